/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.jboss.logging.Logger;

import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.data.models.ExportInfo;
import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.util.TimestampParser;

/**
 * Turns individual archive files into typed entities.
 *
 * <p>
 * Each parse method returns a {@link ParseResult}: a fully populated entity, or the first schema violation found.
 * Required fields are checked here so the loader never sees a half-filled entity.
 *
 * <p>
 * <b>Category descriptor ({@code _category.yml}):</b> required {@code id}, {@code name}; optional {@code slug},
 * {@code parent_cid}, {@code order}, {@code disabled}, {@code icon}, {@code bgColor}, {@code color},
 * {@code postcount}, {@code description}.
 *
 * <p>
 * <b>Topic file ({@code <id>-<slug>.md}):</b> required {@code topic_id}, {@code title}, {@code author_id},
 * {@code category_id}, {@code created}; optional {@code last_post}, {@code view_count}, {@code rating},
 * {@code post_count}, {@code deleted}, {@code locked}, {@code pinned}, {@code tags}.
 */
public class ArchiveFileParser {

    private static final Logger LOG = Logger.getLogger(ArchiveFileParser.class);

    /** Topic file naming convention: numeric id, dash, slug, Markdown extension. */
    public static final Pattern TOPIC_FILE_NAME = Pattern.compile("^(\\d+)-(.+)\\.(md|markdown)$");

    private final ObjectMapper yamlMapper;
    private final FrontMatterParser frontMatterParser;
    private final MarkdownRenderer markdownRenderer;

    public ArchiveFileParser() {
        this(new ObjectMapper(new YAMLFactory()), new MarkdownRenderer());
    }

    public ArchiveFileParser(ObjectMapper yamlMapper, MarkdownRenderer markdownRenderer) {
        this.yamlMapper = yamlMapper;
        this.frontMatterParser = new FrontMatterParser(yamlMapper);
        this.markdownRenderer = markdownRenderer;
    }

    /**
     * @return whether the file name follows the topic naming convention
     */
    public static boolean isTopicFile(Path file) {
        return TOPIC_FILE_NAME.matcher(file.getFileName().toString()).matches();
    }

    /**
     * Parses a category descriptor.
     *
     * @param descriptor
     *            the {@code _category.yml} file
     * @param inheritedParentId
     *            id of the category owning the enclosing directory, {@code null} at top level
     * @return the category or the reason it was rejected
     */
    public ParseResult<Category> parseCategory(Path descriptor, Long inheritedParentId) {
        ObjectNode node;
        try {
            JsonNode tree = yamlMapper.readTree(descriptor.toFile());
            if (!(tree instanceof ObjectNode objectNode)) {
                return ParseResult.failure("descriptor is not a YAML mapping");
            }
            node = objectNode;
        } catch (IOException e) {
            return ParseResult.failure("cannot read descriptor: " + e.getMessage());
        }

        try {
            Fields fields = new Fields(node);
            long id = fields.requiredPositiveLong("id");
            String name = fields.requiredText("name");
            String slug = fields.optionalText("slug").orElseGet(() -> directoryName(descriptor));

            Long parentId = inheritedParentId;
            long explicitParent = fields.optionalLong("parent_cid", 0L);
            if (explicitParent != 0L) {
                if (inheritedParentId != null && explicitParent != inheritedParentId) {
                    LOG.warnf("Category %d declares parent_cid=%d but sits under category %d (%s); using parent_cid",
                            id, explicitParent, inheritedParentId, descriptor);
                }
                parentId = explicitParent;
            }

            return ParseResult.success(new Category(id, name, slug, parentId, (int) fields.optionalLong("order", 0L),
                    fields.optionalBoolean("disabled"), fields.optionalText("icon").orElse(null),
                    fields.optionalText("bgColor").orElse(null), fields.optionalText("color").orElse(null),
                    (int) fields.optionalLong("postcount", 0L), fields.optionalText("description").orElse(null),
                    descriptor));
        } catch (FieldException e) {
            return ParseResult.failure(e.getMessage());
        }
    }

    /**
     * Parses a topic file and renders its body.
     *
     * @param file
     *            a file accepted by {@link #isTopicFile(Path)}
     * @return the topic or the reason it was rejected
     */
    public ParseResult<Topic> parseTopic(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return ParseResult.failure("cannot read file: " + e.getMessage());
        }

        ParseResult<FrontMatterParser.Document> document = frontMatterParser.parse(text);
        if (!document.isSuccess()) {
            return ParseResult.failure(document.error());
        }

        try {
            Fields fields = new Fields(document.value().fields());
            long id = fields.requiredPositiveLong("topic_id");
            String title = fields.requiredText("title");
            long authorId = fields.requiredLong("author_id");
            long categoryId = fields.requiredPositiveLong("category_id");
            Instant created = fields.requiredTimestamp("created");
            Instant lastPost = fields.optionalTimestamp("last_post").orElse(null);

            String fileName = file.getFileName().toString();
            Matcher matcher = TOPIC_FILE_NAME.matcher(fileName);
            String slug = fileName.substring(0, fileName.lastIndexOf('.'));
            if (matcher.matches() && !matcher.group(1).equals(Long.toString(id))) {
                LOG.warnf("Topic file %s declares topic_id=%d; the front matter wins", file, id);
            }

            String body = document.value().body();
            return ParseResult.success(new Topic(id, title, slug, authorId, categoryId, created, lastPost,
                    fields.optionalLong("view_count", 0L), fields.optionalLong("rating", 0L),
                    (int) fields.optionalLong("post_count", 0L), fields.optionalBoolean("deleted"),
                    fields.optionalBoolean("locked"), fields.optionalBoolean("pinned"), fields.textList("tags"), body,
                    markdownRenderer.render(body), file));
        } catch (FieldException e) {
            return ParseResult.failure(e.getMessage());
        }
    }

    /**
     * Parses the exporter descriptor ({@code _export.yml}). Totals live under an {@code export_info} mapping; missing
     * totals default to zero.
     */
    public ParseResult<ExportInfo> parseExportInfo(Path file) {
        JsonNode tree;
        try {
            tree = yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            return ParseResult.failure("cannot read descriptor: " + e.getMessage());
        }
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return ParseResult.success(ExportInfo.EMPTY);
        }
        if (!(tree instanceof ObjectNode root)) {
            return ParseResult.failure("descriptor is not a YAML mapping");
        }
        JsonNode info = root.path("export_info");
        if (info.isMissingNode() || info.isNull()) {
            return ParseResult.success(ExportInfo.EMPTY);
        }
        if (!(info instanceof ObjectNode infoNode)) {
            return ParseResult.failure("export_info is not a mapping");
        }

        try {
            Fields fields = new Fields(infoNode);
            return ParseResult.success(new ExportInfo(fields.optionalLong("total_users", 0L),
                    fields.optionalLong("total_categories", 0L), fields.optionalLong("total_topics", 0L),
                    fields.optionalLong("total_posts", 0L)));
        } catch (FieldException e) {
            return ParseResult.failure(e.getMessage());
        }
    }

    private static String directoryName(Path descriptor) {
        Path parent = descriptor.toAbsolutePath().getParent();
        return parent == null || parent.getFileName() == null ? "" : parent.getFileName().toString();
    }

    /**
     * Typed, strict access to a YAML mapping. Every violation raises {@link FieldException} naming the field.
     */
    private static final class Fields {

        private final ObjectNode node;

        Fields(ObjectNode node) {
            this.node = node;
        }

        long requiredLong(String name) {
            JsonNode value = present(name).orElseThrow(() -> new FieldException("missing required field '" + name + "'"));
            return toLong(name, value);
        }

        long requiredPositiveLong(String name) {
            long value = requiredLong(name);
            if (value <= 0) {
                throw new FieldException("field '" + name + "' must be a positive integer, got " + value);
            }
            return value;
        }

        long optionalLong(String name, long defaultValue) {
            return present(name).map(value -> toLong(name, value)).orElse(defaultValue);
        }

        String requiredText(String name) {
            return optionalText(name).orElseThrow(() -> new FieldException("missing required field '" + name + "'"));
        }

        Optional<String> optionalText(String name) {
            return present(name).map(value -> {
                if (!value.isValueNode()) {
                    throw new FieldException("field '" + name + "' must be a scalar");
                }
                return value.asText().strip();
            }).filter(text -> !text.isEmpty());
        }

        boolean optionalBoolean(String name) {
            return present(name).map(value -> {
                if (value.isBoolean()) {
                    return value.booleanValue();
                }
                if (value.isIntegralNumber()) {
                    return value.longValue() != 0;
                }
                String text = value.asText().strip().toLowerCase(Locale.ROOT);
                if (text.equals("true") || text.equals("yes")) {
                    return true;
                }
                if (text.equals("false") || text.equals("no")) {
                    return false;
                }
                throw new FieldException("field '" + name + "' must be a boolean, got '" + value.asText() + "'");
            }).orElse(false);
        }

        Instant requiredTimestamp(String name) {
            JsonNode value = present(name).orElseThrow(() -> new FieldException("missing required field '" + name + "'"));
            return toInstant(name, value);
        }

        Optional<Instant> optionalTimestamp(String name) {
            return present(name).map(value -> toInstant(name, value));
        }

        List<String> textList(String name) {
            Optional<JsonNode> value = present(name);
            if (value.isEmpty()) {
                return List.of();
            }
            List<String> items = new ArrayList<>();
            if (value.get().isArray()) {
                for (JsonNode item : value.get()) {
                    if (!item.isValueNode()) {
                        throw new FieldException("field '" + name + "' must be a list of scalars");
                    }
                    items.add(item.asText().strip());
                }
            } else if (value.get().isValueNode()) {
                items.add(value.get().asText().strip());
            } else {
                throw new FieldException("field '" + name + "' must be a list");
            }
            items.removeIf(String::isEmpty);
            return items;
        }

        private Optional<JsonNode> present(String name) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull() || value.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(value);
        }

        private static long toLong(String name, JsonNode value) {
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return value.longValue();
            }
            if (value.isTextual()) {
                String text = value.textValue().strip();
                if (!text.isEmpty() && text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
                    return Long.parseLong(text);
                }
            }
            throw new FieldException("field '" + name + "' must be an integer, got '" + value.asText() + "'");
        }

        private static Instant toInstant(String name, JsonNode value) {
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return TimestampParser.fromEpochMillis(value.longValue());
            }
            if (value.isTextual()) {
                Optional<Instant> parsed = TimestampParser.parse(value.textValue());
                if (parsed.isPresent()) {
                    return parsed.get();
                }
            }
            throw new FieldException("field '" + name + "' is not a valid timestamp: '" + value.asText() + "'");
        }
    }

    /**
     * Schema violation inside one file. Never escapes this class; converted to a failed {@link ParseResult}.
     */
    private static final class FieldException extends RuntimeException {

        FieldException(String message) {
            super(message);
        }
    }
}
