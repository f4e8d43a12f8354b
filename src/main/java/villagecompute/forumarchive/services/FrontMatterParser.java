/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.Arrays;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Splits a topic file into its YAML front-matter block and Markdown body.
 *
 * <p>
 * The file must open with a {@code ---} line; the block ends at the next {@code ---} (or {@code ...}) line. A
 * leading byte-order mark is tolerated. The block must be a YAML mapping.
 */
public class FrontMatterParser {

    private static final String DELIMITER = "---";
    private static final String ALTERNATE_END = "...";

    private final ObjectMapper yamlMapper;

    public FrontMatterParser() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public FrontMatterParser(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    /**
     * @param text
     *            full file content
     * @return the parsed document, or the reason it has no usable front matter
     */
    public ParseResult<Document> parse(String text) {
        String content = text.startsWith("\uFEFF") ? text.substring(1) : text;
        String[] lines = content.split("\\r?\\n", -1);
        if (lines.length == 0 || !lines[0].strip().equals(DELIMITER)) {
            return ParseResult.failure("missing front-matter block (file must start with '---')");
        }

        int end = -1;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.equals(DELIMITER) || line.equals(ALTERNATE_END)) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            return ParseResult.failure("unterminated front-matter block");
        }

        String yaml = String.join("\n", Arrays.asList(lines).subList(1, end));
        JsonNode node;
        try {
            node = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            return ParseResult.failure("front matter is not valid YAML: " + e.getOriginalMessage());
        }
        if (!(node instanceof ObjectNode fields)) {
            return ParseResult.failure("front matter is not a YAML mapping");
        }

        String body = String.join("\n", Arrays.asList(lines).subList(end + 1, lines.length));
        return ParseResult.success(new Document(fields, body.strip()));
    }

    /**
     * Front-matter fields and Markdown body of one file.
     *
     * @param fields
     *            front-matter mapping
     * @param body
     *            Markdown body with surrounding blank lines removed
     */
    public record Document(ObjectNode fields, String body) {
    }
}
