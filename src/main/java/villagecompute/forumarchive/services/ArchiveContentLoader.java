/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.jboss.logging.Logger;

import villagecompute.forumarchive.data.models.ArchiveContent;
import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.data.models.ExportInfo;
import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ArchiveLoadException;
import villagecompute.forumarchive.exceptions.MalformedCategoryException;
import villagecompute.forumarchive.exceptions.MalformedExportInfoException;
import villagecompute.forumarchive.exceptions.MalformedTopicException;

/**
 * Reads an exported board archive from disk.
 *
 * <p>
 * <b>Layout:</b>
 *
 * <pre>
 * data-root/
 *   _export.yml                  optional exporter totals
 *   images/                      static assets, never walked
 *   1-general/
 *     _category.yml              category descriptor
 *     100-welcome.md             topic: front matter + Markdown
 *     2-announcements/           sub-category, inherits parent 1
 *       _category.yml
 *       10-hello-world.md
 * </pre>
 *
 * <p>
 * <b>Walk:</b> depth-first, directory entries in lexicographic name order. At each directory the descriptor is read
 * first, then topic files, then subdirectories, which inherit the directory's category as their default parent.
 *
 * <p>
 * <b>Failure policy:</b> the first malformed file aborts the whole load with an {@link ArchiveLoadException} naming
 * it. A wrong index is worse than a failed start, so nothing is skipped silently. After the walk, identity and
 * referential integrity are checked by {@link ArchiveContent#validate()}.
 *
 * <p>
 * Output is deterministic for identical input files. An archive with no categories and no topics is a valid, empty
 * load.
 */
public class ArchiveContentLoader {

    private static final Logger LOG = Logger.getLogger(ArchiveContentLoader.class);

    public static final String EXPORT_DESCRIPTOR = "_export.yml";
    public static final String CATEGORY_DESCRIPTOR = "_category.yml";
    public static final String IMAGES_DIRECTORY = "images";

    private final ArchiveFileParser parser;

    public ArchiveContentLoader() {
        this(new ArchiveFileParser());
    }

    public ArchiveContentLoader(ArchiveFileParser parser) {
        this.parser = parser;
    }

    /**
     * Loads and validates the archive under {@code dataRoot}.
     *
     * @param dataRoot
     *            archive root directory
     * @return validated content in traversal order
     * @throws ArchiveLoadException
     *             (or a subclass) naming the offending file or id
     */
    public ArchiveContent load(Path dataRoot) {
        if (!Files.isDirectory(dataRoot)) {
            throw new ArchiveLoadException("Archive data root is not a directory: " + dataRoot, dataRoot);
        }
        LOG.infof("Loading forum archive from %s", dataRoot.toAbsolutePath());

        ExportInfo exportInfo = readExportInfo(dataRoot);
        List<Category> categories = new ArrayList<>();
        List<Topic> topics = new ArrayList<>();
        walk(dataRoot, null, true, categories, topics);

        ArchiveContent content = new ArchiveContent(exportInfo, categories, topics).validate();
        LOG.infof("Read %d categories and %d topics from %s", categories.size(), topics.size(), dataRoot);
        return content;
    }

    private ExportInfo readExportInfo(Path dataRoot) {
        Path descriptor = dataRoot.resolve(EXPORT_DESCRIPTOR);
        if (!Files.isRegularFile(descriptor)) {
            LOG.debugf("No %s in %s, export totals default to zero", EXPORT_DESCRIPTOR, dataRoot);
            return ExportInfo.EMPTY;
        }
        ParseResult<ExportInfo> result = parser.parseExportInfo(descriptor);
        if (!result.isSuccess()) {
            throw new MalformedExportInfoException(descriptor, result.error(), null);
        }
        return result.value();
    }

    private void walk(Path directory, Long inheritedParentId, boolean isRoot, List<Category> categories,
            List<Topic> topics) {
        Long contextId = inheritedParentId;

        Path descriptor = directory.resolve(CATEGORY_DESCRIPTOR);
        if (Files.isRegularFile(descriptor)) {
            ParseResult<Category> result = parser.parseCategory(descriptor, inheritedParentId);
            if (!result.isSuccess()) {
                throw new MalformedCategoryException(descriptor, result.error());
            }
            Category category = result.value();
            LOG.debugf("Parsed category %d (%s) from %s", category.id(), category.name(), descriptor);
            categories.add(category);
            contextId = category.id();
        }

        List<Path> entries = listSorted(directory);
        for (Path entry : entries) {
            if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            if (!ArchiveFileParser.isTopicFile(entry)) {
                String name = entry.getFileName().toString();
                if (!name.equals(CATEGORY_DESCRIPTOR) && !name.equals(EXPORT_DESCRIPTOR)) {
                    LOG.debugf("Skipping non-topic file %s", entry);
                }
                continue;
            }
            ParseResult<Topic> result = parser.parseTopic(entry);
            if (!result.isSuccess()) {
                throw new MalformedTopicException(entry, result.error());
            }
            topics.add(result.value());
            LOG.debugf("Parsed topic %d from %s", result.value().id(), entry);
        }

        for (Path entry : entries) {
            if (!Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            if (isRoot && entry.getFileName().toString().equals(IMAGES_DIRECTORY)) {
                continue;
            }
            walk(entry, contextId, false, categories, topics);
        }
    }

    private static List<Path> listSorted(Path directory) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException e) {
            throw new ArchiveLoadException("Cannot list archive directory " + directory, directory, e);
        }
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));
        return entries;
    }
}
