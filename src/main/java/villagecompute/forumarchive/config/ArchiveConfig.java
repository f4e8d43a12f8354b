/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.config;

import java.nio.file.Path;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Location of the exported archive on disk.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code archive.data-path} - archive root holding category directories (env {@code ARCHIVE_DATA_PATH})</li>
 * <li>{@code archive.images-path} - static images served under {@code /api/v1/images} (env
 * {@code ARCHIVE_IMAGES_PATH}, default {@code <data-path>/images})</li>
 * </ul>
 *
 * <p>
 * These two paths are the only environment the archive store depends on.
 */
@ApplicationScoped
public class ArchiveConfig {

    private static final Logger LOG = Logger.getLogger(ArchiveConfig.class);

    @ConfigProperty(
            name = "archive.data-path")
    String dataPath;

    @ConfigProperty(
            name = "archive.images-path")
    Optional<String> imagesPath;

    /**
     * Fails startup when the data path is not configured.
     *
     * @throws ArchiveConfigurationException
     *             if {@code archive.data-path} is blank
     */
    @PostConstruct
    public void validateConfiguration() {
        if (dataPath == null || dataPath.isBlank()) {
            String errorMessage = "archive.data-path is not configured. "
                    + "Set ARCHIVE_DATA_PATH to the directory containing the exported forum archive.";
            LOG.fatal(errorMessage);
            throw new ArchiveConfigurationException(errorMessage);
        }
        LOG.infof("Archive configured: data=%s, images=%s", dataPath(), imagesPath());
    }

    public Path dataPath() {
        return Path.of(dataPath.strip());
    }

    public Path imagesPath() {
        return imagesPath.filter(path -> !path.isBlank()).map(path -> Path.of(path.strip()))
                .orElseGet(() -> dataPath().resolve("images"));
    }

    /**
     * Exception thrown when archive configuration is invalid or incomplete.
     */
    public static class ArchiveConfigurationException extends RuntimeException {

        public ArchiveConfigurationException(String message) {
            super(message);
        }
    }
}
