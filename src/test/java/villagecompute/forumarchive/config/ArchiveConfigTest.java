/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import villagecompute.forumarchive.config.ArchiveConfig.ArchiveConfigurationException;

/**
 * Unit tests for {@link ArchiveConfig} validation and path resolution.
 */
class ArchiveConfigTest {

    @Test
    void testValidationSucceedsWithDataPath() {
        ArchiveConfig config = new ArchiveConfig();
        config.dataPath = "/srv/archive";
        config.imagesPath = Optional.empty();

        assertDoesNotThrow(config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithBlankDataPath() {
        ArchiveConfig config = new ArchiveConfig();
        config.dataPath = "  ";
        config.imagesPath = Optional.empty();

        assertThrows(ArchiveConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithNullDataPath() {
        ArchiveConfig config = new ArchiveConfig();
        config.dataPath = null;
        config.imagesPath = Optional.empty();

        assertThrows(ArchiveConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testImagesPathDefaultsUnderDataPath() {
        ArchiveConfig config = new ArchiveConfig();
        config.dataPath = "/srv/archive";
        config.imagesPath = Optional.of(" ");

        assertEquals(Path.of("/srv/archive/images"), config.imagesPath());
    }

    @Test
    void testExplicitImagesPath() {
        ArchiveConfig config = new ArchiveConfig();
        config.dataPath = "/srv/archive";
        config.imagesPath = Optional.of("/srv/images");

        assertEquals(Path.of("/srv/images"), config.imagesPath());
    }
}
