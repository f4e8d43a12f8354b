/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import villagecompute.forumarchive.ArchiveTestFixtures;
import villagecompute.forumarchive.api.types.HealthType;
import villagecompute.forumarchive.services.ArchiveSnapshot;
import villagecompute.forumarchive.services.ArchiveStoreService;

/**
 * Unit tests for {@link HealthResource} readiness reporting with a mocked store.
 */
class HealthResourceLoadingTest {

    @Mock
    ArchiveStoreService archiveStore;

    @InjectMocks
    HealthResource resource;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testReportsLoadingBeforeFirstPublish() {
        when(archiveStore.isReady()).thenReturn(false);

        Response response = resource.health();

        assertEquals(503, response.getStatus());
        HealthType health = (HealthType) response.getEntity();
        assertEquals(HealthType.STATUS_LOADING, health.status());
        assertEquals(0, health.topicsLoaded());
        assertNull(health.loadedAt());
    }

    @Test
    void testReportsPublishedSnapshot() {
        when(archiveStore.isReady()).thenReturn(true);
        when(archiveStore.current()).thenReturn(ArchiveSnapshot.empty(ArchiveTestFixtures.LOADED_AT));

        Response response = resource.health();

        assertEquals(200, response.getStatus());
        HealthType health = (HealthType) response.getEntity();
        assertEquals(HealthType.STATUS_UP, health.status());
        assertEquals(ArchiveTestFixtures.LOADED_AT, health.loadedAt());
    }
}
