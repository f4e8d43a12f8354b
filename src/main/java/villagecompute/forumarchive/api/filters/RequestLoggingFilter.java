/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.forumarchive.observability.LoggingConfig;
import villagecompute.forumarchive.services.ArchiveStoreService;

/**
 * JAX-RS filter that tags every log line written while serving a request with the request origin and the load time
 * of the archive snapshot being served.
 *
 * <p>
 * MDC fields are cleared in the response filter so worker threads do not carry them into the next request.
 *
 * @see LoggingConfig for field names
 */
@Provider
@Priority(Priorities.USER - 100)
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @Inject
    ArchiveStoreService archiveStore;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.setRequestOrigin(
                requestContext.getMethod() + " /" + requestContext.getUriInfo().getPath().replaceFirst("^/", ""));
        if (archiveStore.isReady()) {
            LoggingConfig.setArchiveLoadedAt(archiveStore.current().getLoadedAt());
        }
        LOG.debug("Request received");
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        LOG.debugf("Request completed with status %d", responseContext.getStatus());
        LoggingConfig.clearMDC();
    }
}
