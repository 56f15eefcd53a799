package pl.faktulove.ocr.security;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.io.IOException;

/**
 * Resolves the calling owner from the {@code X-Requested-By} header, falling back to the
 * JWT {@code preferred_username} claim.
 */
@JBossLog
@Provider
public class HeaderInterceptor implements ContainerRequestFilter {

    public static final String REQUESTED_BY_HEADER = "X-Requested-By";

    @Inject
    JsonWebToken jwt;

    @Inject
    RequestHeaderHolder requestHeaderHolder;

    @Override
    public void filter(ContainerRequestContext context) throws IOException {
        String owner = context.getHeaders().getFirst(REQUESTED_BY_HEADER);
        if (owner == null || owner.isBlank()) {
            owner = jwt.getClaim("preferred_username");
            if (owner != null) log.debugf("Owner resolved from JWT: %s", owner);
        }
        if (owner == null || owner.isBlank()) {
            owner = RequestHeaderHolder.ANONYMOUS;
            log.debug("Owner not found in request; defaulting to anonymous");
        }
        requestHeaderHolder.setUsername(owner.trim());
    }
}
