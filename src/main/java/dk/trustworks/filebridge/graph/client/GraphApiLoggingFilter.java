package dk.trustworks.filebridge.graph.client;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import lombok.extern.jbosslog.JBossLog;

/**
 * Logging filter for Microsoft Graph API REST client.
 * The authorization header is never logged, only whether one is present.
 */
@JBossLog
public class GraphApiLoggingFilter implements ClientRequestFilter {

    @Override
    public void filter(ClientRequestContext requestContext) {
        if (!log.isDebugEnabled()) {
            return;
        }
        String authHeader = requestContext.getHeaderString("Authorization");
        String maskedAuth = authHeader != null ? "Bearer ***" : "none";

        log.debugf("Graph API request: %s %s [Auth: %s]",
            requestContext.getMethod(),
            requestContext.getUri(),
            maskedAuth
        );
    }
}
