package dk.trustworks.filebridge.graph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Custom exception mapper for Microsoft Graph API REST client.
 * Captures error response details so callers can classify the failure by status.
 */
@JBossLog
public class GraphResponseExceptionMapper implements ResponseExceptionMapper<GraphResponseExceptionMapper.GraphException> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public GraphException toThrowable(Response response) {
        int status = response.getStatus();
        String statusInfo = response.getStatusInfo().getReasonPhrase();
        String responseBody = readResponseBody(response);

        log.errorf("Graph API error - Status: %d %s, Body: %s", status, statusInfo, responseBody);

        return new GraphException(formatErrorMessage(status, statusInfo, responseBody), status);
    }

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    private String readResponseBody(Response response) {
        try {
            if (response.hasEntity()) {
                Object entity = response.getEntity();

                if (entity instanceof InputStream inputStream) {
                    return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
                }

                if (entity instanceof String s) {
                    return s;
                }

                return response.readEntity(String.class);
            }
            return "<no response body>";
        } catch (Exception e) {
            log.warnf(e, "Failed to read Graph API error response body");
            return "<failed to read body: " + e.getMessage() + ">";
        }
    }

    /**
     * Graph errors look like {@code {"error": {"code": "...", "message": "..."}}}.
     */
    static String formatErrorMessage(int status, String statusInfo, String responseBody) {
        if (responseBody != null && responseBody.startsWith("{")) {
            try {
                JsonNode message = MAPPER.readTree(responseBody).path("error").path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return String.format("Graph API error %d: %s", status, message.asText());
                }
            } catch (Exception e) {
                log.debugf("Graph error body is not JSON: %s", e.getMessage());
            }
        }
        return String.format("Graph API error %d %s: %s", status, statusInfo, responseBody);
    }

    /**
     * Exception for any Graph API error response.
     */
    public static class GraphException extends RuntimeException {
        private final int statusCode;

        public GraphException(String message, int statusCode) {
            super(message);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }
}
