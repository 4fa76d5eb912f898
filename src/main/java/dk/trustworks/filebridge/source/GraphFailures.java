package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.exceptions.AuthExpiredException;
import dk.trustworks.filebridge.exceptions.FileBridgeException;
import dk.trustworks.filebridge.exceptions.NotFoundException;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.graph.client.GraphResponseExceptionMapper.GraphException;
import jakarta.ws.rs.WebApplicationException;

import java.util.function.Supplier;

/**
 * Translates Graph client failures into the service's error taxonomy.
 */
final class GraphFailures {

    private GraphFailures() {
    }

    /**
     * Runs one Graph call, rethrowing any failure as a {@link FileBridgeException}.
     *
     * @param what short description of the call, used in messages (e.g. "list drives of site X")
     */
    static <T> T call(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw translate(what, e);
        }
    }

    static FileBridgeException translate(String what, RuntimeException e) {
        if (e instanceof FileBridgeException fbe) {
            return fbe;
        }
        GraphException graph = findGraphException(e);
        if (graph != null) {
            return fromStatus(what, graph.getStatusCode(), graph.getMessage(), e);
        }
        if (e instanceof WebApplicationException wae && wae.getResponse() != null) {
            return fromStatus(what, wae.getResponse().getStatus(), wae.getMessage(), e);
        }
        // ProcessingException (connect/read timeouts, I/O) and anything unexpected
        return new UpstreamUnavailableException("Could not " + what + ": " + e.getMessage(), e);
    }

    static FileBridgeException fromStatus(String what, int status, String message, Throwable cause) {
        if (status == 401) {
            return new AuthExpiredException(
                "Authentication failed while trying to " + what + ". The access token has expired; "
                    + "reconnect the account. (" + message + ")", cause);
        }
        if (status == 403 || status == 404) {
            return new NotFoundException("Could not " + what + ": " + message, cause);
        }
        return new UpstreamUnavailableException("Could not " + what + ": " + message, cause);
    }

    private static GraphException findGraphException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof GraphException graph) {
                return graph;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
