package dk.trustworks.filebridge.exceptions;

/**
 * Transient network or HTTP failure talking to the provider or the destination store.
 */
public class UpstreamUnavailableException extends FileBridgeException {

    public static final String CODE = "UPSTREAM_UNAVAILABLE";

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
