package dk.trustworks.filebridge.exceptions;

/**
 * Base type for every failure the browser and the transfer pipeline report to callers.
 * Each subclass carries a stable {@link #getCode() code} used in error responses and
 * per-item transfer outcomes.
 */
public abstract class FileBridgeException extends RuntimeException {

    protected FileBridgeException(String message) {
        super(message);
    }

    protected FileBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
