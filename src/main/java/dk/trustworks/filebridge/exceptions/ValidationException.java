package dk.trustworks.filebridge.exceptions;

/**
 * Malformed browse or transfer request.
 */
public class ValidationException extends FileBridgeException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
