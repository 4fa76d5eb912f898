package dk.trustworks.filebridge.exceptions;

/**
 * A referenced site, drive, folder, connection or collection does not exist or is not visible.
 */
public class NotFoundException extends FileBridgeException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
