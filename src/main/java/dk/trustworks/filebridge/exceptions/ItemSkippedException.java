package dk.trustworks.filebridge.exceptions;

/**
 * Nothing to do for a single transfer item. Never escapes the transfer pipeline.
 */
public class ItemSkippedException extends FileBridgeException {

    public static final String CODE = "ITEM_SKIPPED";

    public ItemSkippedException(String message) {
        super(message);
    }

    public ItemSkippedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
