package dk.trustworks.filebridge.exceptions;

/**
 * Browse or transfer requested for a provider without a hierarchical drive model.
 */
public class UnsupportedProviderException extends FileBridgeException {

    public static final String CODE = "UNSUPPORTED_PROVIDER";

    public UnsupportedProviderException(String message) {
        super(message);
    }

    public UnsupportedProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
