package dk.trustworks.filebridge.exceptions;

/**
 * The provider rejected the stored credential (HTTP 401). Kept distinct from
 * {@link UpstreamUnavailableException} so the caller can ask for re-authorization.
 */
public class AuthExpiredException extends FileBridgeException {

    public static final String CODE = "AUTH_EXPIRED";

    public AuthExpiredException(String message) {
        super(message);
    }

    public AuthExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
