package dk.trustworks.filebridge.exceptions;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@Provider
public class FileBridgeExceptionMapper implements ExceptionMapper<FileBridgeException> {

    @Override
    public Response toResponse(FileBridgeException exception) {
        Response.Status status = statusFor(exception);
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            log.errorf(exception, "Request failed: %s", exception.getMessage());
        } else {
            log.infof("Request rejected (%s): %s", exception.getCode(), exception.getMessage());
        }
        return Response.status(status)
                .entity(new ErrorResponse(exception.getMessage(), exception.getCode()))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }

    static Response.Status statusFor(FileBridgeException exception) {
        if (exception instanceof NotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (exception instanceof AuthExpiredException) {
            return Response.Status.UNAUTHORIZED;
        }
        if (exception instanceof UnsupportedProviderException || exception instanceof ValidationException) {
            return Response.Status.BAD_REQUEST;
        }
        if (exception instanceof UpstreamUnavailableException) {
            return Response.Status.BAD_GATEWAY;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    /**
     * Standard error response DTO.
     */
    public record ErrorResponse(String error, String code) {}
}
