package dk.trustworks.filebridge.exceptions;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileBridgeExceptionMapper Tests")
class FileBridgeExceptionMapperTest {

    @Test
    @DisplayName("Should map each error kind to its HTTP status")
    void shouldMapStatuses() {
        assertEquals(Response.Status.NOT_FOUND, FileBridgeExceptionMapper.statusFor(new NotFoundException("x")));
        assertEquals(Response.Status.UNAUTHORIZED, FileBridgeExceptionMapper.statusFor(new AuthExpiredException("x")));
        assertEquals(Response.Status.BAD_REQUEST, FileBridgeExceptionMapper.statusFor(new UnsupportedProviderException("x")));
        assertEquals(Response.Status.BAD_REQUEST, FileBridgeExceptionMapper.statusFor(new ValidationException("x")));
        assertEquals(Response.Status.BAD_GATEWAY, FileBridgeExceptionMapper.statusFor(new UpstreamUnavailableException("x")));
    }

    @Test
    @DisplayName("Should treat a skipped item escaping to the request as a server error")
    void shouldMapSkippedItemToServerError() {
        assertEquals(Response.Status.INTERNAL_SERVER_ERROR,
            FileBridgeExceptionMapper.statusFor(new ItemSkippedException("x")));
    }

    @Test
    @DisplayName("Should carry message and code in the response body")
    void shouldBuildErrorBody() {
        Response response = new FileBridgeExceptionMapper().toResponse(new NotFoundException("Collection not found: c-9"));

        assertEquals(404, response.getStatus());
        FileBridgeExceptionMapper.ErrorResponse body = (FileBridgeExceptionMapper.ErrorResponse) response.getEntity();
        assertEquals("Collection not found: c-9", body.error());
        assertEquals("NOT_FOUND", body.code());
    }
}
