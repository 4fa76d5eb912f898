package dk.trustworks.filebridge.transfer.resources;

import dk.trustworks.filebridge.exceptions.FileBridgeException;
import dk.trustworks.filebridge.exceptions.FileBridgeExceptionMapper.ErrorResponse;
import dk.trustworks.filebridge.exceptions.ValidationException;
import dk.trustworks.filebridge.transfer.model.BatchReport;
import dk.trustworks.filebridge.transfer.model.TransferRequest;
import dk.trustworks.filebridge.transfer.service.TransferService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for copying files selected in the file browser into a collection.
 */
@JBossLog
@Tag(name = "Selective Upload", description = "Transfer selected remote files to object storage")
@Path("/file-browser")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
public class TransferResource {

    @Inject
    TransferService transferService;

    @POST
    @Path("/{sourceConnectionId}/upload-selected")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
        summary = "Upload selected files",
        description = "Downloads each selected file and stores it in the collection's S3 destination. "
            + "Per-file failures are reported in the result, they do not fail the request."
    )
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Batch processed, see per-file outcomes"),
        @APIResponse(responseCode = "400", description = "Invalid request or provider not supported"),
        @APIResponse(responseCode = "401", description = "Provider credentials expired"),
        @APIResponse(responseCode = "404", description = "Connection or collection not found"),
        @APIResponse(responseCode = "502", description = "Destination storage not reachable")
    })
    public Response uploadSelected(
            @Parameter(description = "Source connection id")
            @PathParam("sourceConnectionId") String sourceConnectionId,
            TransferRequest request) {

        log.infof("POST /file-browser/%s/upload-selected (%d files)", sourceConnectionId,
            request != null && request.fileIds() != null ? request.fileIds().size() : 0);

        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        try {
            BatchReport report = transferService.transferSelected(sourceConnectionId, request);
            return Response.ok(report).build();
        } catch (FileBridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            log.errorf(e, "Error in upload process");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(new ErrorResponse("Upload process failed: " + e.getMessage(), "INTERNAL_ERROR"))
                .type(MediaType.APPLICATION_JSON)
                .build();
        }
    }
}
