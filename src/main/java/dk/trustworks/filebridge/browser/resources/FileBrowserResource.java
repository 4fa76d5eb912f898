package dk.trustworks.filebridge.browser.resources;

import dk.trustworks.filebridge.browser.model.NavigationContext;
import dk.trustworks.filebridge.browser.model.RemotePage;
import dk.trustworks.filebridge.browser.service.FileBrowserService;
import dk.trustworks.filebridge.exceptions.FileBridgeException;
import dk.trustworks.filebridge.exceptions.FileBridgeExceptionMapper.ErrorResponse;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for browsing the folder tree of a SharePoint or OneDrive source connection.
 *
 * <p>Navigation state is the query parameters themselves: pick a site, then a drive, then
 * folders, re-issuing the ids returned on the previous page.
 * <pre>
 * GET /file-browser/{id}/browse                                  → sites
 * GET /file-browser/{id}/browse?site_id=S                        → document libraries
 * GET /file-browser/{id}/browse?site_id=S&amp;drive_id=D             → drive root
 * GET /file-browser/{id}/browse?site_id=S&amp;drive_id=D&amp;folder_id=F → folder
 * </pre>
 */
@JBossLog
@Tag(name = "File Browser", description = "Browse remote files without running a sync")
@Path("/file-browser")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
public class FileBrowserResource {

    @Inject
    FileBrowserService fileBrowserService;

    @GET
    @Path("/{sourceConnectionId}/browse")
    @Operation(
        summary = "Browse files and folders",
        description = "Lists sites, document libraries or folder contents depending on which ids are given"
    )
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page listed successfully"),
        @APIResponse(responseCode = "400", description = "Provider not supported or invalid navigation"),
        @APIResponse(responseCode = "401", description = "Provider credentials expired"),
        @APIResponse(responseCode = "404", description = "Connection, site, drive or folder not found"),
        @APIResponse(responseCode = "502", description = "Provider unavailable")
    })
    public Response browse(
            @Parameter(description = "Source connection id")
            @PathParam("sourceConnectionId") String sourceConnectionId,
            @Parameter(description = "SharePoint site id")
            @QueryParam("site_id") String siteId,
            @Parameter(description = "Drive (document library) id")
            @QueryParam("drive_id") String driveId,
            @Parameter(description = "Folder id, drive root when absent")
            @QueryParam("folder_id") String folderId,
            @Parameter(description = "Continuation cursor of a truncated folder listing")
            @QueryParam("cursor") String cursor) {

        log.infof("GET /file-browser/%s/browse (site=%s, drive=%s, folder=%s)",
            sourceConnectionId, siteId, driveId, folderId);

        try {
            RemotePage page = fileBrowserService.browse(
                new NavigationContext(sourceConnectionId, siteId, driveId, folderId, cursor));
            return Response.ok(page).build();
        } catch (FileBridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            log.errorf(e, "Unexpected error browsing files");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(new ErrorResponse("Failed to browse files: " + e.getMessage(), "INTERNAL_ERROR"))
                .type(MediaType.APPLICATION_JSON)
                .build();
        }
    }
}
