package dk.trustworks.filebridge.graph.client;

import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.DriveCollectionResponse;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import dk.trustworks.filebridge.graph.dto.DriveItemCollectionResponse;
import dk.trustworks.filebridge.graph.dto.GroupCollectionResponse;
import dk.trustworks.filebridge.graph.dto.Site;
import dk.trustworks.filebridge.graph.dto.SiteCollectionResponse;
import io.quarkus.oidc.client.filter.OidcClientFilter;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * MicroProfile REST Client for the read side of Microsoft Graph: sites, groups,
 * drives and drive items.
 *
 * <p>Authentication is handled automatically via the OIDC client filter,
 * which obtains and manages access tokens using client credentials flow.
 * Null query parameters are left out of the request, so paged methods can be
 * called with a null {@code skipToken} for the first page.
 *
 * @see <a href="https://learn.microsoft.com/en-us/graph/api/overview">Microsoft Graph API</a>
 */
@Path("/v1.0")
@RegisterRestClient(configKey = "graph-api")
@OidcClientFilter("graph")
@RegisterProvider(GraphResponseExceptionMapper.class)
@RegisterProvider(GraphApiLoggingFilter.class)
@Produces(MediaType.APPLICATION_JSON)
public interface GraphApiClient {

    String SITE_FIELDS = "id,displayName,webUrl,description,name,siteCollection";

    // =========== Sites ===========

    @GET
    @Path("/sites/root")
    Site getRootSite();

    @GET
    @Path("/sites/{siteId}")
    Site getSite(@PathParam("siteId") String siteId);

    /**
     * Lists sites, optionally filtered by a search expression ({@code *} for all sites).
     * Requires Sites.Read.All.
     *
     * @see <a href="https://learn.microsoft.com/en-us/graph/api/site-search">Search Sites</a>
     */
    @GET
    @Path("/sites")
    SiteCollectionResponse listSites(
        @QueryParam("search") String search,
        @QueryParam("$top") int top,
        @QueryParam("$select") String select,
        @QueryParam("$skiptoken") String skipToken
    );

    @GET
    @Path("/users/{userId}/followedSites")
    SiteCollectionResponse listFollowedSites(
        @PathParam("userId") String userId,
        @QueryParam("$top") int top,
        @QueryParam("$select") String select
    );

    /**
     * Lists groups matching an OData filter, e.g. unified (Microsoft 365) groups.
     *
     * @see <a href="https://learn.microsoft.com/en-us/graph/api/group-list">List Groups</a>
     */
    @GET
    @Path("/groups")
    GroupCollectionResponse listGroups(
        @QueryParam("$filter") String filter,
        @QueryParam("$top") int top,
        @QueryParam("$select") String select
    );

    @GET
    @Path("/groups/{groupId}/sites/root")
    Site getGroupRootSite(@PathParam("groupId") String groupId);

    // =========== Drives ===========

    /**
     * Lists all drives (document libraries) in a SharePoint site.
     *
     * @see <a href="https://learn.microsoft.com/en-us/graph/api/site-list-drives">List Drives</a>
     */
    @GET
    @Path("/sites/{siteId}/drives")
    DriveCollectionResponse listSiteDrives(@PathParam("siteId") String siteId);

    @GET
    @Path("/users/{userId}/drives")
    DriveCollectionResponse listUserDrives(@PathParam("userId") String userId);

    @GET
    @Path("/drives/{driveId}")
    Drive getDrive(@PathParam("driveId") String driveId);

    // =========== Drive items ===========

    /**
     * Lists children of the root folder in a drive.
     *
     * @see <a href="https://learn.microsoft.com/en-us/graph/api/driveitem-list-children">List Children</a>
     */
    @GET
    @Path("/drives/{driveId}/root/children")
    DriveItemCollectionResponse listRootChildren(
        @PathParam("driveId") String driveId,
        @QueryParam("$top") int top,
        @QueryParam("$skiptoken") String skipToken
    );

    @GET
    @Path("/drives/{driveId}/items/{itemId}/children")
    DriveItemCollectionResponse listChildren(
        @PathParam("driveId") String driveId,
        @PathParam("itemId") String itemId,
        @QueryParam("$top") int top,
        @QueryParam("$skiptoken") String skipToken
    );

    /**
     * Retrieves a drive item by id. For files the response carries a short-lived,
     * pre-authenticated {@code @microsoft.graph.downloadUrl}.
     *
     * @see <a href="https://learn.microsoft.com/en-us/graph/api/driveitem-get">Get DriveItem</a>
     */
    @GET
    @Path("/drives/{driveId}/items/{itemId}")
    DriveItem getItem(
        @PathParam("driveId") String driveId,
        @PathParam("itemId") String itemId
    );
}
