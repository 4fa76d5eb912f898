package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.graph.client.GraphApiClient;
import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.GraphPage;
import dk.trustworks.filebridge.graph.dto.Group;
import dk.trustworks.filebridge.graph.dto.Site;
import dk.trustworks.filebridge.graph.dto.SiteCollectionResponse;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.Optional;

import static dk.trustworks.filebridge.source.GraphFailures.call;

/**
 * SharePoint through Microsoft Graph: sites contain document libraries (drives).
 */
@JBossLog
public class SharePointSource extends AbstractGraphSource implements SiteDirectory {

    static final String ROOT_SITE = "root";
    static final String UNIFIED_GROUPS = "groupTypes/any(g:g eq 'Unified')";
    private static final int MAX_GROUP_PAGE = 999;

    public SharePointSource(GraphApiClient graph, GraphFileDownloader downloader, SourceConnection connection) {
        super(graph, downloader, connection);
    }

    @Override
    public SourceProvider provider() {
        return SourceProvider.SHAREPOINT;
    }

    @Override
    public Optional<SiteDirectory> siteDirectory() {
        return Optional.of(this);
    }

    // =========== Sites ===========

    @Override
    public Site getRootSite() {
        return call("get root site", graph::getRootSite);
    }

    @Override
    public Site getSite(String siteId) {
        return call("get site " + siteId, () -> graph.getSite(siteId));
    }

    @Override
    public GraphPage<Site> listSites(String search, int pageSize, String cursor) {
        return call(search != null ? "search sites" : "list sites",
            () -> graph.listSites(search, pageSize, GraphApiClient.SITE_FIELDS, cursor));
    }

    @Override
    public List<Site> listFollowedSites(int pageSize) {
        // Followed sites belong to a user; the app-only token has none of its own.
        if (connection.userId() == null) {
            log.debugf("No user configured for connection %s, skipping followed sites", connection.id());
            return List.of();
        }
        SiteCollectionResponse response = call("list followed sites of user " + connection.userId(),
            () -> graph.listFollowedSites(connection.userId(), pageSize, GraphApiClient.SITE_FIELDS));
        return response.items();
    }

    @Override
    public List<Group> listTeamGroups(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int top = Math.min(limit, MAX_GROUP_PAGE);
        List<Group> groups = call("list team groups",
            () -> graph.listGroups(UNIFIED_GROUPS, top, "id,displayName")).items();
        return groups.size() > limit ? groups.subList(0, limit) : groups;
    }

    @Override
    public Site getGroupSite(String groupId) {
        return call("get site of group " + groupId, () -> graph.getGroupRootSite(groupId));
    }

    // =========== Drives ===========

    @Override
    public List<Drive> listDrives(String siteId) {
        return call("list document libraries of site " + siteId, () -> graph.listSiteDrives(siteId)).items();
    }

    @Override
    public Lineage resolveLineage(String siteId, String driveId) {
        String effectiveSiteId = siteId != null && !siteId.isBlank() ? siteId : ROOT_SITE;
        String siteName;
        try {
            siteName = getSite(effectiveSiteId).label();
        } catch (RuntimeException e) {
            log.warnf("Could not resolve name of site %s, using 'Root Site': %s", effectiveSiteId, e.getMessage());
            siteName = "Root Site";
        }
        String driveName = driveName(driveId, "Selected Files");
        return new Lineage(effectiveSiteId, driveId, List.of(
            new Breadcrumb(effectiveSiteId, siteName, "SharePointSite"),
            new Breadcrumb(driveId, driveName, "SharePointDrive")
        ));
    }
}
