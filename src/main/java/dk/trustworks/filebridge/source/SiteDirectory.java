package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.graph.dto.GraphPage;
import dk.trustworks.filebridge.graph.dto.Group;
import dk.trustworks.filebridge.graph.dto.Site;

import java.util.List;

/**
 * Site-level capabilities of a hierarchical provider. Each method is one independent
 * upstream source and may fail on its own (missing permission, network error).
 */
public interface SiteDirectory {

    Site getRootSite();

    Site getSite(String siteId);

    /**
     * One page of the site listing.
     *
     * @param search search expression ({@code *} for every site), or null for the plain listing
     * @param pageSize requested page size
     * @param cursor continuation cursor, null for the first page
     */
    GraphPage<Site> listSites(String search, int pageSize, String cursor);

    List<Site> listFollowedSites(int pageSize);

    /**
     * The first {@code limit} unified (Microsoft 365) groups of the organization.
     */
    List<Group> listTeamGroups(int limit);

    /**
     * The team site backing a group.
     */
    Site getGroupSite(String groupId);
}
