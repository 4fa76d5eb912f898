package dk.trustworks.filebridge.browser.service;

import dk.trustworks.filebridge.browser.model.SiteDiscoveryLimits;
import dk.trustworks.filebridge.exceptions.FileBridgeException;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.graph.dto.GraphPage;
import dk.trustworks.filebridge.graph.dto.GraphPaging;
import dk.trustworks.filebridge.graph.dto.Group;
import dk.trustworks.filebridge.graph.dto.Site;
import dk.trustworks.filebridge.source.SiteDirectory;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects every site a user can reach. No single Graph call returns that, so four
 * independently failing sources are merged:
 * <ol>
 *   <li>the root site,</li>
 *   <li>the site search listing ({@code search=*}, or the plain listing when search is refused),
 *       followed across continuation pages up to the page and result bounds,</li>
 *   <li>the sites the user follows,</li>
 *   <li>the team sites behind the first N unified groups.</li>
 * </ol>
 * Sites are deduplicated by id, first occurrence wins. A failing source is logged and left out;
 * the call only fails when every source failed.
 */
@JBossLog
public class SiteAggregator {

    static final String SEARCH_ALL = "*";

    private final SiteDirectory directory;
    private final SiteDiscoveryLimits limits;

    public SiteAggregator(SiteDirectory directory, SiteDiscoveryLimits limits) {
        this.directory = directory;
        this.limits = limits;
    }

    public List<Site> aggregate() {
        Map<String, Site> sites = new LinkedHashMap<>();
        int succeeded = 0;

        RuntimeException rootFailure = null;
        try {
            merge(sites, List.of(directory.getRootSite()));
            succeeded++;
        } catch (RuntimeException e) {
            log.warnf("Could not fetch root site: %s", e.getMessage());
            rootFailure = e;
        }

        if (collectSearchedSites(sites)) {
            succeeded++;
        }

        try {
            List<Site> followed = directory.listFollowedSites(limits.pageSize());
            log.infof("Found %d followed sites", followed.size());
            merge(sites, followed);
            succeeded++;
        } catch (RuntimeException e) {
            log.debugf("Could not fetch followed sites: %s", e.getMessage());
        }

        if (collectTeamSites(sites)) {
            succeeded++;
        }

        if (succeeded == 0) {
            log.errorf("Every site source failed");
            if (rootFailure instanceof FileBridgeException fbe) {
                throw fbe;
            }
            throw new UpstreamUnavailableException("Could not list sites: every site source failed", rootFailure);
        }

        log.infof("Fetched %d sites (including root) from %d of 4 sources", sites.size(), succeeded);
        return new ArrayList<>(sites.values());
    }

    /**
     * @return true if at least the first page of the listing could be read
     */
    private boolean collectSearchedSites(Map<String, Site> sites) {
        String search = SEARCH_ALL;
        GraphPage<Site> page;
        try {
            page = directory.listSites(search, limits.pageSize(), null);
            log.infof("Found %d sites via search", page.items().size());
        } catch (RuntimeException searchFailure) {
            log.warnf("Sites search failed: %s, trying without search parameter", searchFailure.getMessage());
            search = null;
            try {
                page = directory.listSites(null, limits.pageSize(), null);
                log.infof("Found %d sites without search", page.items().size());
            } catch (RuntimeException e) {
                log.warnf("Could not fetch all sites (may need Sites.Read.All permission): %s", e.getMessage());
                return false;
            }
        }

        int before = sites.size();
        mergeBounded(sites, page.items(), before);
        int pages = 1;
        while (page.hasNext() && pages < limits.searchMaxPages()
                && sites.size() - before < limits.searchMaxResults()) {
            String cursor = GraphPaging.skipToken(page.odataNextLink());
            if (cursor == null) {
                break;
            }
            try {
                page = directory.listSites(search, limits.pageSize(), cursor);
            } catch (RuntimeException e) {
                log.warnf("Site listing stopped after %d pages: %s", pages, e.getMessage());
                break;
            }
            mergeBounded(sites, page.items(), before);
            pages++;
        }
        if (page.hasNext()) {
            log.infof("Site listing truncated after %d pages (%d sites)", pages, sites.size() - before);
        }
        return true;
    }

    private void mergeBounded(Map<String, Site> sites, Collection<Site> found, int before) {
        for (Site site : found) {
            if (sites.size() - before >= limits.searchMaxResults()) {
                return;
            }
            mergeOne(sites, site);
        }
    }

    /**
     * @return true if the group listing could be read, even if no group site resolved
     */
    private boolean collectTeamSites(Map<String, Site> sites) {
        List<Group> groups;
        try {
            groups = directory.listTeamGroups(limits.groupLimit());
            log.infof("Found %d Teams groups", groups.size());
        } catch (RuntimeException e) {
            log.debugf("Could not fetch Teams groups: %s", e.getMessage());
            return false;
        }
        for (Group group : groups) {
            if (group.id() == null) {
                continue;
            }
            try {
                Site site = directory.getGroupSite(group.id());
                if (site != null) {
                    mergeOne(sites, site.asTeamSite(group));
                }
            } catch (RuntimeException e) {
                log.debugf("Could not fetch site for group %s: %s", group.id(), e.getMessage());
            }
        }
        return true;
    }

    private static void merge(Map<String, Site> sites, Collection<Site> found) {
        for (Site site : found) {
            mergeOne(sites, site);
        }
    }

    private static void mergeOne(Map<String, Site> sites, Site site) {
        if (site != null && site.id() != null) {
            sites.putIfAbsent(site.id(), site);
        }
    }
}
