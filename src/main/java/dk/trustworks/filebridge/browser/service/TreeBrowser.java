package dk.trustworks.filebridge.browser.service;

import dk.trustworks.filebridge.browser.model.NavigationContext;
import dk.trustworks.filebridge.browser.model.RemoteNode;
import dk.trustworks.filebridge.browser.model.RemotePage;
import dk.trustworks.filebridge.browser.model.SiteDiscoveryLimits;
import dk.trustworks.filebridge.exceptions.NotFoundException;
import dk.trustworks.filebridge.exceptions.UnsupportedProviderException;
import dk.trustworks.filebridge.exceptions.ValidationException;
import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import dk.trustworks.filebridge.graph.dto.Site;
import dk.trustworks.filebridge.source.PagedIterator;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.source.SiteDirectory;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link NavigationContext} into one {@link RemotePage} of a remote source.
 *
 * <p>Levels, by strict precedence:
 * <ol>
 *   <li>no site: every accessible site as a folder ({@code /sites}); skipped by flat providers,</li>
 *   <li>no drive: the drives of the site ({@code /sites/{siteId}/drives}), or the user's drives
 *       for flat providers ({@code /drives}),</li>
 *   <li>otherwise: files and folders in {@code folderId}, or in the drive root.</li>
 * </ol>
 * Any failure while resolving a level fails the whole call.
 */
@JBossLog
public class TreeBrowser {

    private final RemoteSource source;
    private final SiteDiscoveryLimits siteLimits;
    private final int maxFolderPages;

    public TreeBrowser(RemoteSource source, SiteDiscoveryLimits siteLimits, int maxFolderPages) {
        this.source = source;
        this.siteLimits = siteLimits;
        this.maxFolderPages = maxFolderPages;
    }

    public RemotePage browse(NavigationContext ctx) {
        boolean hierarchical = source.provider().hasSites();

        if (hierarchical && !ctx.hasSite()) {
            if (ctx.hasDrive() || ctx.folderId() != null) {
                log.debugf("No site given, ignoring drive %s / folder %s", ctx.driveId(), ctx.folderId());
            }
            return listSites();
        }
        if (!ctx.hasDrive()) {
            return hierarchical ? listSiteDrives(ctx.siteId()) : listUserDrives();
        }
        return listFolder(ctx, hierarchical ? ctx.siteId() : null);
    }

    // =========== Level 1: sites ===========

    private RemotePage listSites() {
        SiteDirectory directory = source.siteDirectory()
            .orElseThrow(() -> new UnsupportedProviderException(
                source.provider().getShortName() + " has no sites"));

        List<Site> sites = new SiteAggregator(directory, siteLimits).aggregate();
        List<RemoteNode> folders = sites.stream().map(RemoteNode::site).toList();

        log.infof("Returning %d %s sites for browsing", folders.size(), source.provider().getShortName());
        return RemotePage.containers(folders, "/sites", null);
    }

    // =========== Level 2: drives ===========

    private RemotePage listSiteDrives(String siteId) {
        List<Drive> drives = source.listDrives(siteId);
        if (drives.isEmpty()) {
            throw new NotFoundException("No document libraries found in this SharePoint site");
        }
        List<RemoteNode> folders = drives.stream().map(d -> RemoteNode.drive(siteId, d)).toList();

        log.infof("Found %d document libraries in site %s", folders.size(), siteId);
        return RemotePage.containers(folders, "/sites/" + siteId + "/drives", "/sites");
    }

    private RemotePage listUserDrives() {
        List<Drive> drives = source.listDrives(null);
        if (drives.isEmpty()) {
            throw new NotFoundException("No OneDrive found");
        }
        List<RemoteNode> folders = drives.stream().map(d -> RemoteNode.drive(null, d)).toList();

        log.infof("Found %d drives for connection %s", folders.size(), source.connectionId());
        return RemotePage.containers(folders, "/drives", null);
    }

    // =========== Level 3: folder contents ===========

    private RemotePage listFolder(NavigationContext ctx, String siteId) {
        String driveId = ctx.driveId();
        String folderId = ctx.folderId();

        String parentPath = folderId != null
            ? parentOf(driveId, folderId)
            : (siteId != null ? "/sites/" + siteId + "/drives" : "/drives");

        List<RemoteNode> files = new ArrayList<>();
        List<RemoteNode> folders = new ArrayList<>();
        int unclassified = 0;

        PagedIterator<DriveItem> items = source.listFolderItems(driveId, folderId, ctx.pageCursor(), maxFolderPages);
        while (items.hasNext()) {
            DriveItem item = items.next();
            if (item.isFolder()) {
                folders.add(RemoteNode.item(siteId, driveId, item));
            } else if (item.isFile()) {
                files.add(RemoteNode.item(siteId, driveId, item));
            } else {
                unclassified++;
            }
        }

        if (unclassified > 0) {
            log.debugf("Left out %d items that are neither files nor folders", unclassified);
        }
        String nextCursor = items.nextCursor();
        if (nextCursor != null) {
            log.infof("Folder listing cut off after %d pages, returning continuation cursor", items.getPagesRead());
        }
        log.infof("Found %d files and %d folders in drive %s, folder: %s",
            files.size(), folders.size(), driveId, folderId != null ? folderId : "root");

        String currentPath = folderId != null ? RemoteNode.itemPath(driveId, folderId) : "/drives/" + driveId;
        return new RemotePage(files, folders, currentPath, parentPath, nextCursor);
    }

    /**
     * Resolves the folder itself: it must exist and be a folder. Its parent reference gives the
     * way back up.
     */
    private String parentOf(String driveId, String folderId) {
        DriveItem folder = source.getItemMetadata(driveId, folderId);
        if (!folder.isFolder()) {
            throw new ValidationException("Item " + folderId + " is not a folder");
        }
        DriveItem.ParentReference parent = folder.parentReference();
        if (parent == null || parent.id() == null || parent.isDriveRoot()) {
            return "/drives/" + driveId;
        }
        return RemoteNode.itemPath(driveId, parent.id());
    }
}
