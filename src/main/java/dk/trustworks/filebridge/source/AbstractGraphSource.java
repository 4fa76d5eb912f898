package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.graph.client.GraphApiClient;
import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import lombok.extern.jbosslog.JBossLog;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

import static dk.trustworks.filebridge.source.GraphFailures.call;

/**
 * Drive-level operations shared by every Microsoft Graph provider. Subclasses add the
 * provider's drive listing, site capabilities and lineage.
 */
@JBossLog
abstract class AbstractGraphSource implements RemoteSource {

    static final int CHILDREN_PAGE_SIZE = 200;

    protected final GraphApiClient graph;
    protected final GraphFileDownloader downloader;
    protected final SourceConnection connection;

    protected AbstractGraphSource(GraphApiClient graph, GraphFileDownloader downloader, SourceConnection connection) {
        this.graph = graph;
        this.downloader = downloader;
        this.connection = connection;
    }

    @Override
    public String connectionId() {
        return connection.id();
    }

    @Override
    public PagedIterator<DriveItem> listFolderItems(String driveId, String folderId, String cursor, int maxPages) {
        log.debugf("Listing items in drive %s, folder: %s", driveId, folderId != null ? folderId : "root");
        return new PagedIterator<>(skipToken -> folderId == null
            ? call("list root of drive " + driveId,
                () -> graph.listRootChildren(driveId, CHILDREN_PAGE_SIZE, skipToken))
            : call("list folder " + folderId + " in drive " + driveId,
                () -> graph.listChildren(driveId, folderId, CHILDREN_PAGE_SIZE, skipToken)),
            cursor, maxPages);
    }

    @Override
    public DriveItem getItemMetadata(String driveId, String itemId) {
        return call("get item " + itemId + " in drive " + driveId, () -> graph.getItem(driveId, itemId));
    }

    /**
     * Graph includes a short-lived, pre-authenticated download URL in the item resource of a file.
     */
    @Override
    public Optional<String> getDownloadUrl(String driveId, String itemId) {
        DriveItem item = getItemMetadata(driveId, itemId);
        return Optional.ofNullable(item.downloadUrl()).filter(url -> !url.isBlank());
    }

    @Override
    public Optional<FileRecord> buildFileRecord(DriveItem item, Lineage lineage, String downloadUrl) {
        if (!item.isFile() || item.packageFacet() != null) {
            log.debugf("Item %s is not a plain file, no record built", item.id());
            return Optional.empty();
        }
        if (item.id() == null || item.name() == null || item.name().isBlank()) {
            log.debugf("Item %s has no id or name, no record built", item.id());
            return Optional.empty();
        }
        return Optional.of(new FileRecord(
            recordId(lineage.driveId(), item.id()),
            item.id(),
            provider(),
            item.name(),
            item.mimeType(),
            item.size(),
            item.createdDateTime(),
            item.lastModifiedDateTime(),
            item.webUrl(),
            downloadUrl,
            lineage.siteId(),
            lineage.driveId(),
            lineage.breadcrumbs(),
            null
        ));
    }

    @Override
    public Optional<Path> downloadContent(FileRecord record) {
        if (record.downloadUrl() == null || record.downloadUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(downloader.download(record.downloadUrl(), record.recordId()));
    }

    /**
     * Stable record id: the same item in the same drive always maps to the same id.
     */
    protected String recordId(String driveId, String itemId) {
        String key = provider().getShortName() + ":" + driveId + ":" + itemId;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Drive name for breadcrumbs, or the fallback when the lookup fails.
     */
    protected String driveName(String driveId, String fallback) {
        try {
            Drive drive = call("get drive " + driveId, () -> graph.getDrive(driveId));
            return drive.name() != null && !drive.name().isBlank() ? drive.name() : fallback;
        } catch (RuntimeException e) {
            log.warnf("Could not resolve name of drive %s, using '%s': %s", driveId, fallback, e.getMessage());
            return fallback;
        }
    }
}
