package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.DriveItem;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An authenticated connection to one provider account. Instances come from
 * {@link RemoteSourceFactory} fully populated; token acquisition and refresh happen below
 * this interface. Failures are reported with the {@code dk.trustworks.filebridge.exceptions}
 * taxonomy.
 */
public interface RemoteSource {

    String connectionId();

    SourceProvider provider();

    /**
     * Site capabilities; present exactly when {@link SourceProvider#hasSites()}.
     */
    Optional<SiteDirectory> siteDirectory();

    /**
     * Lists drives of a site, or the user's drives for flat providers (siteId ignored).
     */
    List<Drive> listDrives(String siteId);

    /**
     * Lazily lists the children of a folder, following continuation cursors.
     *
     * @param folderId the folder item id, or null for the drive root
     * @param cursor continuation cursor to start from, or null
     * @param maxPages page cap of the listing
     */
    PagedIterator<DriveItem> listFolderItems(String driveId, String folderId, String cursor, int maxPages);

    DriveItem getItemMetadata(String driveId, String itemId);

    Optional<String> getDownloadUrl(String driveId, String itemId);

    /**
     * Resolves the breadcrumb chain for records of one batch. Never fails: names that cannot
     * be looked up fall back to placeholders.
     */
    Lineage resolveLineage(String siteId, String driveId);

    /**
     * @return the record, or empty if the item has a shape that cannot be transferred
     */
    Optional<FileRecord> buildFileRecord(DriveItem item, Lineage lineage, String downloadUrl);

    /**
     * Downloads the record's content to a local temporary file.
     *
     * @return the local file, or empty if the record has nothing to download
     */
    Optional<Path> downloadContent(FileRecord record);
}
