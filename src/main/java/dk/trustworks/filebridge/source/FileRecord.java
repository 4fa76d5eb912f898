package dk.trustworks.filebridge.source;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Normalized, provider-independent description of one remote file, ready to be handed
 * to a destination sink. {@code localPath} is set once the content has been materialized.
 */
public record FileRecord(
    String recordId,
    String sourceItemId,
    SourceProvider provider,
    String name,
    String mimeType,
    Long size,
    OffsetDateTime createdAt,
    OffsetDateTime modifiedAt,
    String webUrl,
    String downloadUrl,
    String siteId,
    String driveId,
    List<Breadcrumb> breadcrumbs,
    Path localPath
) {
    public FileRecord {
        breadcrumbs = breadcrumbs == null ? List.of() : List.copyOf(breadcrumbs);
    }

    public FileRecord withLocalPath(Path path) {
        return new FileRecord(recordId, sourceItemId, provider, name, mimeType, size, createdAt,
            modifiedAt, webUrl, downloadUrl, siteId, driveId, breadcrumbs, path);
    }
}
