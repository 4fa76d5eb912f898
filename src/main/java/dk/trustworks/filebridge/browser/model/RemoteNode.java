package dk.trustworks.filebridge.browser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.filebridge.graph.dto.Drive;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import dk.trustworks.filebridge.graph.dto.Site;

import java.time.OffsetDateTime;

/**
 * One browse entry. {@code path} can be used to navigate back to the entry; the ids needed for
 * the next call ({@code driveId}, {@code siteId}) are carried explicitly so nobody has to parse it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RemoteNode(
    String id,
    String name,
    @JsonIgnore NodeKind kind,
    String path,
    @JsonProperty("site_id") String siteId,
    @JsonProperty("drive_id") String driveId,
    Long size,
    @JsonProperty("modified_at") OffsetDateTime modifiedAt,
    @JsonProperty("mime_type") String mimeType
) {
    @JsonProperty("type")
    public String type() {
        return kind == NodeKind.FILE ? "file" : "folder";
    }

    @JsonProperty("container")
    public String container() {
        return kind == NodeKind.SITE || kind == NodeKind.DRIVE ? kind.name().toLowerCase() : null;
    }

    public static RemoteNode site(Site site) {
        return new RemoteNode(site.id(), site.label(), NodeKind.SITE, "/sites/" + site.id(),
            site.id(), null, null, null, null);
    }

    public static RemoteNode drive(String siteId, Drive drive) {
        String path = siteId != null
            ? "/sites/" + siteId + "/drives/" + drive.id()
            : "/drives/" + drive.id();
        return new RemoteNode(drive.id(), drive.label(), NodeKind.DRIVE, path,
            siteId, drive.id(), null, null, null);
    }

    /**
     * @throws IllegalArgumentException if the item is neither file nor folder
     */
    public static RemoteNode item(String siteId, String driveId, DriveItem item) {
        String path = itemPath(driveId, item.id());
        if (item.isFolder()) {
            return new RemoteNode(item.id(), item.displayName(), NodeKind.FOLDER, path,
                siteId, driveId, null, item.lastModifiedDateTime(), null);
        }
        if (item.isFile()) {
            return new RemoteNode(item.id(), item.displayName(), NodeKind.FILE, path,
                siteId, driveId, item.size(), item.lastModifiedDateTime(), item.mimeType());
        }
        throw new IllegalArgumentException("Item " + item.id() + " is neither a file nor a folder");
    }

    public static String itemPath(String driveId, String itemId) {
        return "/drives/" + driveId + "/items/" + itemId;
    }
}
