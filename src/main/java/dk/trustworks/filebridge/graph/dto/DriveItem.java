package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Represents a file or folder in a SharePoint/OneDrive drive.
 * Maps to Microsoft Graph API DriveItem resource.
 *
 * <p>The {@code file} and {@code folder} facets are the type markers: an item is a file
 * when the file facet is present, a folder when the folder facet is present. Items carrying
 * neither (OneNote packages, for instance) are neither.
 *
 * @see <a href="https://learn.microsoft.com/en-us/graph/api/resources/driveitem">DriveItem Resource</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveItem(
    String id,
    String name,
    Long size,
    @JsonProperty("createdDateTime") OffsetDateTime createdDateTime,
    @JsonProperty("lastModifiedDateTime") OffsetDateTime lastModifiedDateTime,
    @JsonProperty("webUrl") String webUrl,
    Folder folder,
    File file,
    @JsonProperty("package") PackageFacet packageFacet,
    @JsonProperty("parentReference") ParentReference parentReference,
    @JsonProperty("@microsoft.graph.downloadUrl") String downloadUrl
) {
    public boolean isFolder() {
        return folder != null;
    }

    public boolean isFile() {
        return file != null;
    }

    public String mimeType() {
        return file != null ? file.mimeType() : null;
    }

    /**
     * Name shown to users when the item has none.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : "Unknown";
    }

    /**
     * Represents folder-specific properties.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Folder(
        @JsonProperty("childCount") Integer childCount
    ) {}

    /**
     * Represents file-specific properties.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record File(
        String mimeType
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackageFacet(
        String type
    ) {}

    /**
     * Represents the parent folder reference.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParentReference(
        String id,
        String driveId,
        @JsonProperty("driveType") String driveType,
        String path,
        String name,
        @JsonProperty("siteId") String siteId
    ) {
        /**
         * True when the parent is the drive root ({@code /drive/root:} or {@code /drives/{id}/root:}).
         */
        public boolean isDriveRoot() {
            return path != null && path.endsWith("root:");
        }
    }
}
