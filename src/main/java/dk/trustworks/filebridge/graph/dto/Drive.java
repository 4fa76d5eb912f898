package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a SharePoint document library or OneDrive.
 * Maps to Microsoft Graph API Drive resource.
 *
 * @see <a href="https://learn.microsoft.com/en-us/graph/api/resources/drive">Drive Resource</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Drive(
    String id,
    String name,
    @JsonProperty("driveType") String driveType,
    @JsonProperty("webUrl") String webUrl
) {
    public String label() {
        return name != null && !name.isBlank() ? name : "Unknown Document Library";
    }
}
