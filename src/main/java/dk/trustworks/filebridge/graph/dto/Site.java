package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a SharePoint site.
 * Maps to Microsoft Graph API Site resource.
 *
 * @see <a href="https://learn.microsoft.com/en-us/graph/api/resources/site">Site Resource</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Site(
    String id,
    String name,
    @JsonProperty("displayName") String displayName,
    String description,
    @JsonProperty("webUrl") String webUrl,
    SiteCollection siteCollection
) {
    /**
     * Name shown to users: display name, then name, then a placeholder.
     */
    public String label() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return "Unknown Site";
    }

    /**
     * Copy of a group's team site, labelled after the group that owns it.
     */
    public Site asTeamSite(Group group) {
        String groupName = group.displayName() != null ? group.displayName() : "";
        return new Site(
            id,
            name != null ? name : "Team Site",
            group.displayName() != null ? group.displayName() : "Team Site",
            "Microsoft Teams: " + groupName,
            webUrl,
            siteCollection
        );
    }

    /**
     * Represents the site collection that contains the site.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SiteCollection(
        String hostname
    ) {}
}
