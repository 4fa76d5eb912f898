package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response wrapper for a collection of sites.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteCollectionResponse(
    List<Site> value,
    @JsonProperty("@odata.nextLink") String odataNextLink
) implements GraphPage<Site> {}
