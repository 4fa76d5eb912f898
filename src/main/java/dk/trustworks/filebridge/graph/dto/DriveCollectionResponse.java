package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response wrapper for a collection of drives (document libraries).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveCollectionResponse(
    List<Drive> value,
    @JsonProperty("@odata.nextLink") String odataNextLink
) implements GraphPage<Drive> {}
