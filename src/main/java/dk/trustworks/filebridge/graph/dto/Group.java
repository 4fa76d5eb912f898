package dk.trustworks.filebridge.graph.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Microsoft 365 (unified) group. Only used to discover team sites.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    String id,
    @JsonProperty("displayName") String displayName
) {}
