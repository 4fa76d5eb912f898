package dk.trustworks.filebridge.transfer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.filebridge.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Files selected on a browse page, to be copied into a collection.
 *
 * @param fileIds upstream item ids; only unique within {@code driveId} (and {@code siteId})
 * @param siteId SharePoint site of the drive, null for the root site or flat providers
 */
public record TransferRequest(
    @JsonProperty("file_ids") List<String> fileIds,
    @JsonProperty("collection_id") String collectionId,
    @JsonProperty("drive_id") String driveId,
    @JsonProperty("site_id") String siteId
) {
    public TransferRequest {
        fileIds = fileIds == null ? null : Collections.unmodifiableList(new ArrayList<>(fileIds));
    }

    /**
     * @throws ValidationException if a required field is missing or a file id is blank
     */
    public void validate() {
        if (fileIds == null || fileIds.isEmpty()) {
            throw new ValidationException("file_ids must contain at least one file id");
        }
        if (fileIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new ValidationException("file_ids must not contain blank ids");
        }
        if (collectionId == null || collectionId.isBlank()) {
            throw new ValidationException("collection_id is required");
        }
        if (driveId == null || driveId.isBlank()) {
            throw new ValidationException("drive_id is required");
        }
    }
}
