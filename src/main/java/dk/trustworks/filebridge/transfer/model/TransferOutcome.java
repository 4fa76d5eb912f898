package dk.trustworks.filebridge.transfer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What happened to one requested file id.
 *
 * @param errorCode error taxonomy code of a failed or skipped item, e.g. {@code AUTH_EXPIRED}
 * @param destinationPath where the content was stored, set for successful items only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransferOutcome(
    @JsonProperty("file_id") String fileId,
    @JsonProperty("file_name") String fileName,
    TransferStatus status,
    String error,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("destination_path") String destinationPath
) {
    public static TransferOutcome success(String fileId, String fileName, String destinationPath) {
        return new TransferOutcome(fileId, fileName, TransferStatus.SUCCESS, null, null, destinationPath);
    }

    public static TransferOutcome failed(String fileId, String fileName, String error, String errorCode) {
        return new TransferOutcome(fileId, fileName, TransferStatus.FAILED, error, errorCode, null);
    }

    public static TransferOutcome skipped(String fileId, String fileName, String error, String errorCode) {
        return new TransferOutcome(fileId, fileName, TransferStatus.SKIPPED, error, errorCode, null);
    }
}
