package dk.trustworks.filebridge.transfer.destination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.filebridge.connections.DestinationCollection;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.source.Breadcrumb;
import dk.trustworks.filebridge.source.FileRecord;
import lombok.extern.jbosslog.JBossLog;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Stores records of one collection in S3:
 * <pre>
 * {prefix}collections/{readableId}/blobs/{recordId}            file content
 * {prefix}collections/{readableId}/entities/{recordId}.json    record metadata
 * </pre>
 */
@JBossLog
public class S3DestinationSink implements DestinationSink {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3;
    private final String bucketName;
    private final String prefix;
    private final DestinationCollection collection;
    private final ObjectMapper objectMapper;

    public S3DestinationSink(S3Client s3, String bucketName, String prefix,
                             DestinationCollection collection, ObjectMapper objectMapper) {
        this.s3 = s3;
        this.bucketName = bucketName;
        this.prefix = normalizePrefix(prefix);
        this.collection = collection;
        this.objectMapper = objectMapper;
    }

    @Override
    public void bulkInsert(List<FileRecord> records) {
        for (FileRecord record : records) {
            insert(record);
        }
    }

    private void insert(FileRecord record) {
        if (record.localPath() == null) {
            throw new IllegalArgumentException("Record " + record.recordId() + " has no downloaded content");
        }
        String blobKey = blobKey(record);
        String entityKey = collectionKey() + "entities/" + record.recordId() + ".json";
        log.infof("Uploading %s to S3: %s", record.name(), blobKey);
        try {
            s3.putObject(
                PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(blobKey)
                    .contentType(record.mimeType() != null ? record.mimeType() : DEFAULT_CONTENT_TYPE)
                    .metadata(Map.of(
                        "source-item-id", record.sourceItemId(),
                        "source-provider", record.provider().getShortName(),
                        "file-name", URLEncoder.encode(record.name(), StandardCharsets.UTF_8)))
                    .build(),
                RequestBody.fromFile(record.localPath()));

            s3.putObject(
                PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(entityKey)
                    .contentType("application/json")
                    .build(),
                RequestBody.fromBytes(objectMapper.writeValueAsBytes(StoredEntity.from(record, blobKey))));
        } catch (S3Exception e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            log.errorf("Failed to upload %s to S3: %s", blobKey, detail);
            throw new UpstreamUnavailableException("S3 upload failed: " + detail, e);
        } catch (SdkException e) {
            log.errorf("Failed to upload %s to S3: %s", blobKey, e.getMessage());
            throw new UpstreamUnavailableException("S3 upload failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize metadata of record " + record.recordId(), e);
        }
        log.infof("Uploaded %s to S3: %s", record.name(), blobKey);
    }

    @Override
    public String destinationPath(FileRecord record) {
        return "s3://" + bucketName + "/" + blobKey(record);
    }

    private String blobKey(FileRecord record) {
        return collectionKey() + "blobs/" + record.recordId();
    }

    private String collectionKey() {
        return prefix + "collections/" + collection.readableId() + "/";
    }

    static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.strip().replaceAll("^/+", "");
        return trimmed.isEmpty() || trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    /**
     * Metadata document written next to each blob. The short-lived download URL is left out.
     */
    record StoredEntity(
        String recordId,
        String sourceItemId,
        String provider,
        String name,
        String mimeType,
        Long size,
        OffsetDateTime createdAt,
        OffsetDateTime modifiedAt,
        String webUrl,
        String siteId,
        String driveId,
        List<Breadcrumb> breadcrumbs,
        String blobKey
    ) {
        static StoredEntity from(FileRecord record, String blobKey) {
            return new StoredEntity(record.recordId(), record.sourceItemId(), record.provider().getShortName(),
                record.name(), record.mimeType(), record.size(), record.createdAt(), record.modifiedAt(),
                record.webUrl(), record.siteId(), record.driveId(), record.breadcrumbs(), blobKey);
        }
    }
}
