package dk.trustworks.filebridge.transfer.destination;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.connections.DestinationCollection;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.source.FileRecord;
import dk.trustworks.filebridge.source.SourceProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DestinationSinkFactory Tests")
class DestinationSinkFactoryTest {

    private static final DestinationCollection COLLECTION = new DestinationCollection("c-1", "documents", "Documents");

    @Mock
    private FileBridgeConfig.S3Config s3Config;

    @Mock
    private S3Client s3;

    @Test
    @DisplayName("Should open a sink on the configured bucket and prefix")
    void shouldOpenSink() {
        // Given
        when(s3Config.bucket()).thenReturn("bucket");
        when(s3Config.prefix()).thenReturn(Optional.of("tenant-a/"));
        DestinationSinkFactory factory = new DestinationSinkFactory(s3Config, new ObjectMapper(), s3);

        // When
        DestinationSink sink = factory.open(COLLECTION);

        // Then
        FileRecord record = new FileRecord("rec-1", "item-1", SourceProvider.ONEDRIVE, "a.txt", null, null,
            null, null, null, null, null, "OD1", List.of(), null);
        assertEquals("s3://bucket/tenant-a/collections/documents/blobs/rec-1", sink.destinationPath(record));
        verify(s3).headBucket(any(HeadBucketRequest.class));
    }

    @Test
    @DisplayName("Should fail when the bucket cannot be reached")
    void shouldFailOnUnreachableBucket() {
        // Given
        when(s3Config.bucket()).thenReturn("missing");
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(NoSuchBucketException.builder().message("no bucket").build());
        DestinationSinkFactory factory = new DestinationSinkFactory(s3Config, new ObjectMapper(), s3);

        // When / Then
        assertThrows(UpstreamUnavailableException.class, () -> factory.open(COLLECTION));
    }
}
