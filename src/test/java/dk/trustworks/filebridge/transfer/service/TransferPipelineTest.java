package dk.trustworks.filebridge.transfer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.trustworks.filebridge.connections.DestinationCollection;
import dk.trustworks.filebridge.exceptions.AuthExpiredException;
import dk.trustworks.filebridge.exceptions.ItemSkippedException;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import dk.trustworks.filebridge.source.Breadcrumb;
import dk.trustworks.filebridge.source.FileRecord;
import dk.trustworks.filebridge.source.Lineage;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.source.SourceProvider;
import dk.trustworks.filebridge.transfer.destination.DestinationSink;
import dk.trustworks.filebridge.transfer.destination.S3DestinationSink;
import dk.trustworks.filebridge.transfer.model.BatchReport;
import dk.trustworks.filebridge.transfer.model.TransferOutcome;
import dk.trustworks.filebridge.transfer.model.TransferRequest;
import dk.trustworks.filebridge.transfer.model.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static dk.trustworks.filebridge.utils.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransferPipeline: one outcome per requested id, in order, with per-item
 * failure isolation.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransferPipeline Tests")
class TransferPipelineTest {

    private static final String DRIVE = "D1";
    private static final String SITE = "s1";
    private static final Lineage LINEAGE = new Lineage(SITE, DRIVE, List.of(
        new Breadcrumb(SITE, "Sales", "SharePointSite"),
        new Breadcrumb(DRIVE, "Documents", "SharePointDrive")));

    @Mock
    private RemoteSource source;

    @Mock
    private S3Client s3;

    @TempDir
    Path tempDir;

    private DestinationSink sink;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        sink = new S3DestinationSink(s3, "bucket", "", new DestinationCollection("c-1", "documents", "Documents"),
            objectMapper);
        when(source.resolveLineage(SITE, DRIVE)).thenReturn(LINEAGE);
    }

    private static TransferRequest request(String... fileIds) {
        return new TransferRequest(List.of(fileIds), "c-1", DRIVE, SITE);
    }

    private static FileRecord record(DriveItem item, String url) {
        return new FileRecord("rec-" + item.id(), item.id(), SourceProvider.SHAREPOINT, item.name(),
            item.mimeType(), item.size(), item.createdDateTime(), item.lastModifiedDateTime(), item.webUrl(),
            url, SITE, DRIVE, LINEAGE.breadcrumbs(), null);
    }

    /**
     * Stubs the full happy path of one file and returns the local copy the pipeline will receive.
     */
    private Path stubTransferableFile(String id, String name) throws IOException {
        DriveItem item = file(id, name);
        String url = "https://download.example/" + id;
        FileRecord record = record(item, url);
        Path local = Files.writeString(tempDir.resolve(id + ".part"), "content of " + name);

        when(source.getItemMetadata(DRIVE, id)).thenReturn(item);
        when(source.getDownloadUrl(DRIVE, id)).thenReturn(Optional.of(url));
        when(source.buildFileRecord(item, LINEAGE, url)).thenReturn(Optional.of(record));
        when(source.downloadContent(record)).thenReturn(Optional.of(local));
        return local;
    }

    private static void assertCounts(BatchReport report, int successful, int failed, int skipped) {
        assertEquals(successful, report.successful());
        assertEquals(failed, report.failed());
        assertEquals(skipped, report.skipped());
        assertEquals(report.totalFiles(), report.successful() + report.failed() + report.skipped());
        assertEquals(report.totalFiles(), report.outcomes().size());
    }

    @Nested
    @DisplayName("Batch shape")
    class BatchShape {

        @Test
        @DisplayName("Should skip a folder and store a file")
        void shouldSkipFolderAndStoreFile() throws IOException {
            // Given
            when(source.getItemMetadata(DRIVE, "a")).thenReturn(folder("a", "Docs"));
            stubTransferableFile("b", "report.pdf");

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("a", "b"));

            // Then
            assertCounts(report, 1, 0, 1);

            TransferOutcome skipped = report.outcomes().get(0);
            assertEquals("a", skipped.fileId());
            assertEquals("Docs", skipped.fileName());
            assertEquals(TransferStatus.SKIPPED, skipped.status());
            assertEquals("not a file (may be a folder)", skipped.error());
            assertEquals(ItemSkippedException.CODE, skipped.errorCode());

            TransferOutcome stored = report.outcomes().get(1);
            assertEquals("b", stored.fileId());
            assertEquals("report.pdf", stored.fileName());
            assertEquals(TransferStatus.SUCCESS, stored.status());
            assertEquals("s3://bucket/collections/documents/blobs/rec-b", stored.destinationPath());
            assertNull(stored.error());

            verify(source, never()).getDownloadUrl(DRIVE, "a");
            verify(s3, times(2)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        }

        @Test
        @DisplayName("Should report one outcome per id in request order")
        void shouldKeepRequestOrder() throws IOException {
            // Given
            stubTransferableFile("x", "x.txt");
            stubTransferableFile("y", "y.txt");
            stubTransferableFile("z", "z.txt");

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("z", "x", "y"));

            // Then
            assertCounts(report, 3, 0, 0);
            assertEquals(List.of("z", "x", "y"), report.outcomes().stream().map(TransferOutcome::fileId).toList());
        }

        @Test
        @DisplayName("Should resolve lineage once per batch")
        void shouldResolveLineageOnce() throws IOException {
            // Given
            stubTransferableFile("x", "x.txt");
            stubTransferableFile("y", "y.txt");

            // When
            new TransferPipeline(source, sink).run(request("x", "y"));

            // Then
            verify(source, times(1)).resolveLineage(SITE, DRIVE);
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("Should record an expired token on the item and continue with the next")
        void shouldIsolateAuthFailure() throws IOException {
            // Given
            stubTransferableFile("x", "x.txt");
            when(source.getItemMetadata(DRIVE, "y")).thenThrow(new AuthExpiredException("token expired"));
            stubTransferableFile("z", "z.txt");

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x", "y", "z"));

            // Then
            assertCounts(report, 2, 1, 0);
            TransferOutcome failed = report.outcomes().get(1);
            assertEquals(TransferStatus.FAILED, failed.status());
            assertEquals("Unknown", failed.fileName());
            assertEquals("token expired", failed.error());
            assertEquals(AuthExpiredException.CODE, failed.errorCode());
        }

        @Test
        @DisplayName("Should record an expired token during download and continue with the next")
        void shouldIsolateAuthFailureDuringDownload() throws IOException {
            // Given
            DriveItem item = file("x", "x.txt");
            FileRecord record = record(item, "https://download.example/x");
            when(source.getItemMetadata(DRIVE, "x")).thenReturn(item);
            when(source.getDownloadUrl(DRIVE, "x")).thenReturn(Optional.of("https://download.example/x"));
            when(source.buildFileRecord(item, LINEAGE, "https://download.example/x")).thenReturn(Optional.of(record));
            when(source.downloadContent(record)).thenThrow(
                new AuthExpiredException("Authentication failed while trying to download rec-x"));
            stubTransferableFile("y", "y.txt");

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x", "y"));

            // Then
            assertCounts(report, 1, 1, 0);
            TransferOutcome failed = report.outcomes().get(0);
            assertEquals(TransferStatus.FAILED, failed.status());
            assertEquals("x.txt", failed.fileName());
            assertEquals(AuthExpiredException.CODE, failed.errorCode());
            assertEquals(TransferStatus.SUCCESS, report.outcomes().get(1).status());
        }

        @Test
        @DisplayName("Should fail an item without download URL")
        void shouldFailWithoutDownloadUrl() {
            // Given
            when(source.getItemMetadata(DRIVE, "x")).thenReturn(file("x", "x.txt"));
            when(source.getDownloadUrl(DRIVE, "x")).thenReturn(Optional.empty());

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x"));

            // Then
            assertCounts(report, 0, 1, 0);
            assertEquals("could not get download URL", report.outcomes().get(0).error());
            verifyNoInteractions(s3);
        }

        @Test
        @DisplayName("Should skip an item no record can be built for")
        void shouldSkipWithoutRecord() {
            // Given
            DriveItem item = file("x", "x.txt");
            when(source.getItemMetadata(DRIVE, "x")).thenReturn(item);
            when(source.getDownloadUrl(DRIVE, "x")).thenReturn(Optional.of("https://download.example/x"));
            when(source.buildFileRecord(item, LINEAGE, "https://download.example/x")).thenReturn(Optional.empty());

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x"));

            // Then
            assertCounts(report, 0, 0, 1);
            assertEquals("could not create file record", report.outcomes().get(0).error());
        }

        @Test
        @DisplayName("Should fail an item whose content could not be downloaded")
        void shouldFailWhenDownloadIsEmpty() {
            // Given
            DriveItem item = file("x", "x.txt");
            FileRecord record = record(item, "https://download.example/x");
            when(source.getItemMetadata(DRIVE, "x")).thenReturn(item);
            when(source.getDownloadUrl(DRIVE, "x")).thenReturn(Optional.of("https://download.example/x"));
            when(source.buildFileRecord(item, LINEAGE, "https://download.example/x")).thenReturn(Optional.of(record));
            when(source.downloadContent(record)).thenReturn(Optional.empty());

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x"));

            // Then
            assertCounts(report, 0, 1, 0);
            assertEquals("download failed", report.outcomes().get(0).error());
            assertEquals(UpstreamUnavailableException.CODE, report.outcomes().get(0).errorCode());
        }

        @Test
        @DisplayName("Should fail an item the destination rejects and delete its local copy")
        void shouldFailOnSinkError() throws IOException {
            // Given
            Path local = stubTransferableFile("x", "x.txt");
            DestinationSink failingSink = mock(DestinationSink.class);
            doThrow(new UpstreamUnavailableException("S3 upload failed: Access Denied"))
                .when(failingSink).bulkInsert(anyList());

            // When
            BatchReport report = new TransferPipeline(source, failingSink).run(request("x"));

            // Then
            assertCounts(report, 0, 1, 0);
            TransferOutcome failed = report.outcomes().get(0);
            assertEquals("x.txt", failed.fileName());
            assertEquals("S3 upload failed: Access Denied", failed.error());
            assertEquals(UpstreamUnavailableException.CODE, failed.errorCode());
            assertFalse(Files.exists(local));
        }

        @Test
        @DisplayName("Should record unexpected errors as internal errors")
        void shouldRecordUnexpectedError() {
            // Given
            when(source.getItemMetadata(DRIVE, "x")).thenThrow(new IllegalStateException("boom"));

            // When
            BatchReport report = new TransferPipeline(source, sink).run(request("x"));

            // Then
            assertCounts(report, 0, 1, 0);
            assertEquals("boom", report.outcomes().get(0).error());
            assertEquals("INTERNAL_ERROR", report.outcomes().get(0).errorCode());
        }

        @Test
        @DisplayName("Should delete the local copy after a successful upload")
        void shouldDeleteLocalCopyAfterSuccess() throws IOException {
            // Given
            Path local = stubTransferableFile("x", "x.txt");

            // When
            new TransferPipeline(source, sink).run(request("x"));

            // Then
            assertFalse(Files.exists(local));
        }
    }
}
