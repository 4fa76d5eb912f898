package dk.trustworks.filebridge.transfer.service;

import dk.trustworks.filebridge.exceptions.FileBridgeException;
import dk.trustworks.filebridge.exceptions.ItemSkippedException;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import dk.trustworks.filebridge.graph.dto.DriveItem;
import dk.trustworks.filebridge.source.FileRecord;
import dk.trustworks.filebridge.source.Lineage;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.transfer.destination.DestinationSink;
import dk.trustworks.filebridge.transfer.model.BatchReport;
import dk.trustworks.filebridge.transfer.model.TransferOutcome;
import dk.trustworks.filebridge.transfer.model.TransferRequest;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Copies selected files from a remote source into a destination sink.
 *
 * <p>File ids are processed one at a time, in request order. Each id yields exactly one outcome;
 * whatever goes wrong with one id is recorded on its outcome and the batch moves on.
 * Sequential processing keeps at most one download URL and one sink write in flight per batch.
 */
@JBossLog
public class TransferPipeline {

    static final String UNKNOWN_NAME = "Unknown";
    static final String NOT_A_FILE = "not a file (may be a folder)";
    static final String NO_DOWNLOAD_URL = "could not get download URL";
    static final String NO_FILE_RECORD = "could not create file record";
    static final String DOWNLOAD_FAILED = "download failed";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final RemoteSource source;
    private final DestinationSink sink;

    public TransferPipeline(RemoteSource source, DestinationSink sink) {
        this.source = source;
        this.sink = sink;
    }

    public BatchReport run(TransferRequest request) {
        Lineage lineage = source.resolveLineage(request.siteId(), request.driveId());
        BatchReport.Builder report = BatchReport.builder();

        for (String fileId : request.fileIds()) {
            TransferOutcome outcome = transferOne(fileId, request.driveId(), lineage);
            switch (outcome.status()) {
                case SUCCESS -> log.debugf("Transferred %s (%s) to %s", fileId, outcome.fileName(), outcome.destinationPath());
                case SKIPPED -> log.infof("Skipped %s (%s): %s", fileId, outcome.fileName(), outcome.error());
                case FAILED -> log.warnf("Failed to transfer %s (%s): %s", fileId, outcome.fileName(), outcome.error());
            }
            report.add(outcome);
        }
        return report.build();
    }

    private TransferOutcome transferOne(String fileId, String driveId, Lineage lineage) {
        String fileName = UNKNOWN_NAME;
        Path localPath = null;
        try {
            DriveItem item = source.getItemMetadata(driveId, fileId);
            fileName = item.displayName();

            if (!item.isFile()) {
                throw new ItemSkippedException(NOT_A_FILE);
            }

            Optional<String> downloadUrl = source.getDownloadUrl(driveId, fileId);
            if (downloadUrl.isEmpty()) {
                return TransferOutcome.failed(fileId, fileName, NO_DOWNLOAD_URL, UpstreamUnavailableException.CODE);
            }

            FileRecord record = source.buildFileRecord(item, lineage, downloadUrl.get())
                .orElseThrow(() -> new ItemSkippedException(NO_FILE_RECORD));
            fileName = record.name();

            localPath = source.downloadContent(record).orElse(null);
            if (localPath == null || !Files.exists(localPath)) {
                return TransferOutcome.failed(fileId, fileName, DOWNLOAD_FAILED, UpstreamUnavailableException.CODE);
            }

            FileRecord materialized = record.withLocalPath(localPath);
            sink.bulkInsert(List.of(materialized));
            return TransferOutcome.success(fileId, fileName, sink.destinationPath(materialized));

        } catch (ItemSkippedException e) {
            return TransferOutcome.skipped(fileId, fileName, e.getMessage(), e.getCode());
        } catch (FileBridgeException e) {
            return TransferOutcome.failed(fileId, fileName, e.getMessage(), e.getCode());
        } catch (RuntimeException e) {
            log.errorf(e, "Error uploading file %s", fileId);
            return TransferOutcome.failed(fileId, fileName, messageOf(e), INTERNAL_ERROR);
        } finally {
            deleteLocalCopy(localPath);
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static void deleteLocalCopy(Path localPath) {
        if (localPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(localPath);
        } catch (IOException e) {
            log.warnf("Could not delete downloaded copy %s: %s", localPath, e.getMessage());
        }
    }
}
