package dk.trustworks.filebridge.transfer.destination;

import dk.trustworks.filebridge.source.FileRecord;

import java.util.List;

/**
 * Durable storage for transferred files, bound to one collection.
 */
public interface DestinationSink {

    /**
     * Stores the records. Every record must have its content materialized ({@code localPath}).
     *
     * @throws dk.trustworks.filebridge.exceptions.UpstreamUnavailableException on a storage-layer error
     */
    void bulkInsert(List<FileRecord> records);

    /**
     * Human-readable location of a stored record, e.g. {@code s3://bucket/prefix/collections/c/blobs/id}.
     */
    String destinationPath(FileRecord record);
}
