package dk.trustworks.filebridge.transfer.service;

import dk.trustworks.filebridge.connections.CollectionRegistry;
import dk.trustworks.filebridge.connections.DestinationCollection;
import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.connections.SourceConnectionRegistry;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.source.RemoteSourceFactory;
import dk.trustworks.filebridge.transfer.destination.DestinationSink;
import dk.trustworks.filebridge.transfer.destination.DestinationSinkFactory;
import dk.trustworks.filebridge.transfer.model.BatchReport;
import dk.trustworks.filebridge.transfer.model.TransferRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

/**
 * One-shot transfer of selected files into a collection, bypassing the sync pipeline.
 *
 * <p>Everything up to opening the source and the destination can fail the whole request.
 * From there on failures are per file and end up in the {@link BatchReport}.
 */
@JBossLog
@ApplicationScoped
public class TransferService {

    @Inject
    SourceConnectionRegistry connections;

    @Inject
    CollectionRegistry collections;

    @Inject
    RemoteSourceFactory sourceFactory;

    @Inject
    DestinationSinkFactory sinkFactory;

    public BatchReport transferSelected(String sourceConnectionId, TransferRequest request) {
        request.validate();

        SourceConnection connection = connections.get(sourceConnectionId);
        RemoteSource source = sourceFactory.create(connection);
        DestinationCollection collection = collections.get(request.collectionId());
        DestinationSink sink = sinkFactory.open(collection);

        log.infof("Transferring %d selected files from %s connection %s (drive=%s, site=%s) to collection %s",
            request.fileIds().size(), source.provider().getShortName(), connection.id(),
            request.driveId(), request.siteId(), collection.readableId());

        BatchReport report = new TransferPipeline(source, sink).run(request);

        log.infof("Transfer finished for connection %s: %d files, %d successful, %d failed, %d skipped",
            connection.id(), report.totalFiles(), report.successful(), report.failed(), report.skipped());
        return report;
    }
}
