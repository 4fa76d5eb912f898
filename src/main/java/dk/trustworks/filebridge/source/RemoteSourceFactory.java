package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.exceptions.UnsupportedProviderException;
import dk.trustworks.filebridge.exceptions.ValidationException;
import dk.trustworks.filebridge.graph.client.GraphApiClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.inject.RestClient;

/**
 * Builds the {@link RemoteSource} for a source connection. Either returns a source with every
 * capability of its provider or fails; there is no partially usable source.
 */
@JBossLog
@ApplicationScoped
public class RemoteSourceFactory {

    @Inject
    @RestClient
    GraphApiClient graphClient;

    @Inject
    GraphFileDownloader downloader;

    /**
     * @throws UnsupportedProviderException if the connection's provider has no hierarchical support
     * @throws ValidationException if a OneDrive connection names no user
     */
    public RemoteSource create(SourceConnection connection) {
        SourceProvider provider = SourceProvider.fromShortName(connection.provider())
            .orElseThrow(() -> new UnsupportedProviderException(
                "File browsing and selective upload are only supported for SharePoint and OneDrive. Got: "
                    + connection.provider()));

        if (provider == SourceProvider.ONEDRIVE && (connection.userId() == null || connection.userId().isBlank())) {
            throw new ValidationException("OneDrive connection " + connection.id()
                + " has no user-id. Drives are read per user with app-only Graph credentials.");
        }

        log.debugf("Creating %s source for connection %s", provider.getShortName(), connection.id());
        return switch (provider) {
            case SHAREPOINT -> new SharePointSource(graphClient, downloader, connection);
            case ONEDRIVE -> new OneDriveSource(graphClient, downloader, connection);
        };
    }
}
