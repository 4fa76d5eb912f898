package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.graph.client.GraphApiClient;
import dk.trustworks.filebridge.graph.dto.Drive;

import java.util.List;
import java.util.Optional;

import static dk.trustworks.filebridge.source.GraphFailures.call;

/**
 * OneDrive through Microsoft Graph. Flat model: the connection's user owns its drives
 * directly, there are no sites. The connection must name its user, since the app-only
 * Graph token has no {@code /me}.
 */
public class OneDriveSource extends AbstractGraphSource {

    public OneDriveSource(GraphApiClient graph, GraphFileDownloader downloader, SourceConnection connection) {
        super(graph, downloader, connection);
    }

    @Override
    public SourceProvider provider() {
        return SourceProvider.ONEDRIVE;
    }

    @Override
    public Optional<SiteDirectory> siteDirectory() {
        return Optional.empty();
    }

    @Override
    public List<Drive> listDrives(String siteId) {
        return call("list drives of user " + connection.userId(),
            () -> graph.listUserDrives(connection.userId())).items();
    }

    @Override
    public Lineage resolveLineage(String siteId, String driveId) {
        return new Lineage(null, driveId, List.of(
            new Breadcrumb(driveId, driveName(driveId, "OneDrive"), "OneDriveDrive")
        ));
    }
}
