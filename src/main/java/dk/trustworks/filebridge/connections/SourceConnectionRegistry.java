package dk.trustworks.filebridge.connections;

import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.exceptions.NotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Looks up source connections in configuration ({@code filebridge.connections.<id>.*}).
 */
@ApplicationScoped
public class SourceConnectionRegistry {

    @Inject
    FileBridgeConfig config;

    /**
     * @throws NotFoundException if no connection with this id is configured
     */
    public SourceConnection get(String connectionId) {
        FileBridgeConfig.ConnectionConfig connection = connectionId == null
            ? null
            : config.connections().get(connectionId);
        if (connection == null) {
            throw new NotFoundException("Source connection not found: " + connectionId);
        }
        return new SourceConnection(
            connectionId,
            connection.provider(),
            connection.userId().filter(s -> !s.isBlank()).orElse(null),
            connection.displayName().orElse(connectionId)
        );
    }
}
