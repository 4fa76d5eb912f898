package dk.trustworks.filebridge.connections;

import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.exceptions.NotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Looks up destination collections in configuration ({@code filebridge.collections.<id>.*}).
 */
@ApplicationScoped
public class CollectionRegistry {

    @Inject
    FileBridgeConfig config;

    /**
     * @throws NotFoundException if no collection with this id is configured
     */
    public DestinationCollection get(String collectionId) {
        FileBridgeConfig.CollectionConfig collection = collectionId == null
            ? null
            : config.collections().get(collectionId);
        if (collection == null) {
            throw new NotFoundException("Collection not found: " + collectionId);
        }
        return new DestinationCollection(
            collectionId,
            collection.readableId().filter(s -> !s.isBlank()).orElse(collectionId),
            collection.name().orElse(collectionId)
        );
    }
}
