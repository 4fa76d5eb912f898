package dk.trustworks.filebridge.connections;

/**
 * A collection that transferred files are stored under.
 *
 * @param readableId stable, path-safe name used in destination keys
 */
public record DestinationCollection(String id, String readableId, String name) {}
