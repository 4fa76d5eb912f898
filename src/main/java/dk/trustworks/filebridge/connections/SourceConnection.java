package dk.trustworks.filebridge.connections;

/**
 * A configured connection to a provider account.
 *
 * @param id connection id, the organization scope of browse and transfer calls
 * @param provider provider short name as configured (may name an unsupported provider)
 * @param userId user whose drives and followed sites are read; required for OneDrive, optional for
 *               SharePoint where it only enables followed sites
 * @param displayName name shown to users
 */
public record SourceConnection(String id, String provider, String userId, String displayName) {}
