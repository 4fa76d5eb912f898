package dk.trustworks.filebridge.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Providers with a hierarchical drive model that can be browsed and transferred from.
 */
public enum SourceProvider {

    /**
     * Organization → site → document library → folder → file.
     */
    SHAREPOINT("sharepoint", true),

    /**
     * Flat drive model: drives belong to the user, there is no site level.
     */
    ONEDRIVE("onedrive", false);

    private final String shortName;
    private final boolean hasSites;

    SourceProvider(String shortName, boolean hasSites) {
        this.shortName = shortName;
        this.hasSites = hasSites;
    }

    public String getShortName() {
        return shortName;
    }

    public boolean hasSites() {
        return hasSites;
    }

    public static Optional<SourceProvider> fromShortName(String shortName) {
        if (shortName == null) {
            return Optional.empty();
        }
        String normalized = shortName.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.shortName.equals(normalized))
                .findFirst();
    }
}
