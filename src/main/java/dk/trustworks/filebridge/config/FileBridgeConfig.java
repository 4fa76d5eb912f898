package dk.trustworks.filebridge.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for remote browsing and selective transfer.
 *
 * Connections and collections are looked up here by id; nothing is persisted by the service.
 */
@ConfigMapping(prefix = "filebridge")
public interface FileBridgeConfig {

    BrowseConfig browse();

    SitesConfig sites();

    TransferConfig transfer();

    DestinationConfig destination();

    /**
     * Source connections keyed by connection id.
     */
    Map<String, ConnectionConfig> connections();

    /**
     * Destination collections keyed by collection id.
     */
    Map<String, CollectionConfig> collections();

    interface BrowseConfig {
        /**
         * Maximum number of continuation pages followed for one folder listing.
         */
        @WithDefault("50")
        int maxFolderPages();
    }

    interface SitesConfig {
        @WithDefault("100")
        int pageSize();

        @WithDefault("10")
        int searchMaxPages();

        @WithDefault("200")
        int searchMaxResults();

        /**
         * Only the first N unified groups are resolved to their team site.
         */
        @WithDefault("20")
        int groupLimit();
    }

    interface TransferConfig {
        @WithDefault("PT60S")
        Duration downloadTimeout();

        Optional<String> tempDir();
    }

    interface DestinationConfig {
        S3Config s3();
    }

    interface S3Config {
        String bucket();

        /**
         * Key prefix inside the bucket, normally ending with a slash.
         */
        Optional<String> prefix();

        @WithDefault("eu-west-1")
        String region();

        Optional<String> endpointOverride();
    }

    interface ConnectionConfig {
        String provider();

        Optional<String> userId();

        Optional<String> displayName();
    }

    interface CollectionConfig {
        Optional<String> readableId();

        Optional<String> name();
    }
}
