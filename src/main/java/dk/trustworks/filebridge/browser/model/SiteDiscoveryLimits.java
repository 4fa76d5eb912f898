package dk.trustworks.filebridge.browser.model;

import dk.trustworks.filebridge.config.FileBridgeConfig;

/**
 * Safety bounds for site discovery. They bound the number of upstream calls, they do not
 * decide which sites are correct to show.
 */
public record SiteDiscoveryLimits(int pageSize, int searchMaxPages, int searchMaxResults, int groupLimit) {

    public static SiteDiscoveryLimits from(FileBridgeConfig.SitesConfig config) {
        return new SiteDiscoveryLimits(config.pageSize(), config.searchMaxPages(),
            config.searchMaxResults(), config.groupLimit());
    }
}
