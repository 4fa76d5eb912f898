package dk.trustworks.filebridge.browser.service;

import dk.trustworks.filebridge.browser.model.NavigationContext;
import dk.trustworks.filebridge.browser.model.RemotePage;
import dk.trustworks.filebridge.browser.model.SiteDiscoveryLimits;
import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.connections.SourceConnectionRegistry;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.source.RemoteSourceFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

/**
 * Read-only exploration of a source connection's remote tree, without running a sync.
 */
@JBossLog
@ApplicationScoped
public class FileBrowserService {

    @Inject
    SourceConnectionRegistry connections;

    @Inject
    RemoteSourceFactory sourceFactory;

    @Inject
    FileBridgeConfig config;

    public RemotePage browse(NavigationContext ctx) {
        SourceConnection connection = connections.get(ctx.organizationScope());
        RemoteSource source = sourceFactory.create(connection);

        log.infof("Browsing %s files for connection %s (site=%s, drive=%s, folder=%s)",
            source.provider().getShortName(), connection.id(), ctx.siteId(), ctx.driveId(), ctx.folderId());

        TreeBrowser browser = new TreeBrowser(source,
            SiteDiscoveryLimits.from(config.sites()),
            config.browse().maxFolderPages());
        return browser.browse(ctx);
    }
}
