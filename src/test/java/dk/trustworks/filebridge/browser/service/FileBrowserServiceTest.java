package dk.trustworks.filebridge.browser.service;

import dk.trustworks.filebridge.browser.model.NavigationContext;
import dk.trustworks.filebridge.browser.model.RemotePage;
import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.connections.SourceConnection;
import dk.trustworks.filebridge.connections.SourceConnectionRegistry;
import dk.trustworks.filebridge.exceptions.NotFoundException;
import dk.trustworks.filebridge.exceptions.UnsupportedProviderException;
import dk.trustworks.filebridge.source.RemoteSource;
import dk.trustworks.filebridge.source.RemoteSourceFactory;
import dk.trustworks.filebridge.source.SourceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static dk.trustworks.filebridge.utils.GraphFixtures.drive;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FileBrowserService Tests")
class FileBrowserServiceTest {

    @Mock
    private SourceConnectionRegistry connections;

    @Mock
    private RemoteSourceFactory sourceFactory;

    @Mock
    private FileBridgeConfig config;

    @Mock
    private FileBridgeConfig.SitesConfig sitesConfig;

    @Mock
    private FileBridgeConfig.BrowseConfig browseConfig;

    @Mock
    private RemoteSource source;

    private FileBrowserService service;

    @BeforeEach
    void setUp() {
        service = new FileBrowserService();
        service.connections = connections;
        service.sourceFactory = sourceFactory;
        service.config = config;
    }

    @Test
    @DisplayName("Should browse the source of the given connection")
    void shouldBrowseConnectionSource() {
        // Given
        SourceConnection connection = new SourceConnection("od", "onedrive", "user-1", "OneDrive");
        when(connections.get("od")).thenReturn(connection);
        when(sourceFactory.create(connection)).thenReturn(source);
        when(config.sites()).thenReturn(sitesConfig);
        when(config.browse()).thenReturn(browseConfig);
        when(browseConfig.maxFolderPages()).thenReturn(50);
        when(source.provider()).thenReturn(SourceProvider.ONEDRIVE);
        when(source.listDrives(null)).thenReturn(List.of(drive("OD1", "OneDrive")));

        // When
        RemotePage page = service.browse(NavigationContext.root("od"));

        // Then
        assertEquals("/drives", page.currentPath());
        assertEquals(1, page.folders().size());
    }

    @Test
    @DisplayName("Should fail for an unknown connection")
    void shouldFailForUnknownConnection() {
        when(connections.get("nope")).thenThrow(new NotFoundException("Source connection not found: nope"));

        assertThrows(NotFoundException.class, () -> service.browse(NavigationContext.root("nope")));
        verifyNoInteractions(sourceFactory);
    }

    @Test
    @DisplayName("Should fail for an unsupported provider")
    void shouldFailForUnsupportedProvider() {
        SourceConnection connection = new SourceConnection("gd", "google_drive", null, "Drive");
        when(connections.get("gd")).thenReturn(connection);
        when(sourceFactory.create(connection)).thenThrow(new UnsupportedProviderException("not supported"));

        assertThrows(UnsupportedProviderException.class, () -> service.browse(NavigationContext.root("gd")));
    }
}
