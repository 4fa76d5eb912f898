package dk.trustworks.filebridge.source;

import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.exceptions.AuthExpiredException;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Streams file content from pre-authenticated download URLs (Azure blob storage behind
 * Graph's {@code @microsoft.graph.downloadUrl}) into local temporary files.
 */
@JBossLog
@ApplicationScoped
public class GraphFileDownloader {

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Path tempDir;

    @Inject
    public GraphFileDownloader(FileBridgeConfig config) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            config.transfer().downloadTimeout(),
            config.transfer().tempDir().map(Path::of).orElse(null));
    }

    GraphFileDownloader(HttpClient httpClient, Duration timeout, Path tempDir) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.tempDir = tempDir;
    }

    /**
     * Downloads {@code url} to a new temporary file.
     *
     * @return the file; the caller owns it and must delete it
     * @throws AuthExpiredException if the download URL is rejected with 401
     * @throws UpstreamUnavailableException if the download fails or returns any other non-2xx status
     */
    public Path download(String url, String recordId) {
        Path target = null;
        try {
            target = tempDir != null
                ? Files.createTempFile(Files.createDirectories(tempDir), "filebridge-" + recordId + "-", ".part")
                : Files.createTempFile("filebridge-" + recordId + "-", ".part");

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();

            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
            int status = response.statusCode();
            if (status == 401) {
                throw GraphFailures.fromStatus("download " + recordId, status,
                    "Download failed with status: " + status, null);
            }
            if (status / 100 != 2) {
                throw new UpstreamUnavailableException("Download failed with status: " + status);
            }

            log.debugf("Downloaded %s: %d bytes", recordId, Files.size(target));
            return target;
        } catch (IOException e) {
            deleteQuietly(target);
            throw new UpstreamUnavailableException("Download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteQuietly(target);
            throw new UpstreamUnavailableException("Download interrupted", e);
        } catch (RuntimeException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("Could not delete temporary file %s: %s", path, e.getMessage());
        }
    }
}
