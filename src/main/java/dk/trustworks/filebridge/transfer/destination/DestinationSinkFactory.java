package dk.trustworks.filebridge.transfer.destination;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.filebridge.config.FileBridgeConfig;
import dk.trustworks.filebridge.connections.DestinationCollection;
import dk.trustworks.filebridge.exceptions.UpstreamUnavailableException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.http.apache.ProxyConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;

import java.net.URI;

/**
 * Opens the S3 destination for a collection. The S3 client is shared; credentials come from the
 * default AWS provider chain.
 */
@JBossLog
@ApplicationScoped
public class DestinationSinkFactory {

    private final FileBridgeConfig.S3Config s3Config;
    private final ObjectMapper objectMapper;
    private final S3Client s3;

    @Inject
    public DestinationSinkFactory(FileBridgeConfig config, ObjectMapper objectMapper) {
        this(config.destination().s3(), objectMapper, buildClient(config.destination().s3()));
    }

    DestinationSinkFactory(FileBridgeConfig.S3Config s3Config, ObjectMapper objectMapper, S3Client s3) {
        this.s3Config = s3Config;
        this.objectMapper = objectMapper;
        this.s3 = s3;
    }

    private static S3Client buildClient(FileBridgeConfig.S3Config s3Config) {
        ProxyConfiguration.Builder proxyConfig = ProxyConfiguration.builder();
        ApacheHttpClient.Builder httpClientBuilder = ApacheHttpClient.builder()
                .proxyConfiguration(proxyConfig.build());

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3Config.region()))
                .httpClientBuilder(httpClientBuilder);
        s3Config.endpointOverride().ifPresent(endpoint -> builder
                .endpointOverride(URI.create(endpoint))
                .forcePathStyle(true));
        return builder.build();
    }

    /**
     * Checks that the bucket is reachable and returns a sink for the collection.
     *
     * @throws UpstreamUnavailableException if the bucket cannot be reached
     */
    public DestinationSink open(DestinationCollection collection) {
        String bucket = s3Config.bucket();
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException e) {
            log.errorf("S3 destination bucket %s is not reachable: %s", bucket, e.getMessage());
            throw new UpstreamUnavailableException("S3 destination not reachable: " + e.getMessage(), e);
        }
        log.debugf("Opened S3 destination s3://%s for collection %s", bucket, collection.readableId());
        return new S3DestinationSink(s3, bucket, s3Config.prefix().orElse(""), collection, objectMapper);
    }

    @PreDestroy
    void close() {
        s3.close();
    }
}
