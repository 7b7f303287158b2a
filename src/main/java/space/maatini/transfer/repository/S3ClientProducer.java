package space.maatini.transfer.repository;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientAsyncConfiguration;
import software.amazon.awssdk.core.client.config.SdkAdvancedAsyncClientOption;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import space.maatini.transfer.common.config.TransferConfig;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the shared S3 client and the worker pool its futures complete on.
 */
@ApplicationScoped
public class S3ClientProducer {

    private static final Logger LOG = Logger.getLogger(S3ClientProducer.class);

    @Inject
    TransferConfig config;

    private ExecutorService workers;

    @Produces
    @ApplicationScoped
    S3AsyncClient s3AsyncClient() {
        TransferConfig validated = config.validate();
        workers = Executors.newFixedThreadPool(validated.workerThreads(), new WorkerThreadFactory());
        return create(validated, workers);
    }

    void close(@Disposes S3AsyncClient client) {
        client.close();
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Transfer workers did not stop within 10s");
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Build a client for the configured region, or for the endpoint override with path-style
     * addressing (local S3-compatible stores only support that).
     */
    public static S3AsyncClient create(TransferConfig config, ExecutorService callbackExecutor) {
        AwsCredentialsProvider credentials = DefaultCredentialsProvider.create();
        warnOnMissingCredentials(credentials);

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(config.region()))
                .credentialsProvider(credentials)
                .asyncConfiguration(ClientAsyncConfiguration.builder()
                        .advancedOption(SdkAdvancedAsyncClientOption.FUTURE_COMPLETION_EXECUTOR, callbackExecutor)
                        .build());

        if (config.endpointOverride().isPresent()) {
            String endpoint = config.endpointOverride().get();
            LOG.infof("Using endpoint override %s with path-style addressing", endpoint);
            builder.endpointOverride(URI.create(endpoint))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(true)
                            .build());
        }

        LOG.debugf("Created S3 client for region %s with %d workers", config.region(), config.workerThreads());
        return builder.build();
    }

    private static void warnOnMissingCredentials(AwsCredentialsProvider credentials) {
        try {
            credentials.resolveCredentials();
        } catch (SdkClientException e) {
            LOG.warnf("AWS credentials not found, S3 storage will likely be inaccessible: %s", e.getMessage());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "transfer-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
