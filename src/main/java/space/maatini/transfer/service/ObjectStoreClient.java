package space.maatini.transfer.service;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.transfer.common.config.TransferConfig;
import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.NotFoundException;
import space.maatini.transfer.common.exception.RemoteErrorMapper;
import space.maatini.transfer.common.exception.TransferException;
import space.maatini.transfer.common.exception.ValidationException;
import space.maatini.transfer.fault.FaultInjectingObjectStore;
import space.maatini.transfer.fault.FaultInjector;
import space.maatini.transfer.multipart.MultipartUploadSession;
import space.maatini.transfer.repository.ListPage;
import space.maatini.transfer.repository.RemoteObjectStore;
import space.maatini.transfer.segment.BufferPart;
import space.maatini.transfer.segment.LogicalRange;
import space.maatini.transfer.segment.SegmentView;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Service for reading and writing objects in a remote object store.
 * <p>
 * Every operation has a blocking form and an asynchronous form returning a {@link Uni}. The
 * asynchronous forms issue their first remote requests before returning; the remaining blocking
 * phases run on the Mutiny worker pool so that the threads completing remote futures are never
 * blocked.
 */
@ApplicationScoped
public class ObjectStoreClient {

    private static final Logger LOG = Logger.getLogger(ObjectStoreClient.class);

    private RemoteObjectStore store;
    private TransferConfig config;
    private Executor drivers;

    protected ObjectStoreClient() {
    }

    @Inject
    public ObjectStoreClient(RemoteObjectStore store, TransferConfig config, FaultInjector faultInjector) {
        this(store, config, faultInjector, Infrastructure.getDefaultWorkerPool());
    }

    public ObjectStoreClient(RemoteObjectStore store, TransferConfig config) {
        this(store, config, FaultInjector.NONE);
    }

    public ObjectStoreClient(RemoteObjectStore store, TransferConfig config, FaultInjector faultInjector,
            Executor drivers) {
        this.config = config.validate();
        this.store = FaultInjectingObjectStore.wrap(store, faultInjector);
        this.drivers = drivers;
    }

    // ==================== Head ====================

    /**
     * Size of an object.
     *
     * @return the size, or empty if the object does not exist
     * @throws TransferException for any failure other than a missing object
     */
    public OptionalLong headSize(String bucket, String key) {
        try {
            return OptionalLong.of(await(() -> store.headObject(bucket, key), "HeadObject", bucket, key));
        } catch (NotFoundException e) {
            LOG.debugf("HEAD [%s] %s: not found", bucket, key);
            return OptionalLong.empty();
        }
    }

    public boolean exists(String bucket, String key) {
        return headSize(bucket, key).isPresent();
    }

    public Uni<OptionalLong> headSizeAsync(String bucket, String key) {
        return Uni.createFrom().completionStage(issue(() -> store.headObject(bucket, key)))
                .onFailure().transform(e -> RemoteErrorMapper.translate(e, "HeadObject", bucket, key))
                .map(OptionalLong::of)
                .onFailure(NotFoundException.class).recoverWithItem(OptionalLong.empty());
    }

    // ==================== Put ====================

    /**
     * Store {@code data} under {@code key}. Payloads below the multipart threshold go out as one
     * request, larger ones as a multipart upload.
     */
    public void put(String bucket, String key, byte[] data) {
        if (isSinglePut(data)) {
            await(() -> putSingle(bucket, key, data), "PutObject", bucket, key);
            LOG.infof("Stored object [%s] %s: %d bytes", bucket, key, data.length);
            return;
        }
        multipartSession(bucket, key, data).run();
    }

    public Uni<Void> putAsync(String bucket, String key, byte[] data) {
        if (isSinglePut(data)) {
            return Uni.createFrom().completionStage(putSingle(bucket, key, data))
                    .onFailure().transform(e -> RemoteErrorMapper.translate(e, "PutObject", bucket, key))
                    .invoke(() -> LOG.infof("Stored object [%s] %s: %d bytes", bucket, key, data.length));
        }
        MultipartUploadSession session;
        try {
            session = multipartSession(bucket, key, data);
            session.initiate();
        } catch (TransferException e) {
            return Uni.createFrom().failure(e);
        }
        return onDrivers(() -> {
            session.uploadParts();
            session.complete();
            session.awaitDone();
            return null;
        }, "CompleteMultipartUpload", bucket, key);
    }

    /**
     * A multipart upload of {@code data} split by the configured segment size, regardless of the
     * single-put threshold.
     */
    public MultipartUploadSession multipartSession(String bucket, String key, byte[] data) {
        List<BufferPart> parts = SegmentView.build(LogicalRange.of(0, data.length), config.defaultSegmentSize(),
                config.segmentLimits());
        return new MultipartUploadSession(store, bucket, key, data, parts, config.partFailurePolicy());
    }

    private boolean isSinglePut(byte[] data) {
        return data.length < config.multipartThreshold();
    }

    private CompletableFuture<Void> putSingle(String bucket, String key, byte[] data) {
        LOG.debugf("PUT [%s] %s: %d bytes", bucket, key, data.length);
        return issue(() -> store.putObject(bucket, key, ByteBuffer.wrap(data), MultipartUploadSession.CONTENT_TYPE));
    }

    // ==================== Get ====================

    /**
     * Read {@code size} bytes starting at {@code start} into the beginning of {@code destination}.
     */
    public void get(String bucket, String key, long start, long size, byte[] destination) {
        List<BufferPart> parts = segment(start, size, destination);
        if (parts.isEmpty()) {
            return;
        }
        if (parts.size() == 1) {
            BufferPart part = parts.get(0);
            try {
                byte[] bytes = await(() -> store.getObject(bucket, key, part.rangeHeader()),
                        "GetObject " + part.rangeHeader(), bucket, key);
                RangedDownload.copyPart(bucket, key, part, bytes, destination);
            } catch (TransferException e) {
                throw config.partFailurePolicy().escalate(e);
            }
            return;
        }
        RangedDownload download = new RangedDownload(store, bucket, key, parts, destination,
                config.partFailurePolicy());
        download.start();
        download.await();
    }

    /**
     * Asynchronous {@link #get}. Invalid arguments fail the returned {@link Uni} instead of throwing.
     */
    public Uni<Void> getAsync(String bucket, String key, long start, long size, byte[] destination) {
        RangedDownload download;
        try {
            List<BufferPart> parts = segment(start, size, destination);
            if (parts.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            download = new RangedDownload(store, bucket, key, parts, destination, config.partFailurePolicy());
            download.start();
        } catch (TransferException e) {
            return Uni.createFrom().failure(e);
        }
        return onDrivers(() -> {
            download.await();
            return null;
        }, "GetObject", bucket, key);
    }

    private List<BufferPart> segment(long start, long size, byte[] destination) {
        if (size > destination.length) {
            throw new ValidationException(String.format(
                    "Destination holds %d bytes but %d were requested", destination.length, size));
        }
        return SegmentView.build(LogicalRange.of(start, size), config.defaultSegmentSize(), config.segmentLimits());
    }

    // ==================== Delete ====================

    /**
     * Delete {@code keys} in batches. A failed batch does not stop the following ones.
     *
     * @throws TransferException the first batch failure, later ones attached as suppressed
     */
    public void delete(String bucket, Collection<String> keys) {
        int limit = config.deleteBatchLimit();
        TransferException first = null;
        List<String> batch = new ArrayList<>(Math.min(limit, keys.size()));
        for (String key : keys) {
            batch.add(key);
            if (batch.size() == limit) {
                first = deleteBatch(bucket, batch, first);
                batch = new ArrayList<>(limit);
            }
        }
        if (!batch.isEmpty()) {
            first = deleteBatch(bucket, batch, first);
        }
        if (first != null) {
            throw first;
        }
        LOG.debugf("Deleted %d keys from [%s]", keys.size(), bucket);
    }

    /**
     * Delete {@code names} relative to {@code directory}.
     */
    public void delete(String bucket, String directory, Collection<String> names) {
        List<String> keys = new ArrayList<>(names.size());
        for (String name : names) {
            keys.add(joinPath(directory, name));
        }
        delete(bucket, keys);
    }

    public Uni<Void> deleteAsync(String bucket, Collection<String> keys) {
        List<String> snapshot = List.copyOf(keys);
        return onDrivers(() -> {
            delete(bucket, snapshot);
            return null;
        }, "DeleteObjects", bucket, null);
    }

    public Uni<Void> deleteAsync(String bucket, String directory, Collection<String> names) {
        List<String> snapshot = List.copyOf(names);
        return onDrivers(() -> {
            delete(bucket, directory, snapshot);
            return null;
        }, "DeleteObjects", bucket, directory);
    }

    private TransferException deleteBatch(String bucket, List<String> batch, TransferException first) {
        try {
            await(() -> store.deleteObjects(bucket, List.copyOf(batch)), "DeleteObjects", bucket, batch.get(0));
            return first;
        } catch (TransferException e) {
            LOG.errorf("Delete batch of %d keys in [%s] failed: %s", batch.size(), bucket, e.getMessage());
            if (first == null) {
                return e;
            }
            first.addSuppressed(e);
            return first;
        }
    }

    // ==================== List ====================

    /**
     * Add the names of all objects under {@code prefix} to {@code into}, relative to that prefix.
     * An empty prefix lists the whole bucket.
     *
     * @return {@code into}
     */
    public Set<String> list(String bucket, String prefix, Set<String> into) {
        String directory = directoryPrefix(prefix);
        String token = null;
        int pages = 0;
        do {
            String pageToken = token;
            ListPage page = await(() -> store.listObjects(bucket, directory, pageToken), "ListObjectsV2", bucket,
                    directory);
            pages++;
            for (String key : page.keys()) {
                if (key.startsWith(directory) && key.length() > directory.length()) {
                    into.add(key.substring(directory.length()));
                }
            }
            if (page.truncated()) {
                token = page.nextToken();
                if (token == null || token.isEmpty()) {
                    throw new TransferException(ErrorCode.SERVICE_ERROR, String.format(
                            "ListObjectsV2 for [%s] %s is truncated but has no continuation token", bucket,
                            directory));
                }
            } else {
                token = null;
            }
        } while (token != null);
        LOG.debugf("Listed [%s] %s: %d names in %d pages", bucket, directory, into.size(), pages);
        return into;
    }

    public Uni<Set<String>> listAsync(String bucket, String prefix, Set<String> into) {
        return onDrivers(() -> list(bucket, prefix, into), "ListObjectsV2", bucket, prefix);
    }

    static String directoryPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return "";
        }
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }

    static String joinPath(String directory, String name) {
        return directoryPrefix(directory) + name;
    }

    // ==================== Helpers ====================

    private static <T> T await(Supplier<CompletableFuture<T>> call, String operation, String bucket, String key) {
        try {
            return issue(call).join();
        } catch (RuntimeException e) {
            throw RemoteErrorMapper.translate(e, operation, bucket, key);
        }
    }

    private static <T> CompletableFuture<T> issue(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> Uni<T> onDrivers(Supplier<T> work, String operation, String bucket, String key) {
        CompletableFuture<T> driven = CompletableFuture.supplyAsync(work, drivers);
        return Uni.createFrom().completionStage(driven)
                .onFailure().transform(e -> RemoteErrorMapper.translate(e, operation, bucket, key));
    }
}
