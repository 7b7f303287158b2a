package space.maatini.transfer.fault;

import space.maatini.transfer.repository.CompletedPartTag;
import space.maatini.transfer.repository.ListPage;
import space.maatini.transfer.repository.RemoteObjectStore;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Decorates a {@link RemoteObjectStore} so every call probes the injector before it is issued and
 * when its result arrives.
 * <p>
 * A pre-call fault fails the call without reaching the store. A post-call fault turns a successful
 * result into a failure; a call that already failed keeps its own error.
 */
public class FaultInjectingObjectStore implements RemoteObjectStore {

    private final RemoteObjectStore delegate;
    private final FaultInjector injector;

    public FaultInjectingObjectStore(RemoteObjectStore delegate, FaultInjector injector) {
        this.delegate = delegate;
        this.injector = injector;
    }

    /**
     * Wrap {@code store} unless there is nothing to inject.
     */
    public static RemoteObjectStore wrap(RemoteObjectStore store, FaultInjector injector) {
        if (injector == null || injector == FaultInjector.NONE) {
            return store;
        }
        return new FaultInjectingObjectStore(store, injector);
    }

    @Override
    public CompletableFuture<Long> headObject(String bucket, String key) {
        return probed("headObject", FaultSensitivity.NORMAL, () -> delegate.headObject(bucket, key));
    }

    @Override
    public CompletableFuture<byte[]> getObject(String bucket, String key, String range) {
        return probed("getObject", FaultSensitivity.NORMAL, () -> delegate.getObject(bucket, key, range));
    }

    @Override
    public CompletableFuture<Void> putObject(String bucket, String key, ByteBuffer body, String contentType) {
        return probed("putObject", FaultSensitivity.NORMAL, () -> delegate.putObject(bucket, key, body, contentType));
    }

    @Override
    public CompletableFuture<String> createMultipartUpload(String bucket, String key, String contentType) {
        return probed("createMultipartUpload", FaultSensitivity.NORMAL,
                () -> delegate.createMultipartUpload(bucket, key, contentType));
    }

    @Override
    public CompletableFuture<String> uploadPart(String bucket, String key, String uploadId, int partNumber,
            ByteBuffer body) {
        return probed("uploadPart", FaultSensitivity.NORMAL,
                () -> delegate.uploadPart(bucket, key, uploadId, partNumber, body));
    }

    @Override
    public CompletableFuture<Void> completeMultipartUpload(String bucket, String key, String uploadId,
            List<CompletedPartTag> parts) {
        return probed("completeMultipartUpload", FaultSensitivity.HIGH,
                () -> delegate.completeMultipartUpload(bucket, key, uploadId, parts));
    }

    @Override
    public CompletableFuture<Void> abortMultipartUpload(String bucket, String key, String uploadId) {
        return probed("abortMultipartUpload", FaultSensitivity.NORMAL,
                () -> delegate.abortMultipartUpload(bucket, key, uploadId));
    }

    @Override
    public CompletableFuture<Void> deleteObjects(String bucket, List<String> keys) {
        return probed("deleteObjects", FaultSensitivity.HIGH, () -> delegate.deleteObjects(bucket, keys));
    }

    @Override
    public CompletableFuture<ListPage> listObjects(String bucket, String prefix, String continuationToken) {
        return probed("listObjects", FaultSensitivity.NORMAL,
                () -> delegate.listObjects(bucket, prefix, continuationToken));
    }

    private <T> CompletableFuture<T> probed(String operation, FaultSensitivity sensitivity,
            Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> issued;
        try {
            injector.probe(sensitivity, operation + ":pre");
            issued = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return issued.whenComplete((result, failure) -> injector.probe(sensitivity, operation + ":post"));
    }
}
