package space.maatini.transfer.service;

import org.jboss.logging.Logger;
import space.maatini.transfer.common.config.PartFailurePolicy;
import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.RemoteErrorMapper;
import space.maatini.transfer.common.exception.TransferException;
import space.maatini.transfer.repository.RemoteObjectStore;
import space.maatini.transfer.segment.BufferPart;
import space.maatini.transfer.sync.CountingSemaphore;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One ranged request per part, each copied into its own slice of the destination buffer.
 * <p>
 * Slices never overlap, so the callbacks write to the buffer without locking.
 */
class RangedDownload {

    private static final Logger LOG = Logger.getLogger(RangedDownload.class);

    private final RemoteObjectStore store;
    private final String bucket;
    private final String key;
    private final List<BufferPart> parts;
    private final byte[] destination;
    private final PartFailurePolicy failurePolicy;

    private final CountingSemaphore semaphore = new CountingSemaphore();
    private final AtomicReference<TransferException> failure = new AtomicReference<>();

    RangedDownload(RemoteObjectStore store, String bucket, String key, List<BufferPart> parts, byte[] destination,
            PartFailurePolicy failurePolicy) {
        this.store = store;
        this.bucket = bucket;
        this.key = key;
        this.parts = parts;
        this.destination = destination;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Dispatch every part without waiting.
     */
    void start() {
        semaphore.setGoal(parts.size());
        LOG.debugf("GET [%s] %s in %d parts", bucket, key, parts.size());
        for (BufferPart part : parts) {
            CompletableFuture<byte[]> request;
            try {
                request = store.getObject(bucket, key, part.rangeHeader());
            } catch (RuntimeException e) {
                request = CompletableFuture.failedFuture(e);
            }
            request.whenComplete((bytes, error) -> onPartComplete(part, bytes, error));
        }
    }

    /**
     * Block until every part has arrived.
     *
     * @throws TransferException the first part failure
     */
    void await() {
        semaphore.waitUntilZero();
        TransferException error = failure.get();
        if (error != null) {
            throw error;
        }
    }

    private void onPartComplete(BufferPart part, byte[] bytes, Throwable error) {
        try {
            if (error != null) {
                fail(RemoteErrorMapper.translate(error, "GetObject " + part.rangeHeader(), bucket, key));
            } else {
                copyPart(bucket, key, part, bytes, destination);
            }
        } catch (TransferException e) {
            fail(e);
        } finally {
            semaphore.decrementOne();
        }
    }

    private void fail(TransferException error) {
        TransferException escalated = failurePolicy.escalate(error);
        if (failure.compareAndSet(null, escalated)) {
            LOG.errorf("Ranged read failed [%s] %s: %s", bucket, key, escalated.getMessage());
        }
    }

    /**
     * Copy the body of one ranged response into the part's slice of {@code destination}.
     *
     * @throws TransferException if the body length does not match the requested range
     */
    static void copyPart(String bucket, String key, BufferPart part, byte[] bytes, byte[] destination) {
        if (bytes == null || bytes.length != part.length()) {
            throw new TransferException(ErrorCode.SERVICE_ERROR, String.format(
                    "GetObject %s for [%s] %s returned %d bytes, expected %d", part.rangeHeader(), bucket, key,
                    bytes == null ? 0 : bytes.length, part.length()));
        }
        System.arraycopy(bytes, 0, destination, Math.toIntExact(part.destinationOffset()), bytes.length);
    }
}
