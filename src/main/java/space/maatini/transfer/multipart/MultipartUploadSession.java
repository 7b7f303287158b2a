package space.maatini.transfer.multipart;

import org.jboss.logging.Logger;
import space.maatini.transfer.common.config.PartFailurePolicy;
import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.RemoteErrorMapper;
import space.maatini.transfer.common.exception.TransferException;
import space.maatini.transfer.common.exception.ValidationException;
import space.maatini.transfer.repository.CompletedPartTag;
import space.maatini.transfer.repository.RemoteObjectStore;
import space.maatini.transfer.segment.BufferPart;
import space.maatini.transfer.sync.CountingSemaphore;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Uploads one object as a multipart upload: create, upload every part in parallel, complete.
 * <p>
 * Each phase is an explicit method and the owning thread calls them in order:
 * {@link #initiate()}, {@link #uploadParts()}, {@link #complete()}, {@link #awaitDone()}, or all of
 * them through {@link #run()}. Part results arrive on remote worker threads; they record the part's
 * tag and count down the session's semaphore, which {@link #complete()} waits on. One failed part
 * fails the whole object and nothing is completed.
 * <p>
 * A session belongs to the call chain that created it and is used once.
 */
public class MultipartUploadSession {

    private static final Logger LOG = Logger.getLogger(MultipartUploadSession.class);

    public static final String CONTENT_TYPE = "application/octet-stream";

    /**
     * Session lifecycle. {@code DONE} and {@code FAILED} are terminal.
     */
    public enum State {
        CREATED,
        INITIATING,
        UPLOADING,
        COMPLETING,
        DONE,
        FAILED
    }

    private final RemoteObjectStore store;
    private final String bucket;
    private final String key;
    private final byte[] data;
    private final List<BufferPart> parts;
    private final PartFailurePolicy failurePolicy;

    private final CountingSemaphore semaphore = new CountingSemaphore();
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final AtomicReference<TransferException> failure = new AtomicReference<>();

    // guarded by partTags
    private final String[] partTags;

    private volatile String uploadId = "";
    private CompletableFuture<String> createFuture;
    private CompletableFuture<Void> completeFuture;
    private List<CompletedPartTag> manifest = Collections.emptyList();

    public MultipartUploadSession(RemoteObjectStore store, String bucket, String key, byte[] data,
            List<BufferPart> parts, PartFailurePolicy failurePolicy) {
        if (parts.isEmpty()) {
            throw new ValidationException("A multipart upload needs at least one part: [" + bucket + "] " + key);
        }
        BufferPart last = parts.get(parts.size() - 1);
        if (last.destinationOffset() + last.length() > data.length) {
            throw new ValidationException(String.format(
                    "Parts cover %d bytes but the buffer holds %d", last.destinationOffset() + last.length(),
                    data.length));
        }
        this.store = store;
        this.bucket = bucket;
        this.key = key;
        this.data = data;
        this.parts = List.copyOf(parts);
        this.failurePolicy = failurePolicy;
        this.partTags = new String[parts.size()];
    }

    /**
     * Drive every phase on the calling thread.
     *
     * @throws TransferException the first error of the session
     */
    public void run() {
        initiate();
        uploadParts();
        complete();
        awaitDone();
    }

    // ==================== Phases ====================

    /**
     * {@code CREATED -> INITIATING}: ask the store for an upload id without waiting for it.
     */
    public void initiate() {
        transition(State.CREATED, State.INITIATING);
        LOG.debugf("[%s] %s: creating multipart upload for %d bytes in %d parts", bucket, key, data.length,
                parts.size());
        createFuture = issue(() -> store.createMultipartUpload(bucket, key, CONTENT_TYPE));
    }

    /**
     * {@code INITIATING -> UPLOADING}: wait for the upload id, then dispatch one upload per part.
     */
    public void uploadParts() {
        requireState(State.INITIATING);
        String id;
        try {
            id = createFuture.join();
        } catch (RuntimeException e) {
            throw fail(RemoteErrorMapper.translate(e, "CreateMultipartUpload", bucket, key));
        }
        if (id == null || id.isEmpty()) {
            throw fail(new TransferException(ErrorCode.SERVICE_ERROR,
                    "CreateMultipartUpload returned no upload id for [" + bucket + "] " + key));
        }
        uploadId = id;
        transition(State.INITIATING, State.UPLOADING);
        LOG.debugf("[%s] %s: upload id %s, dispatching %d parts", bucket, key, id, parts.size());

        semaphore.setGoal(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            dispatchPart(i);
        }
    }

    /**
     * {@code UPLOADING -> COMPLETING}: wait for every part, then send the manifest ordered by part
     * number. If any part failed the upload is aborted and the first error thrown instead.
     */
    public void complete() {
        State current = state.get();
        if (current == State.CREATED || current == State.INITIATING) {
            throw new IllegalStateException("complete() called before uploadParts(), state " + current);
        }
        semaphore.waitUntilZero();

        TransferException error = failure.get();
        if (error != null) {
            abort();
            throw error;
        }
        transition(State.UPLOADING, State.COMPLETING);

        manifest = buildManifest();
        completeFuture = issue(() -> store.completeMultipartUpload(bucket, key, uploadId, manifest));
    }

    /**
     * {@code COMPLETING -> DONE}: wait for the store to confirm the assembled object.
     */
    public void awaitDone() {
        requireState(State.COMPLETING);
        try {
            completeFuture.join();
        } catch (RuntimeException e) {
            TransferException error = fail(RemoteErrorMapper.translate(e, "CompleteMultipartUpload", bucket, key));
            abort();
            throw error;
        }
        transition(State.COMPLETING, State.DONE);
        LOG.infof("Stored object [%s] %s: %d bytes in %d parts", bucket, key, data.length, parts.size());
    }

    // ==================== Parts ====================

    private void dispatchPart(int index) {
        BufferPart part = parts.get(index);
        int partNumber = index + 1;
        ByteBuffer body = ByteBuffer.wrap(data, Math.toIntExact(part.destinationOffset()),
                Math.toIntExact(part.length()));

        issue(() -> store.uploadPart(bucket, key, uploadId, partNumber, body))
                .whenComplete((eTag, error) -> onPartComplete(index, eTag, error));
    }

    private void onPartComplete(int index, String eTag, Throwable error) {
        int partNumber = index + 1;
        try {
            if (error != null) {
                fail(failurePolicy.escalate(RemoteErrorMapper.translate(error, "UploadPart " + partNumber, bucket, key)));
            } else if (eTag == null || eTag.isEmpty()) {
                fail(failurePolicy.escalate(new TransferException(ErrorCode.SERVICE_ERROR,
                        String.format("UploadPart %d returned no tag for [%s] %s", partNumber, bucket, key))));
            } else {
                synchronized (partTags) {
                    partTags[index] = eTag;
                }
                LOG.debugf("[%s] %s: part %d done, etag %s", bucket, key, partNumber, eTag);
            }
        } finally {
            semaphore.decrementOne();
        }
    }

    private List<CompletedPartTag> buildManifest() {
        List<CompletedPartTag> entries = new ArrayList<>(partTags.length);
        synchronized (partTags) {
            for (int i = 0; i < partTags.length; i++) {
                entries.add(new CompletedPartTag(i + 1, partTags[i]));
            }
        }
        return Collections.unmodifiableList(entries);
    }

    // ==================== Failure ====================

    private TransferException fail(TransferException error) {
        if (failure.compareAndSet(null, error)) {
            LOG.errorf("Multipart upload failed [%s] %s: %s", bucket, key, error.getMessage());
        }
        state.getAndUpdate(current -> current == State.DONE ? current : State.FAILED);
        return failure.get();
    }

    // Best effort so the store does not keep the uploaded parts; the original error stays the one reported.
    private void abort() {
        if (uploadId.isEmpty()) {
            return;
        }
        try {
            store.abortMultipartUpload(bucket, key, uploadId).join();
            LOG.infof("Aborted multipart upload %s for [%s] %s", uploadId, bucket, key);
        } catch (RuntimeException e) {
            TransferException abortError = RemoteErrorMapper.translate(e, "AbortMultipartUpload", bucket, key);
            LOG.warnf("Could not abort multipart upload %s: %s", uploadId, abortError.getMessage());
            TransferException error = failure.get();
            if (error != null) {
                error.addSuppressed(abortError);
            }
        }
    }

    private static <T> CompletableFuture<T> issue(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void requireState(State expected) {
        State current = state.get();
        if (current == State.FAILED && failure.get() != null) {
            throw failure.get();
        }
        if (current != expected) {
            throw new IllegalStateException("Expected state " + expected + " but was " + current);
        }
    }

    private void transition(State from, State to) {
        if (!state.compareAndSet(from, to)) {
            requireState(from);
            throw new IllegalStateException("Cannot move from " + state.get() + " to " + to);
        }
    }

    // ==================== Accessors ====================

    public State state() {
        return state.get();
    }

    public String uploadId() {
        return uploadId;
    }

    public int partCount() {
        return parts.size();
    }

    /**
     * Manifest sent with the completion request, empty before {@link #complete()}.
     */
    public List<CompletedPartTag> manifest() {
        return manifest;
    }

    public String bucket() {
        return bucket;
    }

    public String key() {
        return key;
    }
}
