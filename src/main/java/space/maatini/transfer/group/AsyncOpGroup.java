package space.maatini.transfer.group;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Tracks outstanding asynchronous operations and delivers their continuations in registration order.
 * <p>
 * Operations run concurrently and may resolve in any order. {@link #finish()} walks the queue from the
 * oldest entry, blocks on each future in turn and then runs its continuation, so continuations see a
 * deterministic order. A failure does not stop the walk: every registered operation is still waited
 * on, and the first failure is thrown once the queue is empty.
 * <p>
 * A {@link Uni} is subscribed when it is registered.
 */
public abstract class AsyncOpGroup {

    private static final Logger LOG = Logger.getLogger(AsyncOpGroup.class);

    private final String name;
    private final Queue<TrackedOperation<?>> pending = new ConcurrentLinkedQueue<>();

    protected AsyncOpGroup(String name) {
        this.name = name;
    }

    // ==================== Registration ====================

    public void addOperation(Uni<Void> operation, String label, Runnable onComplete) {
        addOperation(operation.subscribeAsCompletionStage(), label, onComplete);
    }

    public void addOperation(CompletionStage<Void> operation, String label, Runnable onComplete) {
        Objects.requireNonNull(onComplete, "onComplete");
        pending.add(TrackedOperation.plain(label, operation.toCompletableFuture(), onComplete));
        LOG.debugf("%s group: registered '%s', %d pending", name, label, pending.size());
    }

    /**
     * Register an operation whose result is handed to {@code onComplete}. The continuation is skipped
     * when the operation fails.
     */
    public <T> void addOperationWithResult(Uni<T> operation, String label, Consumer<T> onComplete) {
        addOperationWithResult(operation.subscribeAsCompletionStage(), label, onComplete);
    }

    public <T> void addOperationWithResult(CompletionStage<T> operation, String label, Consumer<T> onComplete) {
        Objects.requireNonNull(onComplete, "onComplete");
        pending.add(TrackedOperation.withResult(label, operation.toCompletableFuture(), onComplete));
        LOG.debugf("%s group: registered '%s', %d pending", name, label, pending.size());
    }

    // ==================== Drain ====================

    /**
     * Wait for every registered operation in registration order and run its continuation.
     *
     * @throws GroupOperationException the first failure, of an operation or of a continuation
     */
    public void finish() {
        GroupOperationException first = null;
        int drained = 0;
        TrackedOperation<?> operation;
        while ((operation = pending.poll()) != null) {
            GroupOperationException error = drain(operation);
            drained++;
            if (error == null) {
                continue;
            }
            if (first == null) {
                first = error;
            } else {
                first.addSuppressed(error);
            }
        }
        if (first != null) {
            LOG.errorf("%s group: %d operations drained, first failure: %s", name, drained, first.getMessage());
            throw first;
        }
        LOG.debugf("%s group: %d operations drained", name, drained);
    }

    private <T> GroupOperationException drain(TrackedOperation<T> operation) {
        T value = null;
        GroupOperationException error = null;
        try {
            value = operation.future().join();
        } catch (RuntimeException e) {
            error = new GroupOperationException(operation.label(), e);
            LOG.warnf("%s group: '%s' failed: %s", name, operation.label(), error.getCause());
        }

        if (error != null && !operation.runsOnFailure()) {
            return error;
        }
        try {
            operation.continuation().accept(value);
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s group: continuation of '%s' failed", name, operation.label());
            if (error == null) {
                error = new GroupOperationException(operation.label(), e);
            } else {
                error.addSuppressed(e);
            }
        }
        return error;
    }

    /**
     * Operations registered and not yet drained.
     */
    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
