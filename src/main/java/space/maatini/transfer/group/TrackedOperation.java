package space.maatini.transfer.group;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A registered operation: its label, the future of its result and the continuation to run once it
 * resolved.
 *
 * @param runsOnFailure whether the continuation also runs when the future failed, with a null value
 */
record TrackedOperation<T>(String label, CompletableFuture<T> future, Consumer<T> continuation,
        boolean runsOnFailure) {

    static TrackedOperation<Void> plain(String label, CompletableFuture<Void> future, Runnable continuation) {
        return new TrackedOperation<>(label, future, ignored -> continuation.run(), true);
    }

    static <T> TrackedOperation<T> withResult(String label, CompletableFuture<T> future, Consumer<T> continuation) {
        return new TrackedOperation<>(label, future, continuation, false);
    }
}
