package blobnet.future;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Single-use result slot that is completed exactly once, either with a value or
 * with an exception.
 * <p>
 * Callbacks registered with {@link #onSuccess(Consumer)} and {@link #onFailure(Consumer)}
 * run on the thread that completes the future, or immediately on the registering
 * thread if the future is already done. The overlay engine completes futures on its
 * own thread, so callers on other threads use {@link #await(Duration)} to block with
 * a deadline.
 */
public class ListenableFuture<T> {

    private enum State { PENDING, COMPLETED, FAILED }

    private State state = State.PENDING;
    private T result;
    private Throwable exception;

    private final List<Consumer<T>> successCallbacks = new ArrayList<>();
    private final List<Consumer<Throwable>> failureCallbacks = new ArrayList<>();

    public static <T> ListenableFuture<T> completed(T value) {
        ListenableFuture<T> future = new ListenableFuture<>();
        future.complete(value);
        return future;
    }

    public static <T> ListenableFuture<T> failed(Throwable error) {
        ListenableFuture<T> future = new ListenableFuture<>();
        future.fail(error);
        return future;
    }

    /**
     * Completes the future with a value.
     *
     * @throws IllegalStateException if the future is already completed or failed
     */
    public void complete(T value) {
        List<Consumer<T>> callbacks;
        synchronized (this) {
            if (state != State.PENDING) {
                throw new IllegalStateException("Future already " + state.name().toLowerCase());
            }
            this.result = value;
            this.state = State.COMPLETED;
            callbacks = new ArrayList<>(successCallbacks);
            successCallbacks.clear();
            failureCallbacks.clear();
            notifyAll();
        }
        callbacks.forEach(callback -> callback.accept(value));
    }

    /**
     * Fails the future with the given exception.
     *
     * @throws IllegalStateException if the future is already completed or failed
     */
    public void fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        List<Consumer<Throwable>> callbacks;
        synchronized (this) {
            if (state != State.PENDING) {
                throw new IllegalStateException("Future already " + state.name().toLowerCase());
            }
            this.exception = error;
            this.state = State.FAILED;
            callbacks = new ArrayList<>(failureCallbacks);
            successCallbacks.clear();
            failureCallbacks.clear();
            notifyAll();
        }
        callbacks.forEach(callback -> callback.accept(error));
    }

    public ListenableFuture<T> onSuccess(Consumer<T> callback) {
        T value;
        synchronized (this) {
            if (state == State.PENDING) {
                successCallbacks.add(callback);
                return this;
            }
            if (state == State.FAILED) {
                return this;
            }
            value = result;
        }
        callback.accept(value);
        return this;
    }

    public ListenableFuture<T> onFailure(Consumer<Throwable> callback) {
        Throwable error;
        synchronized (this) {
            if (state == State.PENDING) {
                failureCallbacks.add(callback);
                return this;
            }
            if (state == State.COMPLETED) {
                return this;
            }
            error = exception;
        }
        callback.accept(error);
        return this;
    }

    /**
     * Blocks until the future is done or the timeout elapses.
     *
     * @return the completed value
     * @throws ExecutionException if the future failed; the cause is the failure
     * @throws TimeoutException if the future is still pending after {@code timeout}
     */
    public synchronized T await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (state == State.PENDING) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                throw new TimeoutException("Result not available within " + timeout.toMillis() + "ms");
            }
            long millis = remainingNanos / 1_000_000;
            int nanos = (int) (remainingNanos % 1_000_000);
            wait(millis, nanos);
        }
        if (state == State.FAILED) {
            throw new ExecutionException(exception);
        }
        return result;
    }

    public synchronized boolean isPending() {
        return state == State.PENDING;
    }

    public synchronized boolean isCompleted() {
        return state == State.COMPLETED;
    }

    public synchronized boolean isFailed() {
        return state == State.FAILED;
    }

    public synchronized T getResult() {
        if (state != State.COMPLETED) {
            throw new IllegalStateException("Future is not completed");
        }
        return result;
    }

    public synchronized Throwable getException() {
        if (state != State.FAILED) {
            throw new IllegalStateException("Future has not failed");
        }
        return exception;
    }

    @Override
    public synchronized String toString() {
        return "ListenableFuture{state=" + state + "}";
    }
}
