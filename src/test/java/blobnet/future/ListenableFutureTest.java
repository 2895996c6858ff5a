package blobnet.future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ListenableFutureTest {

    private ListenableFuture<String> future;

    @BeforeEach
    void setUp() {
        future = new ListenableFuture<>();
    }

    @Test
    void shouldStartInPendingState() {
        assertTrue(future.isPending());
        assertFalse(future.isCompleted());
        assertFalse(future.isFailed());
    }

    @Test
    void shouldCompleteSuccessfully() {
        // When
        future.complete("success");

        // Then
        assertTrue(future.isCompleted());
        assertEquals("success", future.getResult());
    }

    @Test
    void shouldFailWithException() {
        // Given
        RuntimeException error = new RuntimeException("test error");

        // When
        future.fail(error);

        // Then
        assertTrue(future.isFailed());
        assertSame(error, future.getException());
    }

    @Test
    void shouldNotAllowSecondCompletion() {
        future.complete("first");

        assertThrows(IllegalStateException.class, () -> future.complete("second"));
        assertThrows(IllegalStateException.class, () -> future.fail(new RuntimeException("late")));
        assertEquals("first", future.getResult());
    }

    @Test
    void shouldRejectNullFailure() {
        assertThrows(IllegalArgumentException.class, () -> future.fail(null));
        assertTrue(future.isPending());
    }

    @Test
    void shouldInvokeCallbackRegisteredBeforeCompletion() {
        // Given
        AtomicReference<String> received = new AtomicReference<>();
        future.onSuccess(received::set);

        // When
        future.complete("value");

        // Then
        assertEquals("value", received.get());
    }

    @Test
    void shouldInvokeCallbackImmediatelyWhenAlreadyDone() {
        // Given
        future.fail(new IllegalStateException("boom"));
        AtomicReference<Throwable> received = new AtomicReference<>();
        AtomicReference<String> success = new AtomicReference<>();

        // When
        future.onSuccess(success::set).onFailure(received::set);

        // Then
        assertNull(success.get());
        assertEquals("boom", received.get().getMessage());
    }

    @Test
    void awaitShouldReturnValueCompletedByAnotherThread() throws Exception {
        // Given
        Thread completer = new Thread(() -> future.complete("from-thread"));

        // When
        completer.start();
        String result = future.await(Duration.ofSeconds(5));

        // Then
        assertEquals("from-thread", result);
    }

    @Test
    void awaitShouldThrowTimeoutWhilePending() {
        assertThrows(TimeoutException.class, () -> future.await(Duration.ofMillis(20)));
        assertTrue(future.isPending());
    }

    @Test
    void awaitShouldWrapFailureInExecutionException() {
        // Given
        IllegalStateException error = new IllegalStateException("failed");
        future.fail(error);

        // When
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.await(Duration.ofSeconds(1)));

        // Then
        assertSame(error, thrown.getCause());
    }

    @Test
    void staticFactoriesShouldCreateDoneFutures() {
        assertEquals(42, ListenableFuture.completed(42).getResult());
        assertTrue(ListenableFuture.failed(new RuntimeException("x")).isFailed());
    }
}
