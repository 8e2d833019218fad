package io.servicekit.restclient;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void notifiesListenersOnce() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void lateListenerRunsImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);
        assertEquals(1, calls.get());
    }

    @Test
    void closedRegistrationIsNotNotified() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        CancellationSignal.Registration registration = signal.onCancel(calls::incrementAndGet);

        registration.close();
        signal.cancel();
        assertEquals(0, calls.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        assertEquals(1, calls.get());
    }

    @Test
    void noneCannotBeCancelled() {
        CancellationSignal none = CancellationSignal.none();
        assertFalse(none.isCancelled());
        assertThrows(UnsupportedOperationException.class, none::cancel);
    }

    @Test
    void afterCancelsOnceDeadlinePasses() throws Exception {
        CancellationSignal signal = CancellationSignal.after(Duration.ofMillis(50));
        CountDownLatch fired = new CountDownLatch(1);
        signal.onCancel(fired::countDown);

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(signal.isCancelled());
        assertTrue(CancellationSignal.after(Duration.ZERO).isCancelled());
    }
}
