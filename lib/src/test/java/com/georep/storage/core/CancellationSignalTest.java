package com.georep.storage.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void testListenersRunOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testLateListenerRunsImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testClosedRegistrationIsNotNotified() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        CancellationSignal.Registration registration = signal.onCancel(calls::incrementAndGet);

        registration.close();
        signal.cancel();

        assertEquals(0, calls.get());
    }
}
