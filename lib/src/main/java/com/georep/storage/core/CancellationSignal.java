package com.georep.storage.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag for one logical operation. Listeners
 * registered after cancellation run immediately on the registering thread.
 */
public final class CancellationSignal {
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    
    public static CancellationSignal none() {
        return new CancellationSignal();
    }
    
    /**
     * Requests cancellation. Only the first call runs the listeners.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    /**
     * Registers {@code listener} to run on cancellation.
     *
     * @return a handle that unregisters the listener
     */
    public Registration onCancel(Runnable listener) {
        Runnable once = new RunOnce(listener);
        listeners.add(once);
        if (cancelled.get()) {
            once.run();
        }
        return () -> listeners.remove(once);
    }
    
    private static final class RunOnce implements Runnable {
        private final Runnable delegate;
        private final AtomicBoolean ran = new AtomicBoolean(false);
        
        private RunOnce(Runnable delegate) {
            this.delegate = delegate;
        }
        
        @Override
        public void run() {
            if (ran.compareAndSet(false, true)) {
                delegate.run();
            }
        }
    }
    
    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
