package com.sqlguard.service;

import com.sqlguard.model.BackendMode;

import java.io.Closeable;
import java.util.Optional;

/**
 * Startup-computed backend state shared by every tool call. Never mutated after construction,
 * so it is read without synchronization.
 */
public final class BackendContext implements Closeable {

    private final BackendMode mode;
    private final ReadOnlySessionExecutor executor;
    private final Closeable pool;

    private BackendContext(BackendMode mode, ReadOnlySessionExecutor executor, Closeable pool) {
        this.mode = mode;
        this.executor = executor;
        this.pool = pool;
    }

    public static BackendContext demo() {
        return new BackendContext(BackendMode.DEMO, null, null);
    }

    public static BackendContext live(ReadOnlySessionExecutor executor, Closeable pool) {
        return new BackendContext(BackendMode.LIVE, executor, pool);
    }

    public BackendMode getMode() {
        return mode;
    }

    /**
     * @return the executor in live mode, empty in demo mode
     */
    public Optional<ReadOnlySessionExecutor> getExecutor() {
        return Optional.ofNullable(executor);
    }

    @Override
    public void close() {
        if (pool == null) {
            return;
        }
        try {
            pool.close();
        } catch (Exception ignored) {
            // Shutdown only; nothing left to release.
        }
    }
}
