package com.delta.listingimport.ingest.external;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent calls with the same key into one execution. The caller that registers the key
 * runs the call on its own thread; the others wait for the same outcome. The key is released once the
 * call settles, success or failure.
 *
 * @param <T> result type shared by every call through this instance
 */
public class RequestDeduplicator<T> {
    private final Map<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    public T execute(String key, Supplier<? extends T> call) {
        CompletableFuture<T> created = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            return join(existing);
        }
        try {
            T result = call.get();
            created.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, created);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
