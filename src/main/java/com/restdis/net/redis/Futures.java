package com.restdis.net.redis;

import com.restdis.net.BackingStoreException;
import io.vertx.core.Future;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Vert.x future'larını çalışan (worker) thread üzerinde bloklayarak bekler.
 * Olay döngüsü thread'inden çağrılmamalıdır.
 */
final class Futures
{
    private Futures() {}

    static <T> T await(Future<T> future, long timeoutMillis)
    {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackingStoreException("ERR interrupted while waiting for backing store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage();
            throw new BackingStoreException(message == null ? cause.getClass().getSimpleName() : message, cause);
        } catch (TimeoutException e) {
            throw new BackingStoreException("ERR backing store timed out after " + timeoutMillis + "ms", e);
        }
    }
}
