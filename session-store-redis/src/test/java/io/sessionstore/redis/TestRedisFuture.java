package io.sessionstore.redis;

import io.lettuce.core.RedisFuture;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Already-completed {@link RedisFuture} for stubbing async commands.
 */
final class TestRedisFuture<T> extends CompletableFuture<T> implements RedisFuture<T> {

    static <T> TestRedisFuture<T> of(T value) {
        TestRedisFuture<T> f = new TestRedisFuture<>();
        f.complete(value);
        return f;
    }

    static <T> TestRedisFuture<T> failed(Throwable error) {
        TestRedisFuture<T> f = new TestRedisFuture<>();
        f.completeExceptionally(error);
        return f;
    }

    @Override
    public String getError() {
        return isCompletedExceptionally() ? "failed" : null;
    }

    @Override
    public boolean await(long timeout, TimeUnit unit) {
        return isDone();
    }
}
