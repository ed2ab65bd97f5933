package document.java17.effect;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/// An asynchronous effect backed by [CompletableFuture].
///
/// `bind` is `thenCompose`: the continuation starts only after the previous
/// future completes, and never starts when it completed exceptionally. Leaf
/// functions may run on executor threads, yet a traversal still evaluates
/// leaves one at a time, left to right.
public record Async<A>(CompletableFuture<A> future) implements Kind<Async.Mu, A> {

    /// Witness type for [Async].
    public static final class Mu {
        private Mu() {}
    }

    private static final Effect<Mu> EFFECT = new Effect<>() {
        @Override
        public <T> Kind<Mu, T> wrap(T value) {
            return completed(value);
        }

        @Override
        public <T, U> Kind<Mu, U> bind(Kind<Mu, T> fa, Function<? super T, ? extends Kind<Mu, U>> f) {
            return new Async<>(narrow(fa).future().thenCompose(t -> narrow(f.apply(t)).future()));
        }
    };

    public Async {
        Objects.requireNonNull(future, "future must not be null");
    }

    public static Effect<Mu> effect() {
        return EFFECT;
    }

    public static <A> Async<A> narrow(Kind<Mu, A> kind) {
        return (Async<A>) kind;
    }

    public static <A> Async<A> completed(A value) {
        return new Async<>(CompletableFuture.completedFuture(value));
    }

    public static <A> Async<A> failed(Throwable error) {
        return new Async<>(CompletableFuture.failedFuture(error));
    }

    /// Runs `supplier` on `executor`.
    public static <A> Async<A> supply(Supplier<A> supplier, Executor executor) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return new Async<>(CompletableFuture.supplyAsync(supplier, executor));
    }
}
