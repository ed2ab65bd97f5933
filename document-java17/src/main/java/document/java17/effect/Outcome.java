package document.java17.effect;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/// Either a successful value or a typed failure.
///
/// As an [Effect], `Outcome` fails fast: binding on a [Failure] never runs the
/// continuation, so a traversal stops at the first failing leaf.
///
/// ```java
/// Outcome<String, Integer> parsed = Outcome.success(41);
/// Outcome<String, Integer> next = parsed.map(i -> i + 1);   // Success[value=42]
/// Outcome<String, Integer> bad = Outcome.failure("nope");
/// bad.map(i -> i + 1);                                      // Failure[error=nope]
/// ```
/// @param <E> the failure type
/// @param <A> the success type
public sealed interface Outcome<E, A> extends Kind<Outcome.Mu<E>, A> permits Outcome.Success, Outcome.Failure {

    /// Witness type for `Outcome<E, ?>`.
    final class Mu<E> {
        private Mu() {}
    }

    record Success<E, A>(A value) implements Outcome<E, A> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<E, A>(E error) implements Outcome<E, A> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        /// The same failure under a different success type.
        public <B> Failure<E, B> retype() {
            return new Failure<>(error);
        }
    }

    boolean isSuccess();

    static <E, A> Outcome<E, A> success(A value) {
        return new Success<>(value);
    }

    static <E, A> Outcome<E, A> failure(E error) {
        return new Failure<>(error);
    }

    static <E, A> Outcome<E, A> narrow(Kind<Mu<E>, A> kind) {
        return (Outcome<E, A>) kind;
    }

    /// The fail-fast effect instance for failures of type `E`.
    static <E> Effect<Mu<E>> effect() {
        return new Effect<>() {
            @Override
            public <T> Kind<Mu<E>, T> wrap(T value) {
                return success(value);
            }

            @Override
            public <T, U> Kind<Mu<E>, U> bind(Kind<Mu<E>, T> fa, Function<? super T, ? extends Kind<Mu<E>, U>> f) {
                final Outcome<E, T> outcome = narrow(fa);
                if (outcome instanceof Success<E, T> success) {
                    return f.apply(success.value());
                }
                return ((Failure<E, T>) outcome).<U>retype();
            }
        };
    }

    /// Runs `supplier`, turning a thrown [RuntimeException] into a [TraversalFailure].
    static <A> Outcome<TraversalFailure, A> attempt(Supplier<? extends A> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        try {
            return success(supplier.get());
        } catch (RuntimeException e) {
            return failure(TraversalFailure.of(e));
        }
    }

    /// Lifts a throwing function into one returning an `Outcome`, for use with traverse.
    static <A, B> Function<A, Outcome<TraversalFailure, B>> catching(Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f must not be null");
        return a -> attempt(() -> f.apply(a));
    }

    default <B> Outcome<E, B> map(Function<? super A, ? extends B> f) {
        if (this instanceof Success<E, A> ok) {
            return success(f.apply(ok.value()));
        }
        return ((Failure<E, A>) this).retype();
    }

    default <B> Outcome<E, B> flatMap(Function<? super A, ? extends Outcome<E, B>> f) {
        if (this instanceof Success<E, A> success) {
            return f.apply(success.value());
        }
        return ((Failure<E, A>) this).retype();
    }

    default <F> Outcome<F, A> mapError(Function<? super E, ? extends F> f) {
        if (this instanceof Failure<E, A> failed) {
            return failure(f.apply(failed.error()));
        }
        return success(((Success<E, A>) this).value());
    }

    default <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess) {
        if (this instanceof Success<E, A> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(((Failure<E, A>) this).error());
    }

    default Optional<A> toOptional() {
        return this instanceof Success<E, A> success ? Optional.ofNullable(success.value()) : Optional.empty();
    }

    /// The value, or the exception built from the failure.
    default A orElseThrow(Function<? super E, ? extends RuntimeException> toException) {
        if (this instanceof Success<E, A> success) {
            return success.value();
        }
        throw toException.apply(((Failure<E, A>) this).error());
    }
}
