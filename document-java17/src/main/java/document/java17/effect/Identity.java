package document.java17.effect;

import java.util.function.Function;

/// The effect that does nothing: it always holds exactly one value.
public record Identity<A>(A value) implements Kind<Identity.Mu, A> {

    /// Witness type for [Identity].
    public static final class Mu {
        private Mu() {}
    }

    private static final Effect<Mu> EFFECT = new Effect<>() {
        @Override
        public <T> Kind<Mu, T> wrap(T value) {
            return new Identity<>(value);
        }

        @Override
        public <T, U> Kind<Mu, U> bind(Kind<Mu, T> fa, Function<? super T, ? extends Kind<Mu, U>> f) {
            return f.apply(narrow(fa).value());
        }
    };

    public static Effect<Mu> effect() {
        return EFFECT;
    }

    public static <A> Identity<A> narrow(Kind<Mu, A> kind) {
        return (Identity<A>) kind;
    }
}
