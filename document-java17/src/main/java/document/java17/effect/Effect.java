package document.java17.effect;

import java.util.function.Function;

/// An effect abstraction passed explicitly to generic traversals.
///
/// Implementations must satisfy the usual laws:
/// - left identity: `bind(wrap(a), f) == f(a)`
/// - right identity: `bind(m, this::wrap) == m`
/// - associativity: `bind(bind(m, f), g) == bind(m, a -> bind(f(a), g))`
///
/// `bind` must not invoke its continuation before `fa` has produced a value,
/// and must not invoke it at all when `fa` failed. Traversals depend on this
/// for left-to-right ordering and short-circuiting.
/// @param <F> the effect's witness type
public interface Effect<F> {

    /// Lifts a plain value into the effect.
    <A> Kind<F, A> wrap(A value);

    /// Sequences a dependent effect after `fa`.
    <A, B> Kind<F, B> bind(Kind<F, A> fa, Function<? super A, ? extends Kind<F, B>> f);

    default <A, B> Kind<F, B> map(Kind<F, A> fa, Function<? super A, ? extends B> f) {
        return bind(fa, a -> wrap(f.apply(a)));
    }
}
