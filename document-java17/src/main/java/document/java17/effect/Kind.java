package document.java17.effect;

/// Type-constructor witness: a value of `Kind<F, A>` is "`F` applied to `A`".
///
/// Java has no higher-kinded types, so each effect declares a marker type `F`
/// (conventionally a nested class named `Mu`) and its values implement
/// `Kind<Mu, A>`. Each effect offers a `narrow` method to recover the concrete
/// type from a `Kind`.
public interface Kind<F, A> {
}
