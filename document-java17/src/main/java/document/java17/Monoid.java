package document.java17;

import java.util.Objects;

/// An associative binary operation with an identity element.
///
/// Instances must satisfy `combine(empty(), x) == x == combine(x, empty())`
/// and `combine(combine(x, y), z) == combine(x, combine(y, z))`.
public interface Monoid<T> {

    T empty();

    T combine(T x, T y);

    /// Combines `values` left to right, starting from [#empty].
    default T combineAll(Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values must not be null");
        T acc = empty();
        for (final T value : values) {
            acc = combine(acc, value);
        }
        return acc;
    }
}
