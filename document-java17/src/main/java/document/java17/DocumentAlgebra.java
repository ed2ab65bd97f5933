package document.java17;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/// One reduction step per variant, consumed by [DocumentSchemes#cata].
///
/// Container methods receive the already-reduced results of their cells, in
/// cell order. The lists are unmodifiable.
///
/// Renderers implement this interface to turn a document into text, markup or
/// a numeric aggregate without touching the tree model.
public interface DocumentAlgebra<A, R> {

    R leaf(A value);

    R horizontal(List<R> cells);

    R vertical(List<R> cells);

    R empty();

    /// Assembles an algebra from four functions.
    static <A, R> DocumentAlgebra<A, R> of(Function<? super A, ? extends R> leaf,
                                           Function<? super List<R>, ? extends R> horizontal,
                                           Function<? super List<R>, ? extends R> vertical,
                                           Supplier<? extends R> empty) {
        Objects.requireNonNull(leaf, "leaf must not be null");
        Objects.requireNonNull(horizontal, "horizontal must not be null");
        Objects.requireNonNull(vertical, "vertical must not be null");
        Objects.requireNonNull(empty, "empty must not be null");
        return new DocumentAlgebra<>() {
            @Override
            public R leaf(A value) {
                return leaf.apply(value);
            }

            @Override
            public R horizontal(List<R> cells) {
                return horizontal.apply(cells);
            }

            @Override
            public R vertical(List<R> cells) {
                return vertical.apply(cells);
            }

            @Override
            public R empty() {
                return empty.get();
            }
        };
    }
}
