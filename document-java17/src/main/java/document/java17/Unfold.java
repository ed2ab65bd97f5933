package document.java17;

import java.util.List;
import java.util.Objects;

/// One step of a coalgebra driving [DocumentSchemes#ana]: either emit a leaf
/// value or expand into child seeds under an orientation.
public sealed interface Unfold<S, A> permits Unfold.Emit, Unfold.Expand {

    /// Stop unfolding here and produce a leaf.
    record Emit<S, A>(A value) implements Unfold<S, A> {
        public Emit {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// Produce a container whose cells are unfolded from `seeds`, in order.
    record Expand<S, A>(List<S> seeds, Orientation orientation) implements Unfold<S, A> {
        public Expand {
            Objects.requireNonNull(seeds, "seeds must not be null");
            Objects.requireNonNull(orientation, "orientation must not be null");
            seeds = List.copyOf(seeds); // defensive copy
        }
    }

    static <S, A> Unfold<S, A> emit(A value) {
        return new Emit<>(value);
    }

    static <S, A> Unfold<S, A> horizontal(List<S> seeds) {
        return new Expand<>(seeds, Orientation.HORIZONTAL);
    }

    static <S, A> Unfold<S, A> vertical(List<S> seeds) {
        return new Expand<>(seeds, Orientation.VERTICAL);
    }
}
