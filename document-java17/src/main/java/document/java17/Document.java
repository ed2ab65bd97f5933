package document.java17;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A finite, immutable document tree whose leaves hold values of type `A`.
///
/// The variant family is closed:
/// - [Leaf] holds exactly one value
/// - [Horizontal] groups cells left to right
/// - [Vertical] groups cells top to bottom
/// - [Empty] means "nothing here" and is the identity of [DocumentMonoid#merge]
///
/// Equality is structural and cell order is significant. Every operation on a
/// document returns a new value; instances are never mutated.
///
/// ## Example
/// ```java
/// Document<String> grid = Document.vertical(
///     Document.horizontal(Document.leaf("A"), Document.leaf("B")),
///     Document.horizontal(Document.leaf("C"), Document.leaf("D")));
/// ```
public sealed interface Document<A> permits Document.Leaf, Document.Container, Document.Empty {

    /// A terminal node holding a single non-null value.
    record Leaf<A>(A value) implements Document<A> {
        public Leaf {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// An ordered grouping of cells. Zero, one or many cells are all legal.
    sealed interface Container<A> extends Document<A> permits Horizontal, Vertical {
        List<Document<A>> cells();

        Orientation orientation();
    }

    /// Cells laid out left to right.
    record Horizontal<A>(List<Document<A>> cells) implements Container<A> {
        public Horizontal {
            Objects.requireNonNull(cells, "cells must not be null");
            cells = List.copyOf(cells); // defensive copy
        }

        @Override
        public Orientation orientation() {
            return Orientation.HORIZONTAL;
        }
    }

    /// Cells laid out top to bottom.
    record Vertical<A>(List<Document<A>> cells) implements Container<A> {
        public Vertical {
            Objects.requireNonNull(cells, "cells must not be null");
            cells = List.copyOf(cells); // defensive copy
        }

        @Override
        public Orientation orientation() {
            return Orientation.VERTICAL;
        }
    }

    /// The nullary variant. All instances are equal.
    record Empty<A>() implements Document<A> {
        private static final Empty<?> INSTANCE = new Empty<>();

        @SuppressWarnings("unchecked")
        static <A> Empty<A> instance() {
            return (Empty<A>) INSTANCE;
        }
    }

    static <A> Document<A> leaf(A value) {
        return new Leaf<>(value);
    }

    @SafeVarargs
    static <A> Document<A> horizontal(Document<A>... cells) {
        return new Horizontal<>(Arrays.asList(cells));
    }

    static <A> Document<A> horizontal(List<Document<A>> cells) {
        return new Horizontal<>(cells);
    }

    @SafeVarargs
    static <A> Document<A> vertical(Document<A>... cells) {
        return new Vertical<>(Arrays.asList(cells));
    }

    static <A> Document<A> vertical(List<Document<A>> cells) {
        return new Vertical<>(cells);
    }

    static <A> Document<A> empty() {
        return Empty.instance();
    }

    /// The leaf value, if this is a [Leaf].
    default Optional<A> asLeaf() {
        return this instanceof Leaf<A> leaf ? Optional.of(leaf.value()) : Optional.empty();
    }

    /// The cells, if this is a [Horizontal].
    default Optional<List<Document<A>>> asHorizontal() {
        return this instanceof Horizontal<A> horizontal ? Optional.of(horizontal.cells()) : Optional.empty();
    }

    /// The cells, if this is a [Vertical].
    default Optional<List<Document<A>>> asVertical() {
        return this instanceof Vertical<A> vertical ? Optional.of(vertical.cells()) : Optional.empty();
    }
}
