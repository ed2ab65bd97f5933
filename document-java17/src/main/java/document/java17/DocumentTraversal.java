package document.java17;

import document.java17.effect.Effect;
import document.java17.effect.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/// Effectful, order-preserving traversal of a [Document].
///
/// `traverse` threads an [Effect] through every leaf and rebuilds a tree of the
/// same shape inside that effect. Guarantees:
/// - leaves are visited left to right, depth first, and their effects are
///   sequenced in that order whatever the effect does internally
/// - a leaf's function is only invoked from inside the `bind` continuation of
///   everything to its left, so an effect that stops binding on failure stops
///   the traversal at the first failing leaf
/// - a failure is the whole result; no partially rebuilt tree escapes
///
/// Cells of one container are sequenced by a loop. Nested containers recurse
/// once per level.
///
/// ```java
/// Document<String> doc = Document.horizontal(Document.leaf("1"), Document.leaf("x"));
/// Outcome<TraversalFailure, Document<Integer>> parsed = Outcome.narrow(
///     DocumentTraversal.traverse(Outcome.effect(), doc, Outcome.<String, Integer>catching(Integer::parseInt)));
/// // Failure[error=TraversalFailure[message=For input string: "x", ...]]
/// ```
public final class DocumentTraversal {

    private static final Logger LOG = Logger.getLogger(DocumentTraversal.class.getName());

    private DocumentTraversal() {}

    /// Applies `f` to every leaf inside `effect`.
    /// @param effect the effect instance sequencing leaf results
    /// @param doc the document to traverse
    /// @param f the effectful leaf function
    /// @return the rebuilt document inside the effect
    /// @throws NullPointerException if any argument is null
    public static <F, A, B> Kind<F, Document<B>> traverse(Effect<F> effect,
                                                          Document<A> doc,
                                                          Function<? super A, ? extends Kind<F, B>> f) {
        Objects.requireNonNull(effect, "effect must not be null");
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(f, "f must not be null");
        LOG.fine(() -> "Traversing document with effect " + effect.getClass().getName());
        return traverseNode(effect, doc, f);
    }

    /// Turns a document of effects into an effect producing a document.
    public static <F, A> Kind<F, Document<A>> sequence(Effect<F> effect, Document<? extends Kind<F, A>> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        @SuppressWarnings("unchecked") final Document<Kind<F, A>> effects = (Document<Kind<F, A>>) doc;
        return traverse(effect, effects, Function.identity());
    }

    private static <F, A, B> Kind<F, Document<B>> traverseNode(Effect<F> effect,
                                                               Document<A> doc,
                                                               Function<? super A, ? extends Kind<F, B>> f) {
        if (doc instanceof Document.Leaf<A> leaf) {
            // f runs inside bind at every position, the root included
            return effect.bind(effect.wrap(leaf.value()), value -> {
                final Kind<F, B> result = f.apply(value);
                return effect.map(result, Document::leaf);
            });
        }
        if (doc instanceof Document.Empty<A>) {
            return effect.wrap(Document.empty());
        }
        if (doc instanceof Document.Container<A> container) {
            final Orientation orientation = container.orientation();
            return effect.map(traverseCells(effect, container.cells(), f), orientation::of);
        }
        throw new AssertionError("unreachable: " + doc);
    }

    private static <F, A, B> Kind<F, List<Document<B>>> traverseCells(Effect<F> effect,
                                                                     List<Document<A>> cells,
                                                                     Function<? super A, ? extends Kind<F, B>> f) {
        Kind<F, Chain<Document<B>>> acc = effect.wrap(Chain.start());
        for (final Document<A> cell : cells) {
            acc = effect.bind(acc, done -> effect.map(traverseNode(effect, cell, f), done::append));
        }
        return effect.map(acc, Chain::toList);
    }

    /// Persistent snoc-list, so an effect that runs a continuation more than
    /// once never observes another run's cells.
    private static final class Chain<T> {
        private static final Chain<?> START = new Chain<>(null, null, 0);

        private final T last;
        private final Chain<T> init;
        private final int size;

        private Chain(T last, Chain<T> init, int size) {
            this.last = last;
            this.init = init;
            this.size = size;
        }

        @SuppressWarnings("unchecked")
        static <T> Chain<T> start() {
            return (Chain<T>) START;
        }

        Chain<T> append(T value) {
            return new Chain<>(value, this, size + 1);
        }

        List<T> toList() {
            final List<T> out = new ArrayList<>(Collections.nCopies(size, null));
            Chain<T> cursor = this;
            for (int i = size - 1; i >= 0; i--) {
                out.set(i, cursor.last);
                cursor = cursor.init;
            }
            return out;
        }
    }
}
