package document.java17;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Recursion schemes over [Document]: catamorphism (tear-down) and
/// anamorphism (build-up).
///
/// Both run on an explicit work stack, so the depth of a tree is limited by
/// heap rather than by the Java call stack.
///
/// ```java
/// Document<Integer> doc = Document.horizontal(Document.leaf(1), Document.leaf(2), Document.leaf(3));
/// int sum = DocumentSchemes.fold(doc, v -> v, cells -> cells.stream().mapToInt(i -> i).sum(),
///     cells -> cells.stream().mapToInt(i -> i).sum()); // 6
/// ```
public final class DocumentSchemes {

    private static final Logger LOG = Logger.getLogger(DocumentSchemes.class.getName());

    private DocumentSchemes() {}

    /// Reduces `doc` bottom-up. Cells are reduced first, in order, then the
    /// container's algebra is applied to their results.
    /// @param doc the document to reduce
    /// @param algebra one reduction per variant
    /// @return the reduced value
    /// @throws NullPointerException if doc or algebra is null
    public static <A, R> R cata(Document<A> doc, DocumentAlgebra<? super A, R> algebra) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(algebra, "algebra must not be null");

        final Deque<CataFrame<A, R>> stack = new ArrayDeque<>();
        Document<A> pending = doc;
        R reduced = null;
        boolean hasReduced = false;

        while (true) {
            if (pending != null) {
                if (pending instanceof Document.Container<A> container) {
                    stack.push(new CataFrame<>(container));
                } else {
                    reduced = reduceTerminal(pending, algebra);
                    hasReduced = true;
                }
                pending = null;
            }

            if (hasReduced) {
                if (stack.isEmpty()) {
                    return reduced;
                }
                stack.peek().results.add(reduced);
                hasReduced = false;
            }

            final CataFrame<A, R> top = stack.peek();
            if (top.next < top.container.cells().size()) {
                pending = top.container.cells().get(top.next++);
            } else {
                stack.pop();
                final List<R> cells = Collections.unmodifiableList(top.results);
                reduced = top.container.orientation() == Orientation.HORIZONTAL
                    ? algebra.horizontal(cells)
                    : algebra.vertical(cells);
                hasReduced = true;
            }
        }
    }

    /// [#cata] with the algebra given as four functions.
    public static <A, R> R cata(Document<A> doc,
                                Function<? super A, ? extends R> leafAlg,
                                Function<? super List<R>, ? extends R> horizontalAlg,
                                Function<? super List<R>, ? extends R> verticalAlg,
                                Supplier<? extends R> emptyAlg) {
        return cata(doc, DocumentAlgebra.<A, R>of(leafAlg, horizontalAlg, verticalAlg, emptyAlg));
    }

    /// [#cata] where [Document.Empty] reduces as a horizontal container with no cells.
    public static <A, R> R fold(Document<A> doc,
                                Function<? super A, ? extends R> f,
                                Function<? super List<R>, ? extends R> g,
                                Function<? super List<R>, ? extends R> h) {
        Objects.requireNonNull(g, "g must not be null");
        final List<R> none = List.of();
        return DocumentSchemes.<A, R>cata(doc, f, g, h, () -> g.apply(none));
    }

    /// Builds a document from `seed`. The coalgebra is called once per node, a
    /// parent before its children and children left to right.
    ///
    /// The coalgebra must reach an [Unfold.Emit] (or an empty expansion) for
    /// every seed it produces; no cycle or depth detection happens here.
    /// @param seed the root seed
    /// @param coalgebra decides whether a seed becomes a leaf or a container
    /// @return the unfolded document
    /// @throws NullPointerException if coalgebra is null or returns null
    public static <S, A> Document<A> ana(S seed, Function<? super S, Unfold<S, A>> coalgebra) {
        Objects.requireNonNull(coalgebra, "coalgebra must not be null");
        LOG.finer(() -> "Unfolding document from seed: " + seed);

        final Deque<AnaFrame<S, A>> stack = new ArrayDeque<>();
        S pendingSeed = seed;
        boolean hasSeed = true;
        Document<A> built = null;
        boolean hasBuilt = false;

        while (true) {
            if (hasSeed) {
                final Unfold<S, A> step = Objects.requireNonNull(coalgebra.apply(pendingSeed),
                    "coalgebra must not return null");
                if (step instanceof Unfold.Emit<S, A> emit) {
                    built = Document.leaf(emit.value());
                    hasBuilt = true;
                } else if (step instanceof Unfold.Expand<S, A> expand) {
                    stack.push(new AnaFrame<>(expand));
                } else {
                    throw new AssertionError("unreachable: " + step);
                }
                hasSeed = false;
            }

            if (hasBuilt) {
                if (stack.isEmpty()) {
                    return built;
                }
                stack.peek().built.add(built);
                hasBuilt = false;
            }

            final AnaFrame<S, A> top = stack.peek();
            if (top.next < top.expand.seeds().size()) {
                pendingSeed = top.expand.seeds().get(top.next++);
                hasSeed = true;
            } else {
                stack.pop();
                built = top.expand.orientation().of(top.built);
                hasBuilt = true;
            }
        }
    }

    private static <A, R> R reduceTerminal(Document<A> doc, DocumentAlgebra<? super A, R> algebra) {
        if (doc instanceof Document.Leaf<A> leaf) {
            return algebra.leaf(leaf.value());
        }
        if (doc instanceof Document.Empty<A>) {
            return algebra.empty();
        }
        throw new AssertionError("unreachable: containers are expanded by the caller");
    }

    /// A container whose cells are being reduced.
    private static final class CataFrame<A, R> {
        final Document.Container<A> container;
        final List<R> results;
        int next;

        CataFrame(Document.Container<A> container) {
            this.container = container;
            this.results = new ArrayList<>(container.cells().size());
        }
    }

    /// An expansion whose child seeds are being unfolded.
    private static final class AnaFrame<S, A> {
        final Unfold.Expand<S, A> expand;
        final List<Document<A>> built;
        int next;

        AnaFrame(Unfold.Expand<S, A> expand) {
            this.expand = expand;
            this.built = new ArrayList<>(expand.seeds().size());
        }
    }
}
