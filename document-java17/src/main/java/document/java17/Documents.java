package document.java17;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Shape-preserving and leaf-oriented operations on [Document].
///
/// `map` and `flatMap` are defined through [DocumentSchemes#cata], so they
/// handle arbitrarily deep trees. The leaf walks behind `foldLeft`, `leaves`
/// and friends are iterative as well.
public final class Documents {

    private static final Logger LOG = Logger.getLogger(Documents.class.getName());

    private Documents() {}

    /// Applies `f` to every leaf, keeping the shape.
    ///
    /// `map(doc, identity)` equals `doc`, and `map(map(doc, f), g)` equals
    /// `map(doc, f.andThen(g))`.
    public static <A, B> Document<B> map(Document<A> doc, Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f must not be null");
        return DocumentSchemes.cata(doc, new Rebuild<A, B>() {
            @Override
            public Document<B> leaf(A value) {
                return Document.leaf(f.apply(value));
            }
        });
    }

    public static <A> Document<A> pure(A value) {
        return Document.leaf(value);
    }

    /// Replaces every leaf with the document `f` returns for it.
    public static <A, B> Document<B> flatMap(Document<A> doc, Function<? super A, ? extends Document<B>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return DocumentSchemes.cata(doc, new Rebuild<A, B>() {
            @Override
            public Document<B> leaf(A value) {
                return Objects.requireNonNull(f.apply(value), "f must not return null");
            }
        });
    }

    /// Every combination of a leaf of `da` with a leaf of `db`, nested in the shape of `da`.
    public static <A, B, C> Document<C> map2(Document<A> da, Document<B> db,
                                            BiFunction<? super A, ? super B, ? extends C> f) {
        Objects.requireNonNull(db, "db must not be null");
        Objects.requireNonNull(f, "f must not be null");
        return Documents.<A, C>flatMap(da, a -> Documents.<B, C>map(db, b -> f.apply(a, b)));
    }

    public static <A, B> Document<B> ap(Document<? extends Function<? super A, ? extends B>> docF, Document<A> docA) {
        Objects.requireNonNull(docA, "docA must not be null");
        @SuppressWarnings("unchecked")
        final Document<Function<? super A, ? extends B>> functions = (Document<Function<? super A, ? extends B>>) docF;
        return Documents.<Function<? super A, ? extends B>, B>flatMap(functions, fn -> Documents.<A, B>map(docA, fn));
    }

    /// Zips two documents cell by cell.
    ///
    /// Two leaves combine with `f`. Containers of the same orientation zip
    /// their cells pairwise and drop the surplus of the longer one. Any other
    /// pairing yields [Document.Empty].
    public static <A, B, C> Document<C> zipWith(Document<A> left, Document<B> right,
                                               BiFunction<? super A, ? super B, ? extends C> f) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(f, "f must not be null");
        if (left instanceof Document.Leaf<A> a && right instanceof Document.Leaf<B> b) {
            return Document.leaf(f.apply(a.value(), b.value()));
        }
        if (left instanceof Document.Container<A> l && right instanceof Document.Container<B> r
            && l.orientation() == r.orientation()) {
            final int size = Math.min(l.cells().size(), r.cells().size());
            final List<Document<C>> cells = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                cells.add(zipWith(l.cells().get(i), r.cells().get(i), f));
            }
            return l.orientation().of(cells);
        }
        return Document.empty();
    }

    /// Turns a list of documents into a document of lists: every combination of
    /// one leaf from each document, in order.
    public static <A> Document<List<A>> sequence(List<Document<A>> docs) {
        Objects.requireNonNull(docs, "docs must not be null");
        Document<List<A>> acc = pure(List.of());
        for (int i = docs.size() - 1; i >= 0; i--) {
            acc = map2(docs.get(i), acc, Documents::prepend);
        }
        return acc;
    }

    /// Folds leaf values left to right.
    public static <A, R> R foldLeft(Document<A> doc, R zero, BiFunction<? super R, ? super A, ? extends R> f) {
        Objects.requireNonNull(f, "f must not be null");
        R acc = zero;
        for (final A value : leaves(doc)) {
            acc = f.apply(acc, value);
        }
        return acc;
    }

    /// Folds leaf values right to left: `f(a1, f(a2, ... f(an, zero)))`.
    public static <A, R> R foldRight(Document<A> doc, R zero, BiFunction<? super A, ? super R, ? extends R> f) {
        Objects.requireNonNull(f, "f must not be null");
        final List<A> values = leaves(doc);
        R acc = zero;
        for (int i = values.size() - 1; i >= 0; i--) {
            acc = f.apply(values.get(i), acc);
        }
        return acc;
    }

    /// Leaf values in document order: left to right, depth first.
    public static <A> List<A> leaves(Document<A> doc) {
        return filterLeaves(doc, value -> true);
    }

    public static <A> List<A> filterLeaves(Document<A> doc, Predicate<? super A> predicate) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        final List<A> out = new ArrayList<>();
        final Deque<Document<A>> stack = new ArrayDeque<>();
        stack.push(doc);
        while (!stack.isEmpty()) {
            final Document<A> node = stack.pop();
            if (node instanceof Document.Leaf<A> leaf) {
                if (predicate.test(leaf.value())) {
                    out.add(leaf.value());
                }
            } else if (node instanceof Document.Container<A> container) {
                final List<Document<A>> cells = container.cells();
                for (int i = cells.size() - 1; i >= 0; i--) {
                    stack.push(cells.get(i));
                }
            }
        }
        return Collections.unmodifiableList(out);
    }

    public static <A> Optional<A> firstLeaf(Document<A> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        final Deque<Document<A>> stack = new ArrayDeque<>();
        stack.push(doc);
        while (!stack.isEmpty()) {
            final Document<A> node = stack.pop();
            if (node instanceof Document.Leaf<A> leaf) {
                return Optional.of(leaf.value());
            }
            if (node instanceof Document.Container<A> container) {
                final List<Document<A>> cells = container.cells();
                for (int i = cells.size() - 1; i >= 0; i--) {
                    stack.push(cells.get(i));
                }
            }
        }
        return Optional.empty();
    }

    public static <A> int leafCount(Document<A> doc) {
        return DocumentSchemes.<A, Integer>cata(doc,
            value -> 1,
            Documents::sum,
            Documents::sum,
            () -> 0);
    }

    /// Leaf 1, `Empty` 0, container one more than its deepest cell (1 when it has none).
    public static <A> int depth(Document<A> doc) {
        return DocumentSchemes.<A, Integer>cata(doc,
            value -> 1,
            Documents::containerDepth,
            Documents::containerDepth,
            () -> 0);
    }

    /// The node at `path`, if every index along it names an existing cell.
    public static <A> Optional<Document<A>> get(Document<A> doc, DocumentPath path) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Document<A> node = doc;
        for (final int index : path.indices()) {
            if (!(node instanceof Document.Container<A> container) || index >= container.cells().size()) {
                return Optional.empty();
            }
            node = container.cells().get(index);
        }
        return Optional.of(node);
    }

    /// Maps `f` over the subtree at `path`. A path that does not exist leaves
    /// `doc` as it is.
    public static <A> Document<A> modifyAt(Document<A> doc, DocumentPath path, UnaryOperator<A> f) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(f, "f must not be null");

        final List<Document.Container<A>> spine = new ArrayList<>(path.depth());
        Document<A> node = doc;
        for (final int index : path.indices()) {
            if (!(node instanceof Document.Container<A> container) || index >= container.cells().size()) {
                LOG.finer(() -> "No node at " + path + "; document unchanged");
                return doc;
            }
            spine.add(container);
            node = container.cells().get(index);
        }

        Document<A> rebuilt = map(node, f);
        for (int level = spine.size() - 1; level >= 0; level--) {
            final Document.Container<A> parent = spine.get(level);
            final List<Document<A>> cells = new ArrayList<>(parent.cells());
            cells.set(path.indices().get(level), rebuilt);
            rebuilt = parent.orientation().of(cells);
        }
        return rebuilt;
    }

    /// Pairs every leaf with its path from the root.
    public static <A> Document<Located<A>> withPaths(Document<A> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return locate(doc, DocumentPath.root());
    }

    private static <A> Document<Located<A>> locate(Document<A> node, DocumentPath path) {
        if (node instanceof Document.Leaf<A> leaf) {
            return Document.leaf(new Located<>(leaf.value(), path));
        }
        if (node instanceof Document.Empty<A>) {
            return Document.empty();
        }
        if (node instanceof Document.Container<A> container) {
            final List<Document<A>> cells = container.cells();
            final List<Document<Located<A>>> located = new ArrayList<>(cells.size());
            for (int i = 0; i < cells.size(); i++) {
                located.add(locate(cells.get(i), path.child(i)));
            }
            return container.orientation().of(located);
        }
        throw new AssertionError("unreachable: " + node);
    }

    private static <A> List<A> prepend(A head, List<A> tail) {
        final List<A> list = new ArrayList<>(tail.size() + 1);
        list.add(head);
        list.addAll(tail);
        return Collections.unmodifiableList(list);
    }

    private static int sum(List<Integer> values) {
        int total = 0;
        for (final int value : values) {
            total += value;
        }
        return total;
    }

    private static int containerDepth(List<Integer> cellDepths) {
        int max = 0;
        for (final int depth : cellDepths) {
            max = Math.max(max, depth);
        }
        return 1 + max;
    }

    /// Rebuilds containers around already-transformed cells; subclasses decide leaves.
    private abstract static class Rebuild<A, B> implements DocumentAlgebra<A, Document<B>> {
        @Override
        public Document<B> horizontal(List<Document<B>> cells) {
            return Document.horizontal(cells);
        }

        @Override
        public Document<B> vertical(List<Document<B>> cells) {
            return Document.vertical(cells);
        }

        @Override
        public Document<B> empty() {
            return Document.empty();
        }
    }
}
