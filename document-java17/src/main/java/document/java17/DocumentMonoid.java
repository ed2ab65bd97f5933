package document.java17;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Merging of documents, with [Document.Empty] as the identity.
///
/// Rules, first match wins:
/// - `Empty` on either side yields the other operand
/// - two `Horizontal`s concatenate their cells into one `Horizontal`
/// - two `Vertical`s concatenate their cells into one `Vertical`
/// - otherwise both operands are stacked into one `Vertical` by their rows,
///   where a container's rows are its cells and a leaf is its own single row
///
/// Flattening containers in the last rule keeps `merge` associative: the rows
/// of a merge are always the rows of its left operand followed by those of
/// its right operand. The price is layout: a `Horizontal` merged with anything
/// other than a `Horizontal` or `Empty` loses its row grouping, so
/// `merge(horizontal(a, b), leaf(c))` is `Vertical[a, b, c]`, not
/// `Vertical[Horizontal[a, b], c]`.
///
/// ```java
/// merge(horizontal(leaf("A")), horizontal(leaf("B")));  // Horizontal[A, B]
/// merge(leaf("x"), leaf("y"));                          // Vertical[x, y]
/// merge(leaf("x"), vertical(leaf("y"), leaf("z")));     // Vertical[x, y, z]
/// ```
public final class DocumentMonoid<A> implements Monoid<Document<A>> {

    private static final DocumentMonoid<?> INSTANCE = new DocumentMonoid<>();

    private DocumentMonoid() {}

    @SuppressWarnings("unchecked")
    public static <A> DocumentMonoid<A> instance() {
        return (DocumentMonoid<A>) INSTANCE;
    }

    @Override
    public Document<A> empty() {
        return Document.empty();
    }

    @Override
    public Document<A> combine(Document<A> x, Document<A> y) {
        return merge(x, y);
    }

    public static <A> Document<A> merge(Document<A> x, Document<A> y) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x instanceof Document.Empty<A>) {
            return y;
        }
        if (y instanceof Document.Empty<A>) {
            return x;
        }
        if (x instanceof Document.Horizontal<A> left && y instanceof Document.Horizontal<A> right) {
            return Document.horizontal(concat(left.cells(), right.cells()));
        }
        if (x instanceof Document.Vertical<A> left && y instanceof Document.Vertical<A> right) {
            return Document.vertical(concat(left.cells(), right.cells()));
        }
        return Document.vertical(concat(rows(x), rows(y)));
    }

    /// Merges every document in order, starting from `Empty`.
    public static <A> Document<A> mergeAll(Iterable<? extends Document<A>> docs) {
        return DocumentMonoid.<A>instance().combineAll(docs);
    }

    private static <A> List<Document<A>> rows(Document<A> doc) {
        if (doc instanceof Document.Container<A> container) {
            return container.cells();
        }
        return List.of(doc);
    }

    private static <A> List<Document<A>> concat(List<Document<A>> first, List<Document<A>> second) {
        final List<Document<A>> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
