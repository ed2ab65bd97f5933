package document.java17;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;

import java.util.List;

/// Generators for finite documents of bounded depth.
public final class DocumentArbitraries {

    private DocumentArbitraries() {}

    /// Documents at most `depth` container levels deep, with up to four cells per container.
    public static <A> Arbitrary<Document<A>> documents(Arbitrary<A> leaves, int depth) {
        final Arbitrary<Document<A>> leaf = leaves.map(Document::leaf);
        final Arbitrary<Document<A>> empty = Arbitraries.just(Document.<A>empty());
        if (depth <= 0) {
            return Arbitraries.oneOf(leaf, leaf, leaf, empty);
        }
        final Arbitrary<List<Document<A>>> cells = documents(leaves, depth - 1).list().ofMaxSize(4);
        final Arbitrary<Document<A>> horizontal = cells.map(Document::horizontal);
        final Arbitrary<Document<A>> vertical = cells.map(Document::vertical);
        return Arbitraries.oneOf(leaf, leaf, empty, horizontal, vertical);
    }

    public static Arbitrary<Document<Integer>> integerDocuments() {
        return documents(Arbitraries.integers().between(-1_000, 1_000), 3);
    }

    public static Arbitrary<Document<String>> stringDocuments() {
        return documents(Arbitraries.strings().alpha().ofMaxLength(6), 3);
    }
}
