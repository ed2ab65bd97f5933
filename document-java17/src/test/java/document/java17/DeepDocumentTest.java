package document.java17;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Documents far deeper than the Java call stack would allow for naive recursion.
class DeepDocumentTest extends DocumentTestBase {

    private static final int DEPTH = 50_000;

    private static Document<Integer> nested(int depth) {
        Document<Integer> doc = leaf(depth);
        for (int level = 1; level < depth; level++) {
            doc = level % 2 == 0 ? Document.horizontal(doc) : Document.vertical(doc, Document.empty());
        }
        return doc;
    }

    @Test
    void cataHandlesDeepDocuments() {
        final Document<Integer> doc = nested(DEPTH);
        assertThat(Documents.depth(doc)).isEqualTo(DEPTH);
        assertThat(Documents.leafCount(doc)).isEqualTo(1);
    }

    @Test
    void mapHandlesDeepDocuments() {
        final Document<String> mapped = Documents.map(nested(DEPTH), i -> "v" + i);
        assertThat(Documents.depth(mapped)).isEqualTo(DEPTH);
        assertThat(Documents.firstLeaf(mapped)).contains("v" + DEPTH);
    }

    @Test
    void anaHandlesDeepDocuments() {
        final Document<Integer> doc = DocumentSchemes.<Integer, Integer>ana(1,
            n -> n >= DEPTH ? Unfold.emit(n) : Unfold.vertical(List.of(n + 1)));
        assertThat(Documents.depth(doc)).isEqualTo(DEPTH);
        assertThat(Documents.leaves(doc)).containsExactly(DEPTH);
    }

    @Test
    void leafWalksHandleDeepDocuments() {
        final Document<Integer> doc = nested(DEPTH);
        assertThat(Documents.foldLeft(doc, 0, Integer::sum)).isEqualTo(DEPTH);
        assertThat(Documents.get(doc, DocumentPath.of(0, 0, 0))).isPresent();
    }
}
