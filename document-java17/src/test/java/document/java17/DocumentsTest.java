package document.java17;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentsTest extends DocumentTestBase {

    private static final Document<String> GRID = Document.vertical(
        Document.horizontal(leaf("A"), leaf("B")),
        Document.horizontal(leaf("C"), Document.vertical(leaf("D"), leaf("E"))),
        Document.empty());

    @Test
    void leafRejectsNull() {
        assertThatThrownBy(() -> Document.leaf(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("value");
    }

    @Test
    void containersCopyTheirCells() {
        final List<Document<String>> cells = new java.util.ArrayList<>(List.of(leaf("A")));
        final Document<String> doc = Document.horizontal(cells);
        cells.add(leaf("B"));
        assertThat(doc).isEqualTo(Document.horizontal(leaf("A")));
    }

    @Test
    void emptyInstancesAreEqual() {
        assertThat(Document.<String>empty()).isEqualTo(new Document.Empty<String>());
        assertThat(Document.<String>horizontal()).isNotEqualTo(Document.<String>vertical());
    }

    @Test
    void accessorsMatchTheVariant() {
        assertThat(leaf("x").asLeaf()).contains("x");
        assertThat(leaf("x").asHorizontal()).isEmpty();
        assertThat(Document.horizontal(leaf("x")).asHorizontal()).contains(List.of(leaf("x")));
        assertThat(Document.vertical(leaf("x")).asVertical()).contains(List.of(leaf("x")));
        assertThat(Document.<String>empty().asLeaf()).isEmpty();
    }

    @Test
    void foldSumsHorizontalLeaves() {
        final Document<Integer> doc = Document.horizontal(leaf(1), leaf(2), leaf(3));
        final Function<List<Integer>, Integer> sum = cells -> cells.stream().mapToInt(Integer::intValue).sum();
        final int total = DocumentSchemes.fold(doc, Function.<Integer>identity(), sum, sum);
        assertThat(total).isEqualTo(6);
    }

    @Test
    void foldReducesEmptyAsHorizontalWithoutCells() {
        final String rendered = DocumentSchemes.<String, String>fold(Document.empty(), v -> v,
            cells -> "h" + cells.size(), cells -> "v" + cells.size());
        assertThat(rendered).isEqualTo("h0");
    }

    @Test
    void cataPassesCellResultsInOrder() {
        final String rendered = DocumentSchemes.cata(GRID, DocumentAlgebra.<String, String>of(
            v -> v,
            cells -> "H(" + String.join(",", cells) + ")",
            cells -> "V(" + String.join(",", cells) + ")",
            () -> "E"));
        assertThat(rendered).isEqualTo("V(H(A,B),H(C,V(D,E)),E)");
    }

    @Test
    void anaUnfoldsInPreOrder() {
        final List<Integer> seen = new java.util.ArrayList<>();
        final Document<String> doc = DocumentSchemes.<Integer, String>ana(1, n -> {
            seen.add(n);
            return n > 3 ? Unfold.emit("n" + n) : Unfold.horizontal(List.of(n * 2, n * 2 + 1));
        });
        assertThat(doc).isEqualTo(Document.horizontal(
            Document.horizontal(leaf("n4"), leaf("n5")),
            Document.horizontal(leaf("n6"), leaf("n7"))));
        assertThat(seen).containsExactly(1, 2, 4, 5, 3, 6, 7);
    }

    @Test
    void anaWithNoSeedsBuildsAnEmptyContainer() {
        final Document<String> doc = DocumentSchemes.<String, String>ana("root", s -> Unfold.vertical(List.of()));
        assertThat(doc).isEqualTo(Document.<String>vertical());
    }

    @Test
    void mergeConcatenatesMatchingContainers() {
        assertThat(DocumentMonoid.merge(Document.horizontal(leaf("A")), Document.horizontal(leaf("B"))))
            .isEqualTo(Document.horizontal(leaf("A"), leaf("B")));
        assertThat(DocumentMonoid.merge(Document.vertical(leaf("A")), Document.vertical(leaf("B"))))
            .isEqualTo(Document.vertical(leaf("A"), leaf("B")));
    }

    @Test
    void mergeWithEmptyOnEitherSideIsTheOtherOperand() {
        assertThat(DocumentMonoid.merge(Document.empty(), leaf("x"))).isEqualTo(leaf("x"));
        assertThat(DocumentMonoid.merge(leaf("x"), Document.empty())).isEqualTo(leaf("x"));
    }

    @Test
    void mergeStacksMismatchedOperandsByRows() {
        assertThat(DocumentMonoid.merge(leaf("x"), leaf("y")))
            .isEqualTo(Document.vertical(leaf("x"), leaf("y")));
        assertThat(DocumentMonoid.merge(leaf("x"), Document.vertical(leaf("y"), leaf("z"))))
            .isEqualTo(Document.vertical(leaf("x"), leaf("y"), leaf("z")));
        assertThat(DocumentMonoid.merge(Document.horizontal(leaf("a")), Document.vertical(leaf("b"))))
            .isEqualTo(Document.vertical(leaf("a"), leaf("b")));
    }

    @Test
    void mergeFlattensHorizontalRowGroupingAgainstLeaf() {
        assertThat(DocumentMonoid.merge(Document.horizontal(leaf("a"), leaf("b")), leaf("c")))
            .isEqualTo(Document.vertical(leaf("a"), leaf("b"), leaf("c")));
    }

    @Test
    void mergeAllMergesInOrder() {
        final Document<String> merged = DocumentMonoid.mergeAll(List.of(
            Document.horizontal(leaf("A")), Document.<String>empty(), Document.horizontal(leaf("B"), leaf("C"))));
        assertThat(merged).isEqualTo(Document.horizontal(leaf("A"), leaf("B"), leaf("C")));
        assertThat(DocumentMonoid.<String>mergeAll(List.of())).isEqualTo(Document.empty());
    }

    @Test
    void zipWithPairsMatchingShapesAndTruncates() {
        final Document<Integer> left = Document.horizontal(leaf(1), leaf(2), leaf(3));
        final Document<String> right = Document.horizontal(leaf("a"), leaf("b"));
        assertThat(Documents.zipWith(left, right, (i, s) -> s + i))
            .isEqualTo(Document.horizontal(leaf("a1"), leaf("b2")));
    }

    @Test
    void zipWithMismatchedShapesIsEmpty() {
        assertThat(Documents.zipWith(Document.horizontal(leaf(1)), Document.vertical(leaf(2)), Integer::sum))
            .isEqualTo(Document.empty());
        assertThat(Documents.zipWith(leaf(1), Document.<Integer>empty(), Integer::sum))
            .isEqualTo(Document.empty());
    }

    @Test
    void map2CombinesEveryPair() {
        final Document<String> doc = Documents.map2(Document.horizontal(leaf(1), leaf(2)), Document.vertical(leaf("a"), leaf("b")),
            (i, s) -> s + i);
        assertThat(doc).isEqualTo(Document.horizontal(
            Document.vertical(leaf("a1"), leaf("b1")),
            Document.vertical(leaf("a2"), leaf("b2"))));
    }

    @Test
    void apAppliesEachFunctionToEachValue() {
        final Document<Function<Integer, Integer>> functions = Document.horizontal(
            Document.<Function<Integer, Integer>>leaf(i -> i + 1),
            Document.<Function<Integer, Integer>>leaf(i -> i * 10));
        assertThat(Documents.ap(functions, Document.vertical(leaf(1), leaf(2))))
            .isEqualTo(Document.horizontal(
                Document.vertical(leaf(2), leaf(3)),
                Document.vertical(leaf(10), leaf(20))));
    }

    @Test
    void sequenceOfLeavesIsOneLeafOfAList() {
        assertThat(Documents.sequence(List.of(leaf(1), leaf(2), leaf(3))))
            .isEqualTo(Document.leaf(List.of(1, 2, 3)));
        assertThat(Documents.<Integer>sequence(List.of())).isEqualTo(Document.leaf(List.of()));
    }

    @Test
    void leafQueriesFollowDocumentOrder() {
        assertThat(Documents.leaves(GRID)).containsExactly("A", "B", "C", "D", "E");
        assertThat(Documents.filterLeaves(GRID, v -> v.compareTo("C") >= 0)).containsExactly("C", "D", "E");
        assertThat(Documents.firstLeaf(GRID)).contains("A");
        assertThat(Documents.firstLeaf(Document.vertical(Document.empty(), Document.<String>horizontal()))).isEmpty();
        assertThat(Documents.leafCount(GRID)).isEqualTo(5);
    }

    @Test
    void depthCountsLevels() {
        assertThat(Documents.depth(Document.empty())).isZero();
        assertThat(Documents.depth(leaf("x"))).isEqualTo(1);
        assertThat(Documents.depth(Document.<String>horizontal())).isEqualTo(1);
        assertThat(Documents.depth(GRID)).isEqualTo(4);
    }

    @Test
    void getFollowsChildIndices() {
        assertThat(Documents.get(GRID, DocumentPath.root())).contains(GRID);
        assertThat(Documents.get(GRID, DocumentPath.of(1, 1, 0))).contains(leaf("D"));
        assertThat(Documents.get(GRID, DocumentPath.of(0, 2))).isEmpty();
        assertThat(Documents.get(GRID, DocumentPath.of(0, 0, 0))).isEmpty();
    }

    @Test
    void modifyAtChangesOnlyTheAddressedSubtree() {
        final Document<String> modified = Documents.modifyAt(GRID, DocumentPath.of(1, 1), String::toLowerCase);
        assertThat(modified).isEqualTo(Document.vertical(
            Document.horizontal(leaf("A"), leaf("B")),
            Document.horizontal(leaf("C"), Document.vertical(leaf("d"), leaf("e"))),
            Document.empty()));
    }

    @Test
    void modifyAtMissingPathLeavesDocumentUnchanged() {
        assertThat(Documents.modifyAt(GRID, DocumentPath.of(9), String::toLowerCase)).isSameAs(GRID);
    }

    @Test
    void withPathsLocatesEveryLeaf() {
        final List<Located<String>> located = Documents.leaves(Documents.withPaths(GRID));
        assertThat(located).extracting(l -> l.path().toString())
            .containsExactly("/0/0", "/0/1", "/1/0", "/1/1/0", "/1/1/1");
        assertThat(located).extracting(Located::value).containsExactly("A", "B", "C", "D", "E");
    }

    @Test
    void documentPathRendersAndParses() {
        assertThat(DocumentPath.root().toString()).isEmpty();
        assertThat(DocumentPath.of(0, 2).toString()).isEqualTo("/0/2");
        assertThat(DocumentPath.parse("/3/1")).isEqualTo(DocumentPath.of(3, 1));
        assertThat(DocumentPath.parse("")).isEqualTo(DocumentPath.root());
        assertThatThrownBy(() -> DocumentPath.parse("/x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DocumentPath.of(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void monoidInstanceAgreesWithMerge() {
        final Monoid<Document<String>> monoid = DocumentMonoid.instance();
        assertThat(monoid.empty()).isEqualTo(Document.empty());
        assertThat(monoid.combine(leaf("a"), leaf("b"))).isEqualTo(DocumentMonoid.merge(leaf("a"), leaf("b")));
        assertThat(monoid.combineAll(List.of(leaf("a"), leaf("b"), leaf("c"))))
            .isEqualTo(Document.vertical(leaf("a"), leaf("b"), leaf("c")));
    }

    @Test
    void unfoldRejectsNullCoalgebraResult() {
        assertThatThrownBy(() -> DocumentSchemes.<String, String>ana("s", s -> null))
            .isInstanceOf(NullPointerException.class);
    }
}
