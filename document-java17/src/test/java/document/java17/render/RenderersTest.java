package document.java17.render;

import document.java17.Document;
import document.java17.DocumentTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RenderersTest extends DocumentTestBase {

    private static final Document<String> DOC = Document.vertical(
        Document.horizontal(leaf("A"), leaf("BB")),
        Document.horizontal(leaf("<C>"), Document.empty()));

    @Test
    void textRendererJoinsCells() {
        assertThat(TextRenderer.render(DOC)).isEqualTo("[A] | [BB]\n[<C>] | ∅");
        assertThat(TextRenderer.render(Document.empty())).isEqualTo("∅");
    }

    @Test
    void htmlRendererEscapesLeafValues() {
        assertThat(HtmlRenderer.render(DOC)).isEqualTo(
            "<div class='vertical'>"
                + "<div class='horizontal'><span>A</span><span>BB</span></div>"
                + "<div class='horizontal'><span>&lt;C&gt;</span><div class='empty'></div></div>"
                + "</div>");
    }

    @Test
    void outlineRendererIndentsTwoSpacesPerLevel() {
        assertThat(OutlineRenderer.render(DOC)).isEqualTo(String.join("\n",
            "Vertical(",
            "  Horizontal(",
            "    Leaf(A)",
            "    Leaf(BB)",
            "  )",
            "  Horizontal(",
            "    Leaf(<C>)",
            "    Empty",
            "  )",
            ")"));
        assertThat(OutlineRenderer.render(Document.<String>horizontal())).isEqualTo("Horizontal()");
    }

    @Test
    void metricsMeasureWidthHeightAndLeaves() {
        assertThat(DocumentMetrics.measure(DOC)).isEqualTo(new DocumentSize(3, 2, 3));
        assertThat(DocumentMetrics.measure(Document.empty())).isEqualTo(DocumentSize.ZERO);
        assertThat(DocumentMetrics.<Integer>of(i -> 1).apply(Document.horizontal(leaf(10), leaf(20))))
            .isEqualTo(new DocumentSize(2, 1, 2));
    }

    @Test
    void documentSizeMonoidStacks() {
        assertThat(DocumentSize.monoid().combineAll(List.of(new DocumentSize(3, 1, 1), new DocumentSize(5, 2, 4))))
            .isEqualTo(new DocumentSize(5, 3, 5));
        assertThat(DocumentSize.monoid().combine(DocumentSize.ZERO, new DocumentSize(1, 1, 1)))
            .isEqualTo(new DocumentSize(1, 1, 1));
    }

    @Test
    void contentAggregateCollectsLeavesInOrder() {
        assertThat(ContentAggregate.aggregate(DOC)).isEqualTo(new ContentAggregate(List.of("A", "BB", "<C>"), 6));
        assertThat(ContentAggregate.aggregate(Document.empty())).isEqualTo(ContentAggregate.EMPTY);
    }
}
