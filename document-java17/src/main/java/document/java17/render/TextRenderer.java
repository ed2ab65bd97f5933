package document.java17.render;

import document.java17.Document;
import document.java17.DocumentAlgebra;
import document.java17.DocumentSchemes;

import java.util.List;

/// Plain-text rendering: a leaf is `[value]`, horizontal cells are joined with
/// `" | "`, vertical cells with a newline, and `Empty` is `∅`.
public final class TextRenderer<A> implements DocumentAlgebra<A, String> {

    private static final TextRenderer<?> INSTANCE = new TextRenderer<>();

    private TextRenderer() {}

    @SuppressWarnings("unchecked")
    public static <A> TextRenderer<A> instance() {
        return (TextRenderer<A>) INSTANCE;
    }

    public static <A> String render(Document<A> doc) {
        return DocumentSchemes.cata(doc, TextRenderer.<A>instance());
    }

    @Override
    public String leaf(A value) {
        return "[" + value + "]";
    }

    @Override
    public String horizontal(List<String> cells) {
        return String.join(" | ", cells);
    }

    @Override
    public String vertical(List<String> cells) {
        return String.join("\n", cells);
    }

    @Override
    public String empty() {
        return "∅";
    }
}
