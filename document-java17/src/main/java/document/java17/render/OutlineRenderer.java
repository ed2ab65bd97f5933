package document.java17.render;

import document.java17.Document;
import document.java17.DocumentAlgebra;
import document.java17.DocumentSchemes;

import java.util.List;

/// Indented outline, two spaces per level:
/// ```
/// Horizontal(
///   Leaf(A)
///   Vertical(
///     Leaf(B)
///   )
/// )
/// ```
/// A container without cells renders on one line, e.g. `Vertical()`.
public final class OutlineRenderer<A> implements DocumentAlgebra<A, String> {

    private static final String INDENT = "  ";
    private static final OutlineRenderer<?> INSTANCE = new OutlineRenderer<>();

    private OutlineRenderer() {}

    @SuppressWarnings("unchecked")
    public static <A> OutlineRenderer<A> instance() {
        return (OutlineRenderer<A>) INSTANCE;
    }

    public static <A> String render(Document<A> doc) {
        return DocumentSchemes.cata(doc, OutlineRenderer.<A>instance());
    }

    @Override
    public String leaf(A value) {
        return "Leaf(" + value + ")";
    }

    @Override
    public String horizontal(List<String> cells) {
        return block("Horizontal", cells);
    }

    @Override
    public String vertical(List<String> cells) {
        return block("Vertical", cells);
    }

    @Override
    public String empty() {
        return "Empty";
    }

    private static String block(String name, List<String> cells) {
        if (cells.isEmpty()) {
            return name + "()";
        }
        final StringBuilder sb = new StringBuilder(name).append("(\n");
        for (final String cell : cells) {
            for (final String line : cell.split("\n", -1)) {
                sb.append(INDENT).append(line).append('\n');
            }
        }
        return sb.append(')').toString();
    }
}
