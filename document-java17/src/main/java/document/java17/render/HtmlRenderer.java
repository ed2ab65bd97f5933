package document.java17.render;

import document.java17.Document;
import document.java17.DocumentAlgebra;
import document.java17.DocumentSchemes;

import java.util.List;

/// HTML rendering. Leaf values are escaped and wrapped in `<span>`; containers
/// become `<div>`s classed `horizontal` or `vertical`.
public final class HtmlRenderer<A> implements DocumentAlgebra<A, String> {

    private static final HtmlRenderer<?> INSTANCE = new HtmlRenderer<>();

    private HtmlRenderer() {}

    @SuppressWarnings("unchecked")
    public static <A> HtmlRenderer<A> instance() {
        return (HtmlRenderer<A>) INSTANCE;
    }

    public static <A> String render(Document<A> doc) {
        return DocumentSchemes.cata(doc, HtmlRenderer.<A>instance());
    }

    @Override
    public String leaf(A value) {
        return "<span>" + escape(String.valueOf(value)) + "</span>";
    }

    @Override
    public String horizontal(List<String> cells) {
        return "<div class='horizontal'>" + String.join("", cells) + "</div>";
    }

    @Override
    public String vertical(List<String> cells) {
        return "<div class='vertical'>" + String.join("", cells) + "</div>";
    }

    @Override
    public String empty() {
        return "<div class='empty'></div>";
    }

    static String escape(String text) {
        final StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
