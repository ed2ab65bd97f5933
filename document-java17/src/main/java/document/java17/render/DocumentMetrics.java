package document.java17.render;

import document.java17.Document;
import document.java17.DocumentAlgebra;
import document.java17.DocumentSchemes;

import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/// Measures a document as a [DocumentSize].
///
/// A leaf is one row as wide as its measured value. Horizontal cells sit side
/// by side, vertical cells stack, and `Empty` measures zero.
public final class DocumentMetrics<A> implements DocumentAlgebra<A, DocumentSize> {

    private static final DocumentMetrics<String> STRINGS = new DocumentMetrics<>(String::length);

    private final ToIntFunction<? super A> width;

    private DocumentMetrics(ToIntFunction<? super A> width) {
        this.width = width;
    }

    /// Measures leaves by their string length.
    public static DocumentMetrics<String> strings() {
        return STRINGS;
    }

    /// Measures leaves with `width`.
    public static <A> DocumentMetrics<A> of(ToIntFunction<? super A> width) {
        Objects.requireNonNull(width, "width must not be null");
        return new DocumentMetrics<>(width);
    }

    public static DocumentSize measure(Document<String> doc) {
        return DocumentSchemes.cata(doc, STRINGS);
    }

    public DocumentSize apply(Document<A> doc) {
        return DocumentSchemes.cata(doc, this);
    }

    @Override
    public DocumentSize leaf(A value) {
        return new DocumentSize(width.applyAsInt(value), 1, 1);
    }

    @Override
    public DocumentSize horizontal(List<DocumentSize> cells) {
        DocumentSize acc = DocumentSize.ZERO;
        for (final DocumentSize cell : cells) {
            acc = acc.beside(cell);
        }
        return acc;
    }

    @Override
    public DocumentSize vertical(List<DocumentSize> cells) {
        DocumentSize acc = DocumentSize.ZERO;
        for (final DocumentSize cell : cells) {
            acc = acc.stack(cell);
        }
        return acc;
    }

    @Override
    public DocumentSize empty() {
        return DocumentSize.ZERO;
    }
}
