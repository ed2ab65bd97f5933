package document.java17.render;

import document.java17.Monoid;

/// Rendered extent of a document.
/// @param width widest row, in characters
/// @param height number of rows
/// @param leafCount number of leaves
public record DocumentSize(int width, int height, int leafCount) {

    public static final DocumentSize ZERO = new DocumentSize(0, 0, 0);

    /// Stacks sizes on top of each other: widest width, heights and leaf counts summed.
    private static final Monoid<DocumentSize> STACKING = new Monoid<>() {
        @Override
        public DocumentSize empty() {
            return ZERO;
        }

        @Override
        public DocumentSize combine(DocumentSize x, DocumentSize y) {
            return x.stack(y);
        }
    };

    public DocumentSize {
        if (width < 0 || height < 0 || leafCount < 0) {
            throw new IllegalArgumentException("size components must be non-negative: "
                + width + "x" + height + " (" + leafCount + " leaves)");
        }
    }

    public static Monoid<DocumentSize> monoid() {
        return STACKING;
    }

    /// Side by side: widths summed, tallest height.
    public DocumentSize beside(DocumentSize other) {
        return new DocumentSize(width + other.width, Math.max(height, other.height), leafCount + other.leafCount);
    }

    /// Top to bottom: widest width, heights summed.
    public DocumentSize stack(DocumentSize other) {
        return new DocumentSize(Math.max(width, other.width), height + other.height, leafCount + other.leafCount);
    }
}
