package document.java17;

import java.util.List;

/// Layout direction of a [Document.Container].
public enum Orientation {
    HORIZONTAL,
    VERTICAL;

    /// Builds a container of this orientation holding `cells`.
    public <A> Document.Container<A> of(List<Document<A>> cells) {
        return this == HORIZONTAL ? new Document.Horizontal<>(cells) : new Document.Vertical<>(cells);
    }
}
