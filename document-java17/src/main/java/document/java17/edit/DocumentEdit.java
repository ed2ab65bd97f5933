package document.java17.edit;

import java.util.Objects;

/// One edit instruction against the grid view of a document.
///
/// Instructions are plain data. [DocumentEdits#apply] interprets them against
/// a document; [DocumentEdits#describe] renders them for audit logs.
public sealed interface DocumentEdit<A> permits DocumentEdit.Insert, DocumentEdit.Delete, DocumentEdit.Update {

    Position position();

    /// Inserts a leaf before the cell at `position`.
    record Insert<A>(A value, Position position) implements DocumentEdit<A> {
        public Insert {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }
    }

    /// Removes the cell at `position`.
    record Delete<A>(Position position) implements DocumentEdit<A> {
        public Delete {
            Objects.requireNonNull(position, "position must not be null");
        }
    }

    /// Replaces the cell at `position` with a leaf.
    record Update<A>(Position position, A value) implements DocumentEdit<A> {
        public Update {
            Objects.requireNonNull(position, "position must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    static <A> DocumentEdit<A> insert(A value, Position position) {
        return new Insert<>(value, position);
    }

    static <A> DocumentEdit<A> delete(Position position) {
        return new Delete<>(position);
    }

    static <A> DocumentEdit<A> update(Position position, A value) {
        return new Update<>(position, value);
    }
}
