package document.java17.edit;

import document.java17.Document;
import document.java17.effect.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Interpreters for [DocumentEdit] instructions.
///
/// Edits address a document as a grid:
/// - the rows of a `Vertical` root are its cells, `Empty` has no rows, and any
///   other root is a single row
/// - the cells of a `Horizontal` row are its cells; any other row is its own
///   single cell
///
/// After an edit, untouched rows keep their structure. An edited row becomes a
/// `Horizontal` of its cells unless it was not horizontal and is left with one
/// cell, in which case it is that cell. A row left with no cells is dropped.
/// A `Vertical` root stays vertical; any other root collapses to `Empty`, its
/// single row, or a `Vertical` of its rows.
///
/// ```java
/// Document<String> doc = Document.horizontal(Document.leaf("A"), Document.leaf("B"));
/// DocumentEdits.apply(doc, List.of(DocumentEdit.insert("X", Position.of(0, 1))));
/// // Success[Horizontal[A, X, B]]
/// ```
public final class DocumentEdits {

    private static final Logger LOG = Logger.getLogger(DocumentEdits.class.getName());

    private DocumentEdits() {}

    /// Applies `edits` in order, stopping at the first one whose position does not exist.
    public static <A> Outcome<EditError, Document<A>> apply(Document<A> doc, List<? extends DocumentEdit<A>> edits) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(edits, "edits must not be null");
        LOG.fine(() -> "Applying " + edits.size() + " edit(s)");

        Document<A> current = doc;
        for (int step = 0; step < edits.size(); step++) {
            final DocumentEdit<A> edit = Objects.requireNonNull(edits.get(step), "edit must not be null");
            final Grid<A> grid = Grid.of(current);
            final String problem = grid.apply(edit);
            if (problem != null) {
                final int failedStep = step;
                LOG.warning(() -> "Edit " + failedStep + " rejected: " + describe(edit) + ": " + problem);
                return Outcome.failure(new EditError(step, edit, problem));
            }
            current = grid.toDocument();
        }
        return Outcome.success(current);
    }

    /// One line of text per instruction, in order.
    public static <A> List<String> describe(List<? extends DocumentEdit<A>> edits) {
        Objects.requireNonNull(edits, "edits must not be null");
        final List<String> lines = new ArrayList<>(edits.size());
        for (final DocumentEdit<A> edit : edits) {
            lines.add(describe(edit));
        }
        return List.copyOf(lines);
    }

    static String describe(DocumentEdit<?> edit) {
        if (edit instanceof DocumentEdit.Insert<?> insert) {
            return "insert '" + insert.value() + "' at " + insert.position();
        }
        if (edit instanceof DocumentEdit.Delete<?> delete) {
            return "delete at " + delete.position();
        }
        if (edit instanceof DocumentEdit.Update<?> update) {
            return "update " + update.position() + " to '" + update.value() + "'";
        }
        throw new AssertionError("unreachable: " + edit);
    }

    /// Mutable working copy of a document's rows for a single edit.
    private static final class Grid<A> {
        private final boolean verticalRoot;
        private final List<Row<A>> rows;

        private Grid(boolean verticalRoot, List<Row<A>> rows) {
            this.verticalRoot = verticalRoot;
            this.rows = rows;
        }

        static <A> Grid<A> of(Document<A> doc) {
            final List<Row<A>> rows = new ArrayList<>();
            if (doc instanceof Document.Vertical<A> vertical) {
                for (final Document<A> row : vertical.cells()) {
                    rows.add(Row.of(row));
                }
                return new Grid<>(true, rows);
            }
            if (!(doc instanceof Document.Empty<A>)) {
                rows.add(Row.of(doc));
            }
            return new Grid<>(false, rows);
        }

        /// Returns null on success, otherwise the reason the edit does not fit.
        String apply(DocumentEdit<A> edit) {
            final Position p = edit.position();
            if (edit instanceof DocumentEdit.Insert<A> insert) {
                if (p.row() == rows.size() && p.col() == 0) {
                    final Row<A> row = new Row<>(null, false, new ArrayList<>());
                    row.insert(0, Document.leaf(insert.value()));
                    rows.add(row);
                    return null;
                }
                if (p.row() >= rows.size()) {
                    return "row " + p.row() + " out of range for " + rows.size() + " row(s)";
                }
                final Row<A> row = rows.get(p.row());
                if (p.col() > row.cells.size()) {
                    return "column " + p.col() + " out of range for insert into row of " + row.cells.size() + " cell(s)";
                }
                row.insert(p.col(), Document.leaf(insert.value()));
                return null;
            }

            final String missing = checkExists(p);
            if (missing != null) {
                return missing;
            }
            final Row<A> row = rows.get(p.row());
            if (edit instanceof DocumentEdit.Update<A> update) {
                row.set(p.col(), Document.leaf(update.value()));
                return null;
            }
            if (edit instanceof DocumentEdit.Delete<A>) {
                row.remove(p.col());
                if (row.cells.isEmpty()) {
                    rows.remove(p.row());
                }
                return null;
            }
            throw new AssertionError("unreachable: " + edit);
        }

        private String checkExists(Position p) {
            if (p.row() >= rows.size()) {
                return "row " + p.row() + " out of range for " + rows.size() + " row(s)";
            }
            final int width = rows.get(p.row()).cells.size();
            if (p.col() >= width) {
                return "column " + p.col() + " out of range for row of " + width + " cell(s)";
            }
            return null;
        }

        Document<A> toDocument() {
            final List<Document<A>> built = new ArrayList<>(rows.size());
            for (final Row<A> row : rows) {
                built.add(row.toDocument());
            }
            if (verticalRoot) {
                return Document.vertical(built);
            }
            if (built.isEmpty()) {
                return Document.empty();
            }
            return built.size() == 1 ? built.get(0) : Document.vertical(built);
        }
    }

    /// One grid row. `original` is null for rows created by an insert.
    private static final class Row<A> {
        private final Document<A> original;
        private final boolean horizontal;
        private final List<Document<A>> cells;
        private boolean edited;

        private Row(Document<A> original, boolean horizontal, List<Document<A>> cells) {
            this.original = original;
            this.horizontal = horizontal;
            this.cells = cells;
        }

        static <A> Row<A> of(Document<A> row) {
            if (row instanceof Document.Horizontal<A> horizontal) {
                return new Row<>(row, true, new ArrayList<>(horizontal.cells()));
            }
            final List<Document<A>> single = new ArrayList<>(1);
            single.add(row);
            return new Row<>(row, false, single);
        }

        void insert(int col, Document<A> cell) {
            cells.add(col, cell);
            edited = true;
        }

        void set(int col, Document<A> cell) {
            cells.set(col, cell);
            edited = true;
        }

        void remove(int col) {
            cells.remove(col);
            edited = true;
        }

        Document<A> toDocument() {
            if (!edited) {
                return original;
            }
            if (!horizontal && cells.size() == 1) {
                return cells.get(0);
            }
            return Document.horizontal(cells);
        }
    }
}
