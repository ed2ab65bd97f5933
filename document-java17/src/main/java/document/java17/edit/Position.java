package document.java17.edit;

/// A cell address in the grid view of a document: zero-based row, then column.
public record Position(int row, int col) {

    public Position {
        if (row < 0) {
            throw new IllegalArgumentException("row must be non-negative: " + row);
        }
        if (col < 0) {
            throw new IllegalArgumentException("col must be non-negative: " + col);
        }
    }

    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
