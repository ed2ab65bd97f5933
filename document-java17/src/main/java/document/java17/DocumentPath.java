package document.java17;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The location of a node as child indices from the root.
///
/// Renders like a JSON Pointer: the root is `""` and the second cell of the
/// first cell is `/0/1`.
/// @param indices child indices, outermost first
public record DocumentPath(List<Integer> indices) {

    private static final DocumentPath ROOT = new DocumentPath(List.of());

    public DocumentPath {
        Objects.requireNonNull(indices, "indices must not be null");
        indices = List.copyOf(indices);
        for (final int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("index must be non-negative: " + index);
            }
        }
    }

    public static DocumentPath root() {
        return ROOT;
    }

    public static DocumentPath of(int... indices) {
        final List<Integer> list = new ArrayList<>(indices.length);
        for (final int index : indices) {
            list.add(index);
        }
        return new DocumentPath(list);
    }

    /// Parses the form produced by [#toString].
    /// @throws IllegalArgumentException if `pointer` is not `""` or a sequence of `/<index>` segments
    public static DocumentPath parse(String pointer) {
        Objects.requireNonNull(pointer, "pointer must not be null");
        if (pointer.isEmpty()) {
            return ROOT;
        }
        if (!pointer.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + pointer);
        }
        final String[] segments = pointer.substring(1).split("/", -1);
        final List<Integer> list = new ArrayList<>(segments.length);
        for (final String segment : segments) {
            try {
                list.add(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a cell index: '" + segment + "' in " + pointer, e);
            }
        }
        return new DocumentPath(list);
    }

    public DocumentPath child(int index) {
        final List<Integer> list = new ArrayList<>(indices.size() + 1);
        list.addAll(indices);
        list.add(index);
        return new DocumentPath(list);
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int depth() {
        return indices.size();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (final int index : indices) {
            sb.append('/').append(index);
        }
        return sb.toString();
    }
}
