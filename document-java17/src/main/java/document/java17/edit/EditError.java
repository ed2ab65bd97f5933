package document.java17.edit;

import java.util.Objects;

/// Why an edit could not be applied.
/// @param step zero-based index of the failing instruction
/// @param edit the failing instruction
/// @param reason what was wrong with its position
public record EditError(int step, DocumentEdit<?> edit, String reason) {

    public EditError {
        Objects.requireNonNull(edit, "edit must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
