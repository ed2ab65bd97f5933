package document.java17.validation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/// A check applied to each leaf value. An empty result means the value passes.
@FunctionalInterface
public interface LeafRule<A> {

    Optional<String> check(A value);

    /// Passes values matching `accept`; everything else fails with `reason`.
    static <A> LeafRule<A> of(Predicate<? super A> accept, String reason) {
        Objects.requireNonNull(accept, "accept must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        return value -> accept.test(value) ? Optional.empty() : Optional.of(reason);
    }

    /// Rejects the empty string.
    static LeafRule<String> nonEmpty() {
        return of(value -> !value.isEmpty(), "empty leaf value not permitted");
    }

    /// Rejects strings that are empty or whitespace only.
    static LeafRule<String> nonBlank() {
        return of(value -> !value.isBlank(), "blank leaf value not permitted");
    }

    /// This rule, then `next` for values this rule accepts.
    default LeafRule<A> and(LeafRule<? super A> next) {
        Objects.requireNonNull(next, "next must not be null");
        return value -> {
            final Optional<String> first = check(value);
            return first.isPresent() ? first : next.check(value);
        };
    }
}
