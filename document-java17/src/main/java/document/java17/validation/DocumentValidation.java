package document.java17.validation;

import document.java17.Document;
import document.java17.DocumentPath;
import document.java17.DocumentTraversal;
import document.java17.Documents;
import document.java17.Located;
import document.java17.effect.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Leaf validation in two modes.
///
/// [#failFast] is a traversal with the [Outcome] effect: it stops at the first
/// violating leaf and reports only that one. [#accumulate] visits every leaf
/// and reports every violation in document order.
///
/// ```java
/// Document<String> doc = Document.horizontal(Document.leaf("ok"), Document.leaf(""), Document.leaf(""));
/// DocumentValidation.failFast(doc, LeafRule.nonEmpty());   // Failure[{path="/1", ...}]
/// DocumentValidation.accumulate(doc, LeafRule.nonEmpty()); // Failure[[{path="/1", ...}, {path="/2", ...}]]
/// ```
public final class DocumentValidation {

    private static final Logger LOG = Logger.getLogger(DocumentValidation.class.getName());

    private DocumentValidation() {}

    public static <A> Outcome<ValidationError, Document<A>> failFast(Document<A> doc, LeafRule<? super A> rule) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        LOG.fine(() -> "Validating document fail-fast");
        final Document<Located<A>> located = Documents.withPaths(doc);
        return Outcome.narrow(DocumentTraversal.<Outcome.Mu<ValidationError>, Located<A>, A>traverse(
            Outcome.effect(), located, leaf -> checkLeaf(rule, leaf)));
    }

    public static <A> Outcome<List<ValidationError>, Document<A>> accumulate(Document<A> doc,
                                                                             LeafRule<? super A> rule) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        LOG.fine(() -> "Validating document, collecting every violation");
        final List<ValidationError> errors = new ArrayList<>();
        for (final Located<A> leaf : Documents.leaves(Documents.withPaths(doc))) {
            rule.check(leaf.value()).ifPresent(reason -> errors.add(new ValidationError(leaf.path(), reason)));
        }
        if (errors.isEmpty()) {
            return Outcome.success(doc);
        }
        LOG.finer(() -> "Validation found " + errors.size() + " violation(s)");
        return Outcome.failure(Collections.unmodifiableList(errors));
    }

    /// Rejects [Document.Empty] at the root. Containers with no cells pass.
    public static <A> Outcome<ValidationError, Document<A>> requireNonEmpty(Document<A> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        if (doc instanceof Document.Empty<A>) {
            return Outcome.failure(new ValidationError(DocumentPath.root(), "document is empty"));
        }
        return Outcome.success(doc);
    }

    private static <A> Outcome<ValidationError, A> checkLeaf(LeafRule<? super A> rule, Located<A> leaf) {
        final Optional<String> violation = rule.check(leaf.value());
        if (violation.isPresent()) {
            LOG.finer(() -> "Leaf at " + leaf.path() + " rejected: " + violation.get());
            return Outcome.failure(new ValidationError(leaf.path(), violation.get()));
        }
        return Outcome.success(leaf.value());
    }
}
