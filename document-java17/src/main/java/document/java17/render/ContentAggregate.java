package document.java17.render;

import document.java17.Document;
import document.java17.Documents;
import document.java17.Monoid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The string leaves of a document in order, with their combined length.
public record ContentAggregate(List<String> values, int totalLength) {

    public static final ContentAggregate EMPTY = new ContentAggregate(List.of(), 0);

    private static final Monoid<ContentAggregate> CONCAT = new Monoid<>() {
        @Override
        public ContentAggregate empty() {
            return EMPTY;
        }

        @Override
        public ContentAggregate combine(ContentAggregate x, ContentAggregate y) {
            final List<String> values = new ArrayList<>(x.values.size() + y.values.size());
            values.addAll(x.values);
            values.addAll(y.values);
            return new ContentAggregate(values, x.totalLength + y.totalLength);
        }
    };

    public ContentAggregate {
        Objects.requireNonNull(values, "values must not be null");
        values = List.copyOf(values);
    }

    public static Monoid<ContentAggregate> monoid() {
        return CONCAT;
    }

    public static ContentAggregate of(String value) {
        return new ContentAggregate(List.of(value), value.length());
    }

    public static ContentAggregate aggregate(Document<String> doc) {
        return Documents.foldLeft(doc, EMPTY, (acc, value) -> CONCAT.combine(acc, of(value)));
    }
}
