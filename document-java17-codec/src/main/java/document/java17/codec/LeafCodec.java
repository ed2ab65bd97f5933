package document.java17.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import document.java17.effect.Outcome;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/// Converts leaf values to and from JSON.
///
/// `decode` returns a failure message rather than throwing. Built-in codecs
/// reject input of the wrong JSON type and never coerce: `integers()` refuses
/// `1.5`, `"1"` and values outside the `int` range.
public interface LeafCodec<A> {

    JsonNode encode(A value);

    Outcome<String, A> decode(JsonNode node);

    /// Whether JSON text should be read with fractions as exact decimals, keeping their scale.
    /// Off by default: a decimal cannot carry the sign of `-0.0`.
    default boolean exactNumbers() {
        return false;
    }

    /// This codec, reading JSON fractions from text as exact decimals.
    default LeafCodec<A> withExactNumbers() {
        final LeafCodec<A> self = this;
        return new LeafCodec<>() {
            @Override
            public JsonNode encode(A value) {
                return self.encode(value);
            }

            @Override
            public Outcome<String, A> decode(JsonNode node) {
                return self.decode(node);
            }

            @Override
            public boolean exactNumbers() {
                return true;
            }
        };
    }

    static <A> LeafCodec<A> of(Function<? super A, ? extends JsonNode> encoder,
                               Function<? super JsonNode, Outcome<String, A>> decoder) {
        Objects.requireNonNull(encoder, "encoder must not be null");
        Objects.requireNonNull(decoder, "decoder must not be null");
        return new LeafCodec<>() {
            @Override
            public JsonNode encode(A value) {
                return encoder.apply(value);
            }

            @Override
            public Outcome<String, A> decode(JsonNode node) {
                return decoder.apply(node);
            }
        };
    }

    static LeafCodec<String> strings() {
        return of(JsonNodeFactory.instance::textNode,
            node -> node.isTextual() ? Outcome.success(node.textValue()) : mismatch("a string", node));
    }

    static LeafCodec<Integer> integers() {
        return of(JsonNodeFactory.instance::numberNode,
            node -> node.isIntegralNumber() && node.canConvertToInt()
                ? Outcome.success(node.intValue())
                : mismatch("a 32-bit integer", node));
    }

    static LeafCodec<Long> longs() {
        return of(JsonNodeFactory.instance::numberNode,
            node -> node.isIntegralNumber() && node.canConvertToLong()
                ? Outcome.success(node.longValue())
                : mismatch("a 64-bit integer", node));
    }

    /// Accepts any JSON number; `-0.0` survives a text round trip. Encoding NaN or an infinity fails,
    /// as JSON cannot represent them.
    static LeafCodec<Double> doubles() {
        return of(value -> {
                if (value.isNaN() || value.isInfinite()) {
                    throw new IllegalArgumentException("JSON cannot represent " + value);
                }
                return JsonNodeFactory.instance.numberNode(value);
            },
            node -> node.isNumber() ? Outcome.success(node.doubleValue()) : mismatch("a number", node));
    }

    static LeafCodec<Boolean> booleans() {
        return of(JsonNodeFactory.instance::booleanNode,
            node -> node.isBoolean() ? Outcome.success(node.booleanValue()) : mismatch("a boolean", node));
    }

    /// Keeps scale through a text round trip: `1.10` stays `1.10`.
    static LeafCodec<BigDecimal> decimals() {
        return LeafCodec.<BigDecimal>of(JsonNodeFactory.instance::numberNode,
            node -> node.isNumber() ? Outcome.success(node.decimalValue()) : mismatch("a number", node))
            .withExactNumbers();
    }

    private static <A> Outcome<String, A> mismatch(String expected, JsonNode node) {
        return Outcome.failure("expected " + expected + " but found " + node.getNodeType().name().toLowerCase(Locale.ROOT)
            + " " + node);
    }
}
