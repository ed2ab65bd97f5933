package document.java17.codec;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import document.java17.Document;
import document.java17.DocumentAlgebra;
import document.java17.DocumentSchemes;
import document.java17.Orientation;
import document.java17.effect.Outcome;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Encodes documents to the tagged JSON wire format and decodes them back.
///
/// ```
/// { "type": "leaf",       "value": <leaf JSON> }
/// { "type": "horizontal", "cells": [ <document>, ... ] }
/// { "type": "vertical",   "cells": [ <document>, ... ] }
/// { "type": "empty" }
/// ```
///
/// Decoding never throws on bad input: every problem comes back as a
/// [DecodeError] whose `path` is a JSON Pointer into the input. Both
/// directions walk the tree with an explicit stack.
///
/// For any leaf codec that round-trips its own values,
/// `decode(encode(doc))` is `Success(doc)`.
///
/// ```java
/// DocumentCodec<Integer> codec = DocumentCodec.of(LeafCodec.integers());
/// String json = codec.encodeToString(Document.horizontal(Document.leaf(1), Document.leaf(2)));
/// Outcome<DecodeError, Document<Integer>> back = codec.decode(json);
/// ```
public final class DocumentCodec<A> {

    private static final Logger LOG = Logger.getLogger(DocumentCodec.class.getName());

    /// Mappers for the default depth, with and without exact decimal reading.
    private static final ObjectMapper DEFAULT_MAPPER = newMapper(CodecOptions.DEFAULT_MAX_DEPTH, false);
    private static final ObjectMapper EXACT_MAPPER = newMapper(CodecOptions.DEFAULT_MAX_DEPTH, true);

    private final LeafCodec<A> leafCodec;
    private final CodecOptions options;
    private final ObjectMapper mapper;

    private DocumentCodec(LeafCodec<A> leafCodec, CodecOptions options, ObjectMapper mapper) {
        this.leafCodec = Objects.requireNonNull(leafCodec, "leafCodec must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public static <A> DocumentCodec<A> of(LeafCodec<A> leafCodec) {
        return of(leafCodec, CodecOptions.defaults());
    }

    /// Reads JSON text with nesting limits derived from [CodecOptions#maxDepth]. JSON fractions are read
    /// as exact decimals only when [LeafCodec#exactNumbers] asks for it.
    public static <A> DocumentCodec<A> of(LeafCodec<A> leafCodec, CodecOptions options) {
        Objects.requireNonNull(leafCodec, "leafCodec must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return new DocumentCodec<>(leafCodec, options, defaultMapper(options.maxDepth(), leafCodec.exactNumbers()));
    }

    /// Uses `mapper` for reading and writing JSON text. Its own nesting limits and number handling apply.
    public static <A> DocumentCodec<A> of(LeafCodec<A> leafCodec, CodecOptions options, ObjectMapper mapper) {
        return new DocumentCodec<>(leafCodec, options, mapper);
    }

    public CodecOptions options() {
        return options;
    }

    public JsonNode encode(Document<A> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        LOG.fine(() -> "Encoding document");
        final JsonNodeFactory nodes = mapper.getNodeFactory();
        return DocumentSchemes.cata(doc, new DocumentAlgebra<A, JsonNode>() {
            @Override
            public JsonNode leaf(A value) {
                final JsonNode encoded = Objects.requireNonNull(leafCodec.encode(value),
                    "leaf codec must not return null");
                final ObjectNode node = tagged(nodes, Tag.LEAF);
                node.set(Tag.VALUE, encoded);
                return node;
            }

            @Override
            public JsonNode horizontal(List<JsonNode> cells) {
                return container(nodes, Tag.HORIZONTAL, cells);
            }

            @Override
            public JsonNode vertical(List<JsonNode> cells) {
                return container(nodes, Tag.VERTICAL, cells);
            }

            @Override
            public JsonNode empty() {
                return tagged(nodes, Tag.EMPTY);
            }
        });
    }

    /// JSON text for `doc`, indented when [CodecOptions#prettyPrint] is set.
    ///
    /// Tokens are streamed from an explicit stack, so any finite document can be written.
    /// @throws UncheckedIOException if Jackson fails to write the text
    public String encodeToString(Document<A> doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        LOG.fine(() -> "Writing document JSON, prettyPrint=" + options.prettyPrint());
        final StringWriter out = new StringWriter();
        final ObjectWriter writer = options.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        try (JsonGenerator generator = writer.createGenerator(out)) {
            writeWithStack(doc, generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write document JSON", e);
        }
        return out.toString();
    }

    public Outcome<DecodeError, Document<A>> decode(String json) {
        Objects.requireNonNull(json, "json must not be null");
        final JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            final DecodeError.Reason reason = e instanceof StreamConstraintsException
                || e.getCause() instanceof StreamConstraintsException
                ? DecodeError.Reason.TOO_DEEP
                : DecodeError.Reason.MALFORMED_JSON;
            return rejected(new DecodeError(reason,
                Objects.requireNonNullElse(e.getOriginalMessage(), e.getClass().getSimpleName()), ""));
        }
        if (node == null || node.isMissingNode()) {
            return rejected(new DecodeError(DecodeError.Reason.MALFORMED_JSON, "no JSON content", ""));
        }
        return decode(node);
    }

    public Outcome<DecodeError, Document<A>> decode(JsonNode json) {
        Objects.requireNonNull(json, "json must not be null");
        LOG.fine(() -> "Decoding document, maxDepth=" + options.maxDepth());
        final Outcome<DecodeError, Document<A>> result = decodeWithStack(json);
        if (result instanceof Outcome.Failure<DecodeError, Document<A>> failure) {
            LOG.warning(() -> "Rejected document: " + failure.error());
        }
        return result;
    }

    /// @throws DocumentDecodeException if `json` is not a valid encoded document
    public Document<A> decodeOrThrow(String json) {
        return decode(json).orElseThrow(DocumentDecodeException::new);
    }

    /// @throws DocumentDecodeException if `json` is not a valid encoded document
    public Document<A> decodeOrThrow(JsonNode json) {
        return decode(json).orElseThrow(DocumentDecodeException::new);
    }

    private void writeWithStack(Document<A> root, JsonGenerator generator) throws IOException {
        final Deque<Iterator<Document<A>>> stack = new ArrayDeque<>();
        Document<A> pending = root;

        while (true) {
            if (pending != null) {
                generator.writeStartObject();
                if (pending instanceof Document.Leaf<A> leaf) {
                    generator.writeStringField(Tag.TYPE, Tag.LEAF.key());
                    generator.writeFieldName(Tag.VALUE);
                    mapper.writeTree(generator, Objects.requireNonNull(leafCodec.encode(leaf.value()),
                        "leaf codec must not return null"));
                    generator.writeEndObject();
                } else if (pending instanceof Document.Empty<A>) {
                    generator.writeStringField(Tag.TYPE, Tag.EMPTY.key());
                    generator.writeEndObject();
                } else if (pending instanceof Document.Container<A> container) {
                    generator.writeStringField(Tag.TYPE, tagOf(container.orientation()).key());
                    generator.writeArrayFieldStart(Tag.CELLS);
                    stack.push(container.cells().iterator());
                } else {
                    throw new AssertionError("unreachable: " + pending);
                }
                pending = null;
            }

            if (stack.isEmpty()) {
                return;
            }
            final Iterator<Document<A>> cells = stack.peek();
            if (cells.hasNext()) {
                pending = cells.next();
            } else {
                stack.pop();
                generator.writeEndArray();
                generator.writeEndObject();
            }
        }
    }

    private Outcome<DecodeError, Document<A>> rejected(DecodeError error) {
        LOG.warning(() -> "Rejected document: " + error);
        return Outcome.failure(error);
    }

    private Outcome<DecodeError, Document<A>> decodeWithStack(JsonNode root) {
        final Deque<Frame<A>> stack = new ArrayDeque<>();
        JsonNode pending = root;
        Document<A> built = null;

        while (true) {
            if (pending != null) {
                final JsonNode node = pending;
                pending = null;

                final int depth = stack.size() + 1;
                if (depth > options.maxDepth()) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.TOO_DEEP,
                        "document nests deeper than " + options.maxDepth() + " levels", pointer(stack)));
                }
                if (!node.isObject()) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.NOT_AN_OBJECT,
                        "expected a tagged object but found " + node.getNodeType(), pointer(stack)));
                }
                final JsonNode type = node.get(Tag.TYPE);
                if (type == null) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.MISSING_TYPE,
                        "object has no '" + Tag.TYPE + "' field", pointer(stack, Tag.TYPE)));
                }
                if (!type.isTextual()) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.TYPE_NOT_STRING,
                        "'" + Tag.TYPE + "' must be a string but found " + type.getNodeType(), pointer(stack, Tag.TYPE)));
                }
                final Tag tag = Tag.fromKey(type.textValue());
                if (tag == null) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.UNKNOWN_TYPE,
                        "unknown document type '" + type.textValue() + "'", pointer(stack, Tag.TYPE)));
                }
                final String unknownField = unknownField(node, tag);
                if (unknownField != null) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.UNKNOWN_FIELD,
                        "'" + tag.key() + "' does not define field '" + unknownField + "'",
                        pointer(stack, escapePointer(unknownField))));
                }
                final String payloadField = tag.payloadField();
                final JsonNode payload = payloadField == null ? null : node.get(payloadField);
                if (payloadField != null && payload == null) {
                    return Outcome.failure(new DecodeError(DecodeError.Reason.MISSING_FIELD,
                        "'" + tag.key() + "' requires field '" + payloadField + "'", pointer(stack, payloadField)));
                }

                if (tag == Tag.EMPTY) {
                    built = Document.empty();
                } else if (tag == Tag.LEAF) {
                    final Outcome<String, A> value = leafCodec.decode(payload);
                    if (value instanceof Outcome.Failure<String, A> refused) {
                        return Outcome.failure(new DecodeError(DecodeError.Reason.INVALID_LEAF,
                            refused.error(), pointer(stack, Tag.VALUE)));
                    }
                    built = Document.leaf(((Outcome.Success<String, A>) value).value());
                } else {
                    if (!payload.isArray()) {
                        return Outcome.failure(new DecodeError(DecodeError.Reason.CELLS_NOT_ARRAY,
                            "expected an array but found " + payload.getNodeType(), pointer(stack, Tag.CELLS)));
                    }
                    LOG.finer(() -> "Decoding " + tag.key() + " at '" + pointer(stack) + "' with "
                        + payload.size() + " cell(s)");
                    final Orientation orientation = tag == Tag.HORIZONTAL ? Orientation.HORIZONTAL : Orientation.VERTICAL;
                    stack.push(new Frame<>((ArrayNode) payload, orientation));
                }
            }

            if (built != null) {
                if (stack.isEmpty()) {
                    return Outcome.success(built);
                }
                stack.peek().built.add(built);
                built = null;
            }

            final Frame<A> top = stack.peek();
            if (top.next < top.cells.size()) {
                pending = top.cells.get(top.next++);
            } else {
                stack.pop();
                built = top.orientation.of(top.built);
            }
        }
    }

    /// JSON Pointer to the node being decoded: each open frame contributes the cell it is on.
    private static String pointer(Deque<? extends Frame<?>> stack) {
        final StringBuilder sb = new StringBuilder();
        final Iterator<? extends Frame<?>> outermostFirst = stack.descendingIterator();
        while (outermostFirst.hasNext()) {
            sb.append('/').append(Tag.CELLS).append('/').append(outermostFirst.next().next - 1);
        }
        return sb.toString();
    }

    private static String pointer(Deque<? extends Frame<?>> stack, String field) {
        return pointer(stack) + "/" + field;
    }

    /// The first field `tag` does not define, or null when unknown fields are allowed or absent.
    private String unknownField(JsonNode node, Tag tag) {
        if (!options.rejectUnknownFields()) {
            return null;
        }
        final Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            final String name = names.next();
            if (!name.equals(Tag.TYPE) && !name.equals(tag.payloadField())) {
                return name;
            }
        }
        return null;
    }

    static ObjectMapper defaultMapper(int maxDepth, boolean exactNumbers) {
        if (maxDepth == CodecOptions.DEFAULT_MAX_DEPTH) {
            return exactNumbers ? EXACT_MAPPER : DEFAULT_MAPPER;
        }
        LOG.fine(() -> "Building mapper for maxDepth=" + maxDepth + ", exactNumbers=" + exactNumbers);
        return newMapper(maxDepth, exactNumbers);
    }

    /// Reading allows two JSON levels per document level (object and `cells` array) plus the
    /// leaf object and its value. Writing is unbounded.
    private static ObjectMapper newMapper(int maxDepth, boolean exactNumbers) {
        final int readNesting = (int) Math.min(Integer.MAX_VALUE, 2L * maxDepth + 2);
        final JsonMapper.Builder builder = JsonMapper.builder(new JsonFactoryBuilder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(readNesting).build())
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
                .build())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES);
        if (exactNumbers) {
            builder.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        }
        return builder.build();
    }

    private static Tag tagOf(Orientation orientation) {
        return orientation == Orientation.HORIZONTAL ? Tag.HORIZONTAL : Tag.VERTICAL;
    }

    /// RFC 6901 escaping of one reference token.
    static String escapePointer(String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }

    private static ObjectNode tagged(JsonNodeFactory nodes, Tag tag) {
        final ObjectNode node = nodes.objectNode();
        node.put(Tag.TYPE, tag.key());
        return node;
    }

    private static JsonNode container(JsonNodeFactory nodes, Tag tag, List<JsonNode> cells) {
        final ObjectNode node = tagged(nodes, tag);
        final ArrayNode array = nodes.arrayNode(cells.size());
        array.addAll(cells);
        node.set(Tag.CELLS, array);
        return node;
    }

    /// A container whose cells are being decoded.
    private static final class Frame<A> {
        final ArrayNode cells;
        final Orientation orientation;
        final List<Document<A>> built;
        int next;

        Frame(ArrayNode cells, Orientation orientation) {
            this.cells = cells;
            this.orientation = orientation;
            this.built = new ArrayList<>(cells.size());
        }
    }
}
