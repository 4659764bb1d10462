package com.pyparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.pyparser.ast.Element;
import com.pyparser.ast.Leaf;
import com.pyparser.ast.Literal;
import com.pyparser.ast.Module;
import com.pyparser.ast.Node;
import com.pyparser.ast.NodeFactory;
import com.pyparser.ast.Position;
import com.pyparser.ast.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for syntax tree elements.
 *
 * Leaves are written as {@code {type, value, prefix, start}}, number literals also get
 * their evaluated {@code literal}. Nodes are written as {@code {type, start, end, children}},
 * modules additionally carry their {@code path}. Reading rebuilds the typed elements
 * through {@link NodeFactory}; a module read back is indexed like a parsed one.
 */
public class TreeModule extends SimpleModule {

    private static final Logger LOG = LoggerFactory.getLogger(TreeModule.class);

    public TreeModule() {
        super("TreeModule", new Version(1, 0, 0, null, "com.pyparser", "pytree-jackson"));
        addSerializer(Element.class, new ElementSerializer());
        addDeserializer(Element.class, new ElementDeserializer());
    }

    // ==================== Serialization ====================

    static class ElementSerializer extends StdSerializer<Element> {

        private final LiteralValueSerializer literalSerializer = new LiteralValueSerializer();

        ElementSerializer() {
            super(Element.class);
        }

        @Override
        public void serialize(Element element, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("type", element.type());
            if (element instanceof Leaf leaf) {
                gen.writeStringField("value", leaf.value());
                gen.writeStringField("prefix", leaf.prefix());
                writePosition("start", leaf.start(), gen);
                if (leaf instanceof Literal literal && !literal.isString()) {
                    writeLiteral(literal, gen, provider);
                }
            } else {
                Node node = (Node) element;
                if (node instanceof Module module && module.path() != null) {
                    gen.writeStringField("path", module.path());
                }
                writePosition("start", node.start(), gen);
                writePosition("end", node.end(), gen);
                gen.writeArrayFieldStart("children");
                for (Element child : node.children()) {
                    serialize(child, gen, provider);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }

        private void writeLiteral(Literal literal, JsonGenerator gen, SerializerProvider provider) throws IOException {
            Object value;
            try {
                value = literal.eval();
            } catch (UnsupportedOperationException | IllegalStateException e) {
                LOG.debug("No literal value for '{}' at {}: {}", literal.value(), literal.start(), e.getMessage());
                return;
            }
            gen.writeFieldName("literal");
            literalSerializer.serialize(value, gen, provider);
        }

        private static void writePosition(String field, Position position, JsonGenerator gen) throws IOException {
            gen.writeObjectFieldStart(field);
            gen.writeNumberField("line", position.line());
            gen.writeNumberField("column", position.column());
            gen.writeEndObject();
        }
    }

    // ==================== Deserialization ====================

    static class ElementDeserializer extends StdDeserializer<Element> {

        ElementDeserializer() {
            super(Element.class);
        }

        @Override
        public Element deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            return build(tree, p);
        }

        private Element build(JsonNode json, JsonParser p) throws JsonMappingException {
            if (json == null || !json.isObject() || !json.hasNonNull("type")) {
                throw JsonMappingException.from(p, "Expected an element object with a 'type', got: " + json);
            }
            String type = json.get("type").asText();
            try {
                if (json.has("children")) {
                    return buildNode(type, json, p);
                }
                Position start = readPosition(json.get("start"), p);
                return NodeFactory.createLeaf(type, json.path("value").asText(), start, json.path("prefix").asText());
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Invalid element of type '" + type + "'", e);
            }
        }

        private Element buildNode(String type, JsonNode json, JsonParser p) throws JsonMappingException {
            JsonNode childrenJson = json.get("children");
            if (!childrenJson.isArray()) {
                throw JsonMappingException.from(p, "'children' of " + type + " must be an array");
            }
            List<Element> children = new ArrayList<>(childrenJson.size());
            for (JsonNode child : childrenJson) {
                children.add(build(child, p));
            }
            Symbol symbol = Symbol.fromGrammarName(type);
            String path = json.hasNonNull("path") ? json.get("path").asText() : null;
            return NodeFactory.create(symbol, children, path);
        }

        private static Position readPosition(JsonNode json, JsonParser p) throws JsonMappingException {
            if (json == null || !json.has("line") || !json.has("column")) {
                throw JsonMappingException.from(p, "Leaf without a start position");
            }
            return new Position(json.get("line").asInt(), json.get("column").asInt());
        }
    }
}
