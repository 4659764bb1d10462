package com.pyparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyparser.ast.Element;
import com.pyparser.ast.Module;
import com.pyparser.json.TreeJsonDeserializer;
import com.pyparser.json.TreeJsonException;
import com.pyparser.json.TreeJsonProvider;
import com.pyparser.json.TreeJsonSerializer;

/**
 * Jackson-based implementation of TreeJsonProvider.
 */
public class JacksonTreeJsonProvider implements TreeJsonProvider {

    private final ObjectMapper mapper;
    private final TreeJsonSerializer serializer;
    private final TreeJsonDeserializer deserializer;

    public JacksonTreeJsonProvider() {
        this.mapper = PyTreeJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public TreeJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public TreeJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements TreeJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Element element) throws TreeJsonException {
            try {
                return mapper.writeValueAsString(element);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + element.type(), e);
            }
        }

        @Override
        public String serializePretty(Element element) throws TreeJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(element);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + element.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements TreeJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Module deserializeModule(String json) throws TreeJsonException {
            Element element = deserialize(json);
            if (element instanceof Module module) {
                return module;
            }
            throw new TreeJsonException("Expected a module, got " + element.type());
        }

        @Override
        public Element deserialize(String json) throws TreeJsonException {
            try {
                return mapper.readValue(json, Element.class);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to deserialize element", e);
            }
        }
    }
}
