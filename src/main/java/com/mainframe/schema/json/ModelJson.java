package com.mainframe.schema.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mainframe.schema.exception.StructureMismatchException;
import com.mainframe.schema.model.Model;
import com.mainframe.schema.model.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * JSON text in and out of model instances.
 *
 * Writing goes through {@link Model#serialize(String)}, so roles apply exactly as they
 * do for map output. Reading parses a JSON object into a map and hands it to the usual
 * construction or validation path.
 */
public class ModelJson {

    private static final Logger log = LoggerFactory.getLogger(ModelJson.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ModelJson() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public ModelJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(Model model) throws JsonProcessingException {
        return toJson(model, null);
    }

    public String toJson(Model model, String role) throws JsonProcessingException {
        return mapper.writeValueAsString(model.serialize(role));
    }

    /**
     * @throws com.mainframe.schema.exception.ModelValidationException if the values are invalid
     */
    public Model fromJson(ModelDefinition definition, String json) throws JsonProcessingException {
        return definition.newInstance(readObject(json));
    }

    public boolean validateJson(Model model, String json, boolean partial) throws JsonProcessingException {
        return model.validate(readObject(json), partial);
    }

    /**
     * @throws StructureMismatchException if the document is valid JSON but not an object
     */
    public Map<String, Object> readObject(String json) throws JsonProcessingException {
        JsonNode node = mapper.readTree(json);
        if (node == null || !node.isObject()) {
            String kind = node == null ? "nothing" : node.getNodeType().toString();
            log.debug("Expected a JSON object, got {}", kind);
            throw new StructureMismatchException("Expected a JSON object, got " + kind + ".");
        }
        return mapper.convertValue(node, MAP_TYPE);
    }
}
