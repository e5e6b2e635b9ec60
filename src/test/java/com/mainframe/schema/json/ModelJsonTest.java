package com.mainframe.schema.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mainframe.schema.exception.ModelValidationException;
import com.mainframe.schema.exception.StructureMismatchException;
import com.mainframe.schema.model.Model;
import com.mainframe.schema.model.ModelDefinition;
import com.mainframe.schema.model.ModelOptions;
import com.mainframe.schema.serialize.Roles;
import com.mainframe.schema.types.DecimalType;
import com.mainframe.schema.types.ListType;
import com.mainframe.schema.types.StringType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for reading and writing model instances as JSON.
 */
class ModelJsonTest {

    private static final ModelDefinition PRODUCT = ModelDefinition.builder()
            .name("Product")
            .field("name", StringType.builder().required(true).build())
            .field("price", new DecimalType())
            .field("tags", new ListType<>(new StringType()))
            .options(ModelOptions.builder().roles(Map.of("public", Roles.whitelist("name"))).build())
            .build();

    private final ModelJson json = new ModelJson();

    @Test
    void testRoundTrip() throws JsonProcessingException {
        Model product = json.fromJson(PRODUCT, "{\"name\":\"Lamp\",\"price\":19.99,\"tags\":[\"home\",\"light\"]}");

        assertThat(product.get("price")).isEqualTo(new BigDecimal("19.99"));
        assertThat(product.get("tags")).isEqualTo(List.of("home", "light"));

        Model reread = json.fromJson(PRODUCT, json.toJson(product));
        assertThat(reread).isEqualTo(product);
    }

    @Test
    void testToJsonWithRole() throws JsonProcessingException {
        Model product = PRODUCT.newInstance(Map.of("name", "Lamp", "price", "5"));

        assertThat(json.toJson(product, "public")).isEqualTo("{\"name\":\"Lamp\"}");
    }

    @Test
    void testNonObjectDocumentIsRejected() {
        assertThatThrownBy(() -> json.fromJson(PRODUCT, "[1, 2]"))
                .isInstanceOf(StructureMismatchException.class)
                .hasMessage("Expected a JSON object, got ARRAY.");
    }

    @Test
    void testInvalidValuesFailConstruction() {
        assertThatThrownBy(() -> json.fromJson(PRODUCT, "{\"price\":\"cheap\"}"))
                .isInstanceOfSatisfying(ModelValidationException.class,
                        e -> assertThat(e.getFieldNames()).containsExactly("name", "price"));
    }

    @Test
    void testMalformedJsonPropagates() {
        assertThatThrownBy(() -> json.readObject("{not json"))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void testPartialValidationFromJson() throws JsonProcessingException {
        Model product = PRODUCT.newInstance(Map.of("name", "Lamp"));

        assertThat(json.validateJson(product, "{\"price\":\"12.50\"}", true)).isTrue();
        assertThat(product.get("price")).isEqualTo(new BigDecimal("12.50"));
        assertThat(product.get("name")).isEqualTo("Lamp");
    }
}
