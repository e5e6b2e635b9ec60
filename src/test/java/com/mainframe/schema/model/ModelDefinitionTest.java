package com.mainframe.schema.model;

import com.mainframe.schema.exception.InvalidConfigurationException;
import com.mainframe.schema.exception.ModelValidationException;
import com.mainframe.schema.types.FieldType;
import com.mainframe.schema.types.IntType;
import com.mainframe.schema.types.StringType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelDefinition: field registry, inheritance and construction.
 */
class ModelDefinitionTest {

    private final StringType name = StringType.builder().required(true).build();
    private final IntType age = new IntType();

    @Test
    void testFieldRegistryKeepsDeclarationOrder() {
        ModelDefinition user = ModelDefinition.builder()
                .name("User")
                .field("name", name)
                .field("age", age)
                .build();

        assertThat(user.getFieldNames()).containsExactly("name", "age");
        assertThat(user.getField("name")).containsSame(name);
        assertThat(user.getField("email")).isEmpty();
        assertThat(user.hasField("age")).isTrue();
    }

    @Test
    void testInheritedFieldsComeFirst() {
        ModelDefinition parent = ModelDefinition.builder().name("Parent").field("name", name).build();
        ModelDefinition child = ModelDefinition.builder().name("Child").parent(parent).field("age", age).build();

        assertThat(child.getFieldNames()).containsExactly("name", "age");
        assertThat(child.getDeclaredFields()).containsOnlyKeys("age");
        assertThat(parent.getFieldNames()).containsExactly("name");
    }

    @Test
    void testOverrideReplacesInheritedField() {
        StringType optionalName = new StringType();
        ModelDefinition parent = ModelDefinition.builder().name("Parent").field("name", name).field("age", age).build();
        ModelDefinition child = ModelDefinition.builder().name("Child").parent(parent).field("name", optionalName).build();

        assertThat(child.getFieldNames()).containsExactly("name", "age");
        assertThat(child.getField("name")).containsSame(optionalName);
    }

    @Test
    void testNearestParentWins() {
        FieldType<String> first = new StringType();
        FieldType<String> second = new StringType();
        ModelDefinition a = ModelDefinition.builder().name("A").field("title", first).build();
        ModelDefinition b = ModelDefinition.builder().name("B").field("title", second).build();
        ModelDefinition c = ModelDefinition.builder().name("C").parent(a).parent(b).build();

        assertThat(c.getField("title")).containsSame(first);
    }

    @Test
    void testSubtype() {
        ModelDefinition parent = ModelDefinition.builder().name("Parent").build();
        ModelDefinition child = ModelDefinition.builder().name("Child").parent(parent).build();
        ModelDefinition grandChild = ModelDefinition.builder().name("GrandChild").parent(child).build();

        assertThat(grandChild.isSubtypeOf(parent)).isTrue();
        assertThat(child.isSubtypeOf(child)).isTrue();
        assertThat(parent.isSubtypeOf(child)).isFalse();
    }

    @Test
    void testBlankFieldNameIsRejected() {
        assertThatThrownBy(() -> ModelDefinition.builder().name("User").field(" ", name).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("blank name");
    }

    @Test
    void testInvalidDefaultsAreRejected() {
        assertThatThrownBy(() -> ModelDefinition.builder()
                .name("Player")
                .field("level", IntType.builder().defaultValue(200).maxValue(100).build())
                .field("kind", StringType.builder().defaultValue("x").choice("a").choice("b").build())
                .build())
                .isInstanceOfSatisfying(InvalidConfigurationException.class, e -> assertThat(e.getErrors())
                        .containsExactly(
                                "Default of field 'level' on model Player is invalid: "
                                        + "Int value should be less than or equal to 100.",
                                "Default of field 'kind' on model Player is invalid: "
                                        + "Value must be one of [a, b]."));
    }

    @Test
    void testValidDefaultsAreStoredAndPassFullValidation() {
        ModelDefinition player = ModelDefinition.builder()
                .name("Player")
                .field("level", IntType.builder().defaultValue(50).maxValue(100).build())
                .field("kind", StringType.builder().defaultValue("a").choice("a").choice("b").build())
                .build();

        Model instance = player.newInstance();

        assertThat(instance.getData()).containsExactly(entry("level", 50), entry("kind", "a"));
        assertThat(instance.validate(Map.of())).isTrue();
        assertThat(instance.hasErrors()).isFalse();
    }

    @Test
    void testOptionsAreBoundToDefinition() {
        ModelDefinition user = ModelDefinition.builder()
                .name("User")
                .options(ModelOptions.builder().namespace("accounts").build())
                .build();

        assertThat(user.getOptions().getKlass()).isSameAs(user);
        assertThat(user.getOptions().getNamespace()).isEqualTo("accounts");
    }

    @Test
    void testOptionsAreNotInherited() {
        ModelDefinition parent = ModelDefinition.builder()
                .name("Parent")
                .options(ModelOptions.builder().namespace("accounts").build())
                .build();
        ModelDefinition child = ModelDefinition.builder().name("Child").parent(parent).build();

        assertThat(child.getOptions().getNamespace()).isNull();
    }

    @Test
    void testNewInstanceWithoutValuesDoesNotEnforceRequired() {
        ModelDefinition user = ModelDefinition.builder().name("User").field("name", name).build();

        Model instance = user.newInstance();

        assertThat(instance.getData()).isEmpty();
        assertThat(instance.hasErrors()).isFalse();
    }

    @Test
    void testNewInstanceReportsEveryFailingField() {
        ModelDefinition user = ModelDefinition.builder()
                .name("User")
                .field("name", name)
                .field("email", StringType.builder().required(true).build())
                .field("age", age)
                .build();

        assertThatThrownBy(() -> user.newInstance(Map.of("age", "x")))
                .isInstanceOfSatisfying(ModelValidationException.class, e -> {
                    assertThat(e.getModelName()).isEqualTo("User");
                    assertThat(e.getFieldNames()).containsExactly("name", "email", "age");
                    assertThat(e.getErrors().get("name")).containsExactly("This field is required.");
                })
                .hasMessageContaining("email: This field is required.");
    }
}
