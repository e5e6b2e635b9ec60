package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import com.mainframe.schema.exception.SizeConstraintException;
import com.mainframe.schema.exception.StructureMismatchException;
import com.mainframe.schema.model.Model;
import com.mainframe.schema.model.ModelDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ListType element conversion and size constraints.
 */
class ListTypeTest {

    private static final ModelDefinition USER = ModelDefinition.builder()
            .name("User")
            .field("name", new StringType())
            .build();

    @Test
    void testConvertsEachElement() {
        ListType<Integer> ids = new ListType<>(new IntType());

        assertThat(ids.clean(List.of("1", "2"))).containsExactly(1, 2);
        assertThat(ids.clean(Set.of(3))).containsExactly(3);
        assertThat(ids.clean(new int[]{4, 5})).containsExactly(4, 5);
    }

    @Test
    void testEmptyListIsValidWhenRequired() {
        ListType<String> ids = ListType.listOf(new StringType()).required(true).build();

        assertThat(ids.isRequired()).isTrue();
        assertThat(ids.clean(List.of())).isEmpty();
    }

    @Test
    void testElementFailuresAreReportedPerIndex() {
        ListType<Integer> ids = new ListType<>(new IntType());

        assertThatThrownBy(() -> ids.clean(Arrays.asList("1", "x", null)))
                .isInstanceOfSatisfying(ConversionException.class, e -> assertThat(e.getMessages()).containsExactly(
                        "Item 1: Value 'x' is not a valid integer.",
                        "Item 2: This field is required."));
    }

    @Test
    void testRejectsNonListValues() {
        ListType<String> names = new ListType<>(new StringType());

        assertThatThrownBy(() -> names.clean("abc"))
                .isInstanceOf(StructureMismatchException.class)
                .hasMessage("Expected a list of items.");
        assertThatThrownBy(() -> names.clean(Map.of("a", "b")))
                .isInstanceOf(StructureMismatchException.class);
    }

    @Test
    void testSizeConstraints() {
        ListType<String> tags = ListType.listOf(new StringType()).minSize(1).maxSize(2).build();

        assertThat(tags.isRequired()).isTrue();
        assertThatThrownBy(() -> tags.clean(List.of()))
                .isInstanceOf(SizeConstraintException.class)
                .hasMessage("Please provide at least 1 item(s).");
        assertThatThrownBy(() -> tags.clean(List.of("a", "b", "c")))
                .isInstanceOf(SizeConstraintException.class)
                .hasMessage("Please provide no more than 2 item(s).");
    }

    @Test
    void testMinSizeGreaterThanMaxSizeIsRejected() {
        assertThatThrownBy(() -> ListType.listOf(new StringType()).minSize(3).maxSize(1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testModelItems() {
        ListType<Model> users = new ListType<>(new ModelType(USER));

        List<Model> converted = users.clean(List.of(Map.of("name", "Doggy")));

        assertThat(converted).hasSize(1);
        assertThat(converted.get(0).getDefinition()).isSameAs(USER);
        assertThat(converted.get(0).get("name")).isEqualTo("Doggy");
    }

    @Test
    void testScalarInModelListIsSingleStructuralError() {
        ListType<Model> users = new ListType<>(new ModelType(USER));

        assertThatThrownBy(() -> users.clean(List.of(Map.of("name", "a"), 1, 2)))
                .isInstanceOfSatisfying(StructureMismatchException.class,
                        e -> assertThat(e.getMessages()).hasSize(1));
    }

    @Test
    void testExportUsesItemExport() {
        ListType<Model> users = new ListType<>(new ModelType(USER));
        List<Model> converted = users.clean(List.of(Map.of("name", "Doggy")));

        assertThat(users.toPrimitive(converted, null)).isEqualTo(List.of(Map.of("name", "Doggy")));
    }

    @Test
    void testConvertedListIsUnmodifiable() {
        List<String> names = new ListType<>(new StringType()).clean(List.of("a"));

        assertThatThrownBy(() -> names.add("b")).isInstanceOf(UnsupportedOperationException.class);
    }
}
