package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import com.mainframe.schema.exception.FieldValidationException;
import com.mainframe.schema.exception.RequiredFieldException;
import com.mainframe.schema.exception.SizeConstraintException;
import com.mainframe.schema.exception.StructureMismatchException;
import com.mainframe.schema.model.Model;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * List of values of one item type, optionally bounded in size.
 *
 * <p>Every element is cleaned with the item type. Element failures are collected and
 * reported together, one message per failing index. A list whose item type is a
 * {@link ModelType} and which contains a non-mapping element fails as a whole with a
 * single structural error.</p>
 *
 * <p>{@code required} governs presence of the list value; an empty list satisfies it.
 * A positive {@code minSize} constrains length and implies {@code required}.</p>
 *
 * @param <E> item type
 */
@Getter
public class ListType<E> extends FieldType<List<E>> {

    private final FieldType<E> itemType;
    private final Integer minSize;
    private final Integer maxSize;

    public ListType(FieldType<E> itemType) {
        this(itemType, false, null, null, null, null);
    }

    @Builder
    public ListType(@NonNull FieldType<E> itemType, boolean required, List<E> defaultValue,
                    @Singular List<FieldValidator<List<E>>> validators,
                    Integer minSize, Integer maxSize) {
        super(required, defaultValue != null ? List.copyOf(defaultValue) : null, List.of(), validators);
        if (minSize != null && maxSize != null && minSize > maxSize) {
            throw new IllegalArgumentException("minSize " + minSize + " is greater than maxSize " + maxSize);
        }
        this.itemType = itemType;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * Builder with the item type already set, so the element type is inferred.
     */
    public static <E> ListTypeBuilder<E> listOf(FieldType<E> itemType) {
        return ListType.<E>builder().itemType(itemType);
    }

    @Override
    public boolean isRequired() {
        return super.isRequired() || (minSize != null && minSize > 0);
    }

    @Override
    public List<E> convert(Object raw) {
        List<?> items = asList(raw);

        if (itemType instanceof ModelType) {
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (item != null && !(item instanceof Map) && !(item instanceof Model)) {
                    throw new StructureMismatchException(
                            "Please use a mapping for each item; item " + i + " is a "
                                    + item.getClass().getSimpleName() + ".");
                }
            }
        }

        List<E> converted = new ArrayList<>(items.size());
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item == null) {
                errors.add(itemMessage(i, RequiredFieldException.MESSAGE));
                continue;
            }
            try {
                converted.add(itemType.clean(item));
            } catch (FieldValidationException e) {
                for (String message : e.getMessages()) {
                    errors.add(itemMessage(i, message));
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ConversionException(errors);
        }
        return List.copyOf(converted);
    }

    @Override
    public void validate(List<E> value) {
        if (minSize != null && value.size() < minSize) {
            throw new SizeConstraintException("Please provide at least " + minSize + " item(s).");
        }
        if (maxSize != null && value.size() > maxSize) {
            throw new SizeConstraintException("Please provide no more than " + maxSize + " item(s).");
        }
        super.validate(value);
    }

    @Override
    public Object toPrimitive(List<E> value, String role) {
        List<Object> exported = new ArrayList<>(value.size());
        for (E item : value) {
            exported.add(itemType.toPrimitive(item, role));
        }
        return exported;
    }

    private static List<?> asList(Object raw) {
        if (raw instanceof List<?> list) {
            return list;
        }
        if (raw instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(raw, i));
            }
            return items;
        }
        throw new StructureMismatchException("Expected a list of items.");
    }

    private static String itemMessage(int index, String message) {
        return "Item " + index + ": " + message;
    }

    @Override
    public String toString() {
        return "ListType<" + itemType + ">" + (isRequired() ? "(required)" : "");
    }
}
