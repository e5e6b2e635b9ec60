package com.mainframe.schema.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one validation call, before it is applied to an instance.
 */
@Value
@Builder
public class ValidationResult {

    /**
     * Converted values that passed validation and should be stored.
     */
    @Singular
    Map<String, Object> acceptedValues;

    /**
     * Messages for every field that failed.
     */
    @Singular
    Map<String, List<String>> errors;

    /**
     * Fields this call evaluated; their previous errors are replaced.
     */
    @Singular
    Set<String> evaluatedFields;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
