package com.mainframe.schema.validation;

/**
 * How much of the schema a validation call enforces.
 */
public enum ValidationMode {

    /**
     * Every declared field is evaluated; required fields without a value are reported
     * and declared defaults fill unset fields.
     */
    FULL,

    /**
     * Only fields present in the input are evaluated. No completeness checks, no defaults.
     */
    PARTIAL
}
