package io.github.formtranscoder.pattern;

/**
 * Kinds of field patterns. Declaration order is matching priority: when several patterns
 * match one key, the kind declared first wins.
 */
public enum PatternKind {

    /** {@code nested_N_union_[branch_]property}: union member flattened into the nested item. */
    FLATTENED_UNION,

    /** {@code nested_N_field}: direct field of a union-bearing nested item. */
    FLATTENED_DIRECT,

    /** {@code array_N_nested_M_field}: direct field of a nested array item. */
    NESTED_ARRAY_DIRECT,

    /** {@code array_N_nested_M_rest}: anything below a nested array item, rebuilt recursively. */
    NESTED_ARRAY_GENERIC,

    /** {@code array_N_object_field}: property of an inline object or item-level union. */
    SIMPLE_NESTED,

    /** {@code array_N_ref_property}: property of a referenced object. */
    REFERENCE_NESTED,

    /** {@code array_N_field}: plain item field. */
    DIRECT
}
