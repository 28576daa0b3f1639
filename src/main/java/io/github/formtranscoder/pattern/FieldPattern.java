package io.github.formtranscoder.pattern;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One compiled rule mapping a flat form key to its place in an item.
 *
 * <p>Group layout of {@link #getRegex()} depends on the kind:</p>
 * <ul>
 *   <li>{@code FLATTENED_UNION}: group 1 is the optional branch token, when branch tokens are known</li>
 *   <li>{@code NESTED_ARRAY_DIRECT}: group 1 is the nested index</li>
 *   <li>{@code NESTED_ARRAY_GENERIC}: group 1 is the nested index, group 2 the remainder</li>
 *   <li>{@code DIRECT}: group 1 is the field name</li>
 *   <li>other kinds: no groups</li>
 * </ul>
 */
public final class FieldPattern {

    private final Pattern regex;
    private final PatternKind kind;
    private final String arrayField;
    private final String targetField;
    private final String subField;

    /**
     * @param regex       anchored pattern matched against the whole key
     * @param kind        what a match means
     * @param arrayField  array the pattern is scoped on (the nested array for flattened kinds)
     * @param targetField property receiving the value: the field itself, the nested array,
     *                    or the object grouping the value; null for {@code DIRECT}
     * @param subField    union field for {@code FLATTENED_UNION}, property inside the group
     *                    for {@code SIMPLE_NESTED}/{@code REFERENCE_NESTED}, otherwise null
     */
    public FieldPattern(Pattern regex, PatternKind kind, String arrayField, String targetField, String subField) {
        this.regex = Objects.requireNonNull(regex, "regex");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.arrayField = arrayField;
        this.targetField = targetField;
        this.subField = subField;
    }

    public Matcher match(String key) {
        Matcher matcher = regex.matcher(key);
        return matcher.matches() ? matcher : null;
    }

    public Pattern getRegex() {
        return regex;
    }

    public PatternKind getKind() {
        return kind;
    }

    public String getArrayField() {
        return arrayField;
    }

    public String getTargetField() {
        return targetField;
    }

    public String getSubField() {
        return subField;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPattern that)) return false;
        return kind == that.kind
                && regex.pattern().equals(that.regex.pattern())
                && Objects.equals(arrayField, that.arrayField)
                && Objects.equals(targetField, that.targetField)
                && Objects.equals(subField, that.subField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regex.pattern(), kind, arrayField, targetField, subField);
    }

    @Override
    public String toString() {
        return kind + " " + regex.pattern();
    }
}
