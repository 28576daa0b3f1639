package io.github.formtranscoder.pattern;

import io.github.formtranscoder.schema.ArrayItemStructure;
import io.github.formtranscoder.schema.BranchNameTable;
import io.github.formtranscoder.schema.FieldHierarchy;
import io.github.formtranscoder.schema.NestedStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiles a {@link FieldHierarchy} into the ordered list of {@link FieldPattern}s used to
 * route flat form keys.
 *
 * <p>Every hierarchy entry is scoped on its own array field name, so the same patterns
 * serve container items ({@code stores_0_...}) and nested items that the assembler has
 * re-keyed ({@code bike_sales_0_...}). The result is stably sorted by {@link PatternKind}
 * priority and free of duplicates.</p>
 */
public class PatternCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(PatternCompiler.class);

    private static final String INDEX = "_\\d+_";

    private final List<String> branchTokens;

    public PatternCompiler() {
        this(List.of());
    }

    public PatternCompiler(BranchNameTable branchNames) {
        this(branchNames.asMap().keySet());
    }

    /**
     * @param branchTokens lower-cased union branch tokens accepted between a union field
     *                     and its member property
     */
    public PatternCompiler(Iterable<String> branchTokens) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : Objects.requireNonNull(branchTokens, "branchTokens")) {
            if (token != null && !token.isEmpty()) {
                tokens.add(token);
            }
        }
        // Longest first so that rootmodel_mountainbike is tried before mountainbike
        this.branchTokens = tokens.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
    }

    /**
     * @throws PatternGenerationException if an entry carries a blank array or field name
     */
    public List<FieldPattern> generatePatterns(FieldHierarchy hierarchy) {
        Objects.requireNonNull(hierarchy, "hierarchy");
        Set<FieldPattern> patterns = new LinkedHashSet<>();

        for (Map.Entry<String, ArrayItemStructure> entry : hierarchy.getEntries().entrySet()) {
            String path = entry.getKey();
            ArrayItemStructure structure = entry.getValue();
            if (structure == null) {
                throw new PatternGenerationException(path, "Hierarchy entry has no structure");
            }
            try {
                compileEntry(path, structure, patterns);
            } catch (PatternSyntaxException e) {
                throw new PatternGenerationException(path, "Generated pattern does not compile", e);
            }
        }

        List<FieldPattern> ordered = new ArrayList<>(patterns);
        // List.sort is stable: equal kinds keep generation order
        ordered.sort(Comparator.comparing(FieldPattern::getKind));

        LOG.debug("Generated {} patterns from {} hierarchy entries", ordered.size(), hierarchy.getEntries().size());
        if (LOG.isTraceEnabled()) {
            ordered.forEach(p -> LOG.trace("  {}", p));
        }
        return List.copyOf(ordered);
    }

    private void compileEntry(String path, ArrayItemStructure structure, Set<FieldPattern> patterns) {
        String array = requireName(path, structure.arrayField(), "array field");
        String scope = "^" + Pattern.quote(array) + INDEX;

        for (Map.Entry<String, NestedStructure> nested : structure.nestedObjects().entrySet()) {
            String name = requireName(path, nested.getKey(), "nested field");
            NestedStructure shape = nested.getValue();

            if (shape instanceof NestedStructure.NestedArrayFields fields) {
                if (fields.isUnionBearing()) {
                    addFlattened(path, name, fields, patterns);
                } else {
                    for (String field : fields.directFields()) {
                        requireName(path, field, "nested array field");
                        patterns.add(new FieldPattern(
                                Pattern.compile(scope + Pattern.quote(name) + "_(\\d+)_" + Pattern.quote(field) + "$"),
                                PatternKind.NESTED_ARRAY_DIRECT, array, name, field));
                    }
                }
            } else if (shape instanceof NestedStructure.ReferenceFields reference) {
                for (String property : reference.properties()) {
                    requireName(path, property, "reference property");
                    patterns.add(new FieldPattern(
                            Pattern.compile(scope + Pattern.quote(name) + "_" + Pattern.quote(property) + "$"),
                            PatternKind.REFERENCE_NESTED, array, name, property));
                }
            } else if (shape instanceof NestedStructure.SimpleList list) {
                for (String field : list.fields()) {
                    requireName(path, field, "nested field");
                    patterns.add(new FieldPattern(
                            Pattern.compile(scope + Pattern.quote(name) + "_" + Pattern.quote(field) + "$"),
                            PatternKind.SIMPLE_NESTED, array, name, field));
                }
            }
        }

        for (String arrayField : structure.arrayFields()) {
            requireName(path, arrayField, "array field");
            patterns.add(new FieldPattern(
                    Pattern.compile(scope + Pattern.quote(arrayField) + "_(\\d+)_(.+)$"),
                    PatternKind.NESTED_ARRAY_GENERIC, array, arrayField, null));
        }

        patterns.add(new FieldPattern(Pattern.compile(scope + "(.+)$"), PatternKind.DIRECT, array, null, null));
    }

    /**
     * Union-bearing nested array: patterns are scoped on the nested array itself since its
     * items are rebuilt from re-keyed fields.
     */
    private void addFlattened(String path, String nested, NestedStructure.NestedArrayFields fields,
                              Set<FieldPattern> patterns) {
        String scope = "^" + Pattern.quote(nested) + INDEX;
        String branch = branchTokens.isEmpty()
                ? ""
                : "(?:((?i:" + branchTokens.stream().map(Pattern::quote).collect(Collectors.joining("|")) + "))_)?";

        for (Map.Entry<String, List<String>> union : fields.unionFields().entrySet()) {
            String unionField = requireName(path, union.getKey(), "union field");
            for (String property : union.getValue()) {
                requireName(path, property, "union member");
                patterns.add(new FieldPattern(
                        Pattern.compile(scope + Pattern.quote(unionField) + "_" + branch + Pattern.quote(property) + "$"),
                        PatternKind.FLATTENED_UNION, nested, property, unionField));
            }
        }
        for (String field : fields.directFields()) {
            requireName(path, field, "nested array field");
            patterns.add(new FieldPattern(
                    Pattern.compile(scope + Pattern.quote(field) + "$"),
                    PatternKind.FLATTENED_DIRECT, nested, field, null));
        }
    }

    private static String requireName(String path, String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new PatternGenerationException(path, "Blank " + what + " name");
        }
        return name;
    }
}
