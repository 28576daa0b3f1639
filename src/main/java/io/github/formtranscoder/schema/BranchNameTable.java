package io.github.formtranscoder.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps union discriminator tokens to display variant names and back.
 *
 * <p>Tokens are compared lower-cased. A branch definition {@code RootModel_MountainBike}
 * contributes the tokens {@code rootmodel_mountainbike} and {@code mountainbike}, both
 * resolving to {@code MountainBike}. Explicitly configured entries take precedence.</p>
 */
public final class BranchNameTable {

    private final Map<String, String> displayByToken;
    private final Map<String, String> tokenByDisplay;

    private BranchNameTable(Map<String, String> displayByToken) {
        this.displayByToken = Collections.unmodifiableMap(displayByToken);
        Map<String, String> reverse = new LinkedHashMap<>();
        // Shortest token wins: it is the one the flattener writes into keys.
        displayByToken.forEach((token, display) -> reverse.merge(display, token,
                (a, b) -> b.length() < a.length() ? b : a));
        this.tokenByDisplay = Collections.unmodifiableMap(reverse);
    }

    public static BranchNameTable of(Map<String, String> configured, Collection<String> branchDefinitions) {
        Map<String, String> table = new LinkedHashMap<>();
        for (String definition : branchDefinitions) {
            String display = displayName(definition);
            table.put(definition.toLowerCase(Locale.ROOT), display);
            table.putIfAbsent(display.toLowerCase(Locale.ROOT), display);
        }
        configured.forEach((token, display) -> table.put(token.toLowerCase(Locale.ROOT), display));
        return new BranchNameTable(table);
    }

    /**
     * Display name for a branch definition: the part after the last underscore.
     */
    public static String displayName(String definitionName) {
        int idx = definitionName.lastIndexOf('_');
        return idx >= 0 && idx < definitionName.length() - 1
                ? definitionName.substring(idx + 1)
                : definitionName;
    }

    /**
     * Returns the display name for {@code token}, or the token unchanged when unknown.
     */
    public String resolve(String token) {
        if (token == null) {
            return null;
        }
        return displayByToken.getOrDefault(token.toLowerCase(Locale.ROOT), token);
    }

    /**
     * Returns the key token for a display name. Empty for values not in the table, since
     * compiled union patterns only recognise known tokens.
     */
    public Optional<String> tokenFor(String display) {
        return Optional.ofNullable(tokenByDisplay.get(display));
    }

    public Map<String, String> asMap() {
        return displayByToken;
    }

    @Override
    public String toString() {
        return "BranchNameTable" + displayByToken;
    }
}
