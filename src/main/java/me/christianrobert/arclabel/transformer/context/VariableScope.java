package me.christianrobert.arclabel.transformer.context;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of the variables visible to one source fragment.
 *
 * <p>Two substitution modes:</p>
 * <ul>
 *   <li><strong>External reference</strong> - any known variable other than the self-reference
 *       target becomes its bound value: {@code d1 → @d1}.</li>
 *   <li><strong>Self reference</strong> - the target variable becomes the expression accumulated
 *       for it at this point of the branch, parenthesized: {@code t → (@t || 'a')}. A bare
 *       variable reference is substituted without parentheses.</li>
 * </ul>
 *
 * <p>Lookups are case-insensitive. Instances are never mutated; {@link #withSelfReference}
 * returns a new scope, so a scope can be handed to nested parsing steps safely.</p>
 */
public final class VariableScope {

    private static final VariableScope EMPTY = new VariableScope(Collections.emptyMap(), null, null);

    private final Map<String, String> variables;  // lower-case → canonical
    private final String selfVariable;            // canonical, null when no self reference is active
    private final String selfValue;

    private VariableScope(Map<String, String> variables, String selfVariable, String selfValue) {
        this.variables = variables;
        this.selfVariable = selfVariable;
        this.selfValue = selfValue;
    }

    /**
     * Scope with no variables: every identifier is left as written.
     */
    public static VariableScope empty() {
        return EMPTY;
    }

    /**
     * Scope in which every given variable is an external reference.
     */
    public static VariableScope of(Collection<String> variableNames) {
        Map<String, String> variables = new LinkedHashMap<>();
        for (String name : variableNames) {
            variables.putIfAbsent(name.toLowerCase(), name);
        }
        return new VariableScope(Collections.unmodifiableMap(variables), null, null);
    }

    /**
     * Returns a scope in which {@code variableName} reads {@code currentValue} instead of its bound value.
     *
     * @param variableName Target variable being updated
     * @param currentValue Accumulated expression for it at this point
     */
    public VariableScope withSelfReference(String variableName, String currentValue) {
        if (variableName == null || currentValue == null) {
            return this;
        }
        Map<String, String> extended = new LinkedHashMap<>(variables);
        extended.putIfAbsent(variableName.toLowerCase(), variableName);
        return new VariableScope(Collections.unmodifiableMap(extended), extended.get(variableName.toLowerCase()),
                currentValue);
    }

    /**
     * Resolves an identifier found outside quotes.
     *
     * @param identifier Whole-word identifier as written in the source
     * @return Replacement text, or null if the identifier is not a variable in this scope
     */
    public String resolve(String identifier) {
        String canonical = variables.get(identifier.toLowerCase());
        if (canonical == null) {
            return null;
        }
        if (canonical.equals(selfVariable)) {
            if (QgisExpressionUtils.isVariableReference(selfValue)) {
                return selfValue;
            }
            return "(" + selfValue + ")";
        }
        return QgisExpressionUtils.variableReference(canonical);
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    @Override
    public String toString() {
        return "VariableScope{" +
                "variables=" + variables.values() +
                ", selfVariable='" + selfVariable + '\'' +
                '}';
    }
}
