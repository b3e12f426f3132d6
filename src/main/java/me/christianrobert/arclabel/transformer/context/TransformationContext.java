package me.christianrobert.arclabel.transformer.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Context for a single label program transformation.
 *
 * <p><strong>Two layers:</strong></p>
 * <ul>
 *   <li><strong>Settings</strong> - function-header name and output layout, fixed at creation
 *       (the header name is replaced once if the program declares its own).</li>
 *   <li><strong>Program state</strong> - variables assigned in the initial-assignment chain, in source
 *       order, and the target variable (the last of them). Filled by the program driver before any
 *       control-flow block is visited, read-only afterwards.</li>
 * </ul>
 *
 * <p>Variable names are case-insensitive (VBScript semantics). The spelling of the first
 * assignment is the canonical name used in the output.</p>
 *
 * <p>Each transformation creates a fresh context; nothing here is shared between calls.</p>
 */
public class TransformationContext {

    /**
     * A variable from the initial-assignment chain with its translated initializer.
     * The same name may be assigned more than once; each assignment is its own definition.
     */
    public static class VariableDefinition {
        private final String variableName;
        private final String qgisInitializer;
        private final int lineNumber;

        public VariableDefinition(String variableName, String qgisInitializer, int lineNumber) {
            this.variableName = variableName;
            this.qgisInitializer = qgisInitializer;
            this.lineNumber = lineNumber;
        }

        public String getVariableName() {
            return variableName;
        }

        public String getQgisInitializer() {
            return qgisInitializer;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        @Override
        public String toString() {
            return "VariableDefinition{" +
                    "variableName='" + variableName + '\'' +
                    ", qgisInitializer='" + qgisInitializer + '\'' +
                    ", lineNumber=" + lineNumber +
                    '}';
        }
    }

    // ========== Settings ==========

    private String functionName;
    private final boolean prettyPrint;

    // ========== Program state ==========

    private final Map<String, String> canonicalNames = new LinkedHashMap<>();  // lower-case → first spelling
    private final List<VariableDefinition> initialAssignments = new ArrayList<>();
    private String targetVariable;

    public TransformationContext(String functionName, boolean prettyPrint) {
        this.functionName = functionName;
        this.prettyPrint = prettyPrint;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Replaces the configured function name with the one declared by the program header.
     */
    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public boolean isFunctionName(String name) {
        return functionName != null && functionName.equalsIgnoreCase(name);
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    /**
     * Records an initial assignment. The assigned name becomes the target variable candidate.
     *
     * @param name Variable name as written in the source
     * @param qgisInitializer Translated right-hand side
     * @param lineNumber Source line of the assignment
     * @return The canonical spelling of the variable
     */
    public String addInitialAssignment(String name, String qgisInitializer, int lineNumber) {
        String canonical = canonicalNames.computeIfAbsent(name.toLowerCase(), key -> name);
        initialAssignments.add(new VariableDefinition(canonical, qgisInitializer, lineNumber));
        targetVariable = canonical;
        return canonical;
    }

    public List<VariableDefinition> getInitialAssignments() {
        return Collections.unmodifiableList(initialAssignments);
    }

    public boolean hasInitialAssignments() {
        return !initialAssignments.isEmpty();
    }

    /**
     * Canonical names of all variables assigned so far, in first-assignment order.
     */
    public List<String> getVariableNames() {
        return new ArrayList<>(canonicalNames.values());
    }

    /**
     * Resolves a source identifier to its canonical variable name.
     *
     * @return Canonical name, or null if the identifier is not a known variable
     */
    public String resolveVariable(String identifier) {
        if (identifier == null) {
            return null;
        }
        return canonicalNames.get(identifier.toLowerCase());
    }

    /**
     * The variable whose final value is the label text: the last one assigned
     * before the first control-flow block.
     */
    public String getTargetVariable() {
        return targetVariable;
    }

    public boolean isTargetVariable(String identifier) {
        return targetVariable != null && targetVariable.equalsIgnoreCase(identifier);
    }

    /**
     * Scope seen by a fragment evaluated while the target variable holds {@code currentValue}.
     *
     * @param currentValue Accumulated expression for the target at this point
     */
    public VariableScope scopeAt(String currentValue) {
        return VariableScope.of(getVariableNames()).withSelfReference(targetVariable, currentValue);
    }

    /**
     * Scope in which every known variable, the target included, reads its bound value.
     */
    public VariableScope externalScope() {
        return VariableScope.of(getVariableNames());
    }
}
