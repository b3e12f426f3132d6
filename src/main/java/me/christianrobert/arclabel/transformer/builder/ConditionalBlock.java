package me.christianrobert.arclabel.transformer.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A QGIS {@code CASE WHEN ... END} expression under construction.
 *
 * <p>Both If-chains and Select Case blocks reduce to this node: an ordered list of conditional
 * branches (first match wins) plus an optional fallback. Without a fallback the expression yields
 * NULL when no branch matches.</p>
 *
 * <pre>
 * single line:  CASE WHEN c1 THEN v1 WHEN c2 THEN v2 ELSE f END
 * pretty:       CASE
 *                 WHEN c1 THEN v1
 *                 WHEN c2 THEN v2
 *                 ELSE f
 *               END
 * </pre>
 */
public class ConditionalBlock {

    private final List<Branch> branches = new ArrayList<>();
    private Branch fallback;

    public ConditionalBlock addBranch(String condition, String value) {
        if (condition == null) {
            throw new IllegalArgumentException("Conditional branch requires a condition; use setFallback for ELSE");
        }
        branches.add(new Branch(condition, value));
        return this;
    }

    public ConditionalBlock setFallback(String value) {
        this.fallback = value != null ? Branch.fallback(value) : null;
        return this;
    }

    public List<Branch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    public Branch getFallback() {
        return fallback;
    }

    public boolean isEmpty() {
        return branches.isEmpty();
    }

    /**
     * Renders the CASE expression.
     *
     * @param prettyPrint One WHEN/ELSE per line instead of a single line
     * @throws IllegalStateException if no conditional branch was added
     */
    public String render(boolean prettyPrint) {
        if (branches.isEmpty()) {
            throw new IllegalStateException("CASE expression requires at least one WHEN branch");
        }

        String separator = prettyPrint ? "\n  " : " ";
        StringBuilder result = new StringBuilder("CASE");
        for (Branch branch : branches) {
            result.append(separator).append("WHEN ").append(branch.getCondition())
                  .append(" THEN ").append(branch.getValue());
        }
        if (fallback != null) {
            result.append(separator).append("ELSE ").append(fallback.getValue());
        }
        result.append(prettyPrint ? "\n" : " ").append("END");
        return result.toString();
    }
}
