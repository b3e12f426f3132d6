package me.christianrobert.arclabel.transformer.builder;

/**
 * One arm of a conditional: WHEN condition THEN value, or the ELSE arm when condition is null.
 */
public class Branch {

    private final String condition;
    private final String value;

    public Branch(String condition, String value) {
        this.condition = condition;
        this.value = value;
    }

    public static Branch fallback(String value) {
        return new Branch(null, value);
    }

    public String getCondition() {
        return condition;
    }

    public String getValue() {
        return value;
    }

    public boolean isFallback() {
        return condition == null;
    }

    @Override
    public String toString() {
        return isFallback() ? "ELSE " + value : "WHEN " + condition + " THEN " + value;
    }
}
