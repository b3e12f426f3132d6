package me.christianrobert.arclabel.transformer.model;

/**
 * Scripting engine a label expression was written for.
 */
public enum ExpressionEngine {
    VBSCRIPT("VBScript"),
    ARCADE("Arcade"),
    PYTHON("Python"),
    JSCRIPT("JScript");

    private final String displayName;

    ExpressionEngine(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup by display name.
     *
     * @return The engine, or null if the name is unknown
     */
    public static ExpressionEngine fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (ExpressionEngine engine : values()) {
            if (engine.displayName.equalsIgnoreCase(trimmed)) {
                return engine;
            }
        }
        return null;
    }
}
