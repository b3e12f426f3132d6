package me.christianrobert.arclabel.transformer.model;

/**
 * One label class as extracted from its source document: name, expression text and engine name.
 */
public class LabelDefinition {

    private String name;
    private String expression;
    private String engine;  // Null means VBScript

    public LabelDefinition() {
        // For JSON deserialization
    }

    public LabelDefinition(String name, String expression, String engine) {
        this.name = name;
        this.expression = expression;
        this.engine = engine;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    @Override
    public String toString() {
        return "LabelDefinition{" +
                "name='" + name + '\'' +
                ", engine='" + engine + '\'' +
                '}';
    }
}
