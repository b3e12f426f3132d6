package me.christianrobert.arclabel.transformer.builder;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DomainCaseExpressionBuilderTest {

    @Test
    void codesAreComparedAsStringsInOrder() {
        Map<String, String> codedValues = new LinkedHashMap<>();
        codedValues.put("2", "Two");
        codedValues.put("1", "One");

        assertEquals("CASE WHEN \"CODE\" = '2' THEN 'Two' WHEN \"CODE\" = '1' THEN 'One' END",
                DomainCaseExpressionBuilder.build("CODE", codedValues, false));
    }

    @Test
    void descriptionsAreEscaped() {
        assertEquals("CASE WHEN \"OWNER\" = 'S' THEN 'State''s land' END",
                DomainCaseExpressionBuilder.build("OWNER", Map.of("S", "State's land"), false));
    }

    @Test
    void missingDescriptionFallsBackToCode() {
        Map<String, String> codedValues = new LinkedHashMap<>();
        codedValues.put("X", null);

        assertEquals("CASE WHEN \"T\" = 'X' THEN 'X' END", DomainCaseExpressionBuilder.build("T", codedValues, false));
    }

    @Test
    void emptyDomain() {
        assertNull(DomainCaseExpressionBuilder.build("T", Map.of(), false));
        assertNull(DomainCaseExpressionBuilder.build("T", null, false));
    }
}
