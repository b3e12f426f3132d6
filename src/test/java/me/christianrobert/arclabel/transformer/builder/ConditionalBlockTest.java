package me.christianrobert.arclabel.transformer.builder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalBlockTest {

    @Test
    void render_singleLine() {
        ConditionalBlock block = new ConditionalBlock()
                .addBranch("\"A\" = 1", "'one'")
                .addBranch("\"A\" = 2", "'two'")
                .setFallback("@t");

        assertEquals("CASE WHEN \"A\" = 1 THEN 'one' WHEN \"A\" = 2 THEN 'two' ELSE @t END", block.render(false));
    }

    @Test
    void render_prettyPrint() {
        ConditionalBlock block = new ConditionalBlock()
                .addBranch("\"A\" = 1", "'one'")
                .setFallback("@t");

        assertEquals("CASE\n  WHEN \"A\" = 1 THEN 'one'\n  ELSE @t\nEND", block.render(true));
    }

    @Test
    void render_withoutFallbackHasNoElse() {
        ConditionalBlock block = new ConditionalBlock().addBranch("c", "v");

        assertEquals("CASE WHEN c THEN v END", block.render(false));
        assertNull(block.getFallback());
    }

    @Test
    void branchesKeepOrder() {
        ConditionalBlock block = new ConditionalBlock().addBranch("c1", "v1").addBranch("c2", "v2").setFallback("f");

        assertEquals(2, block.getBranches().size());
        assertEquals("c1", block.getBranches().get(0).getCondition());
        assertFalse(block.getBranches().get(0).isFallback());
        assertTrue(block.getFallback().isFallback());
        assertEquals("ELSE f", block.getFallback().toString());
    }

    @Test
    void emptyBlockCannotRender() {
        ConditionalBlock block = new ConditionalBlock();

        assertTrue(block.isEmpty());
        assertThrows(IllegalStateException.class, () -> block.render(false));
        assertThrows(IllegalArgumentException.class, () -> block.addBranch(null, "v"));
    }
}
