package com.taxprep.fdg.scenario;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ScenarioSelectionTest {

    @Test
    public void testFirstSelectedIsEvicted() {
        ScenarioSelection selection = new ScenarioSelection();
        assertNull(selection.select("a"));
        assertNull(selection.select("b"));
        assertNull(selection.select("c"));
        assertEquals("a", selection.select("d"));
        assertEquals(List.of("b", "c", "d"), selection.selected());
    }

    @Test
    public void testReselectIsNoOp() {
        ScenarioSelection selection = new ScenarioSelection(2);
        selection.select("a");
        selection.select("b");
        assertNull(selection.select("a"));
        // "a" keeps its place as the oldest
        assertEquals("a", selection.select("c"));
    }

    @Test
    public void testDeselectAndClear() {
        ScenarioSelection selection = new ScenarioSelection();
        selection.select("a");
        selection.select("b");
        assertTrue(selection.deselect("a"));
        assertFalse(selection.deselect("a"));
        assertFalse(selection.contains("a"));
        assertTrue(selection.contains("b"));
        selection.clear();
        assertTrue(selection.selected().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLimitMustBePositive() {
        new ScenarioSelection(0);
    }
}
