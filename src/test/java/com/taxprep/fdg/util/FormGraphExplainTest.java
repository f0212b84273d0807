package com.taxprep.fdg.util;

import com.taxprep.fdg.FormGraph;
import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.engine.ReturnGraph;
import com.taxprep.fdg.forms.y2025.F1040;
import org.junit.Test;

import static org.junit.Assert.*;

public class FormGraphExplainTest {

    @Test
    public void testDumpBuildOrder() {
        FormGraphExplain explain = new FormGraphExplain(FormGraph.builder(2025).buildOrder());
        String dump = explain.dumpBuildOrder();
        assertTrue(dump.startsWith("Catalog (15 forms)"));
        assertTrue(dump.contains("f1040 (ROOT)"));
        assertTrue(dump.contains("ws-income (WORKSHEET)"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new FormGraphExplain(FormGraph.builder(2025).buildOrder()).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("f1040[[\"f1040\"]];"));
        assertTrue(mermaid.contains("ws_income(\"ws-income\");"));
        assertTrue(mermaid.contains("ws_income --> f1040;"));
    }

    @Test
    public void testExplainForm() {
        ReturnGraph graph = FormGraph.builder(2025).build(SampleReturns.singleFiler(50000, 5000));
        String text = FormGraphExplain.explainForm(graph.node(F1040.class));
        assertTrue(text.contains("Form: f1040"));
        assertTrue(text.contains("Needed: true"));
        assertTrue(text.contains("l15 = 34250.0"));
    }
}
