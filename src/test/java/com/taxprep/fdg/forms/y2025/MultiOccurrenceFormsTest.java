package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.FormGraph;
import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.assembly.FieldTemplates;
import com.taxprep.fdg.assembly.FilingSet;
import com.taxprep.fdg.assembly.FilingSetAssembler;
import com.taxprep.fdg.engine.ReturnGraph;
import com.taxprep.fdg.model.CoverageType;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.HealthSavingsAccount;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.TaxPayer;
import com.taxprep.fdg.model.ValidatedInformation;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class MultiOccurrenceFormsTest {

    private static ValidatedInformation.Builder joint() {
        return ValidatedInformation.builder(2025)
                .taxPayer(new TaxPayer(FilingStatus.MFJ, SampleReturns.primary(), SampleReturns.spouse(), List.of()))
                .w2(SampleReturns.w2(PersonRole.PRIMARY, 70000, 12000))
                .w2(SampleReturns.w2(PersonRole.SPOUSE, 50000, 8000));
    }

    @Test
    public void testOneScheduleSEPerSelfEmployedPerson() {
        ReturnGraph graph = FormGraph.builder(2025).build(joint()
                .business(SampleReturns.business("Design", PersonRole.PRIMARY, 25000, 5000))
                .business(SampleReturns.business("Bakery", PersonRole.SPOUSE, 18000, 8000))
                .build());
        ScheduleSE se = graph.node(ScheduleSE.class);

        assertEquals(PersonRole.PRIMARY, se.personRole());
        assertEquals(1, se.copies().size());
        assertEquals(PersonRole.SPOUSE, se.copies().get(0).personRole());
        assertEquals(1, se.copies().get(0).copyIndex());
        assertEquals(20000 * 0.9235, se.l6(), 0.001);
        assertEquals(10000 * 0.9235, se.copies().get(0).l6(), 0.001);

        FilingSet set = FilingSetAssembler.assemble(graph);
        assertEquals(2, set.count(FormTag.SCHEDULE_SE));
        assertEquals(2, set.count(FormTag.SCHEDULE_C));
        FieldTemplates.load().verify(set);
    }

    @Test
    public void testSmallProfitNeedsNoScheduleSE() {
        ReturnGraph graph = FormGraph.builder(2025).build(joint()
                .business(SampleReturns.business("Design", PersonRole.PRIMARY, 25000, 5000))
                .business(SampleReturns.business("Stall", PersonRole.SPOUSE, 700, 400))
                .build());
        ScheduleSE se = graph.node(ScheduleSE.class);
        assertTrue(se.copies().isEmpty());
        assertEquals(PersonRole.PRIMARY, se.personRole());
        assertEquals(1, FilingSetAssembler.assemble(graph).count(FormTag.SCHEDULE_SE));
    }

    @Test
    public void testNoBusinessMeansNoScheduleSE() {
        ReturnGraph graph = FormGraph.builder(2025).build(joint().build());
        assertFalse(graph.node(ScheduleSE.class).isNeeded());
        assertFalse(graph.node(ScheduleC.class).isNeeded());
        assertEquals(0.0, graph.node(ScheduleSE.class).totalTax(), 0.0);
    }

    @Test
    public void testOneForm8889PerHolder() {
        ReturnGraph graph = FormGraph.builder(2025).build(joint()
                .hsa(new HealthSavingsAccount("Primary HSA", PersonRole.PRIMARY, CoverageType.SELF_ONLY, 5000, 0, 0))
                .hsa(new HealthSavingsAccount("Spouse HSA", PersonRole.SPOUSE, CoverageType.FAMILY, 9000, 1000, 400))
                .build());
        F8889 f = graph.node(F8889.class);

        assertEquals(PersonRole.PRIMARY, f.personRole());
        assertEquals(1, f.copies().size());
        assertEquals(4300.0, f.l13(), 0.0);
        assertEquals(8550.0, f.copies().get(0).l13(), 0.0);
        assertEquals(4300.0 + 8550.0, f.totalDeduction(), 0.0);
        assertEquals(600.0, f.totalTaxableDistributions(), 0.0);
        assertEquals(120.0, f.totalAdditionalTax(), 0.001);

        FilingSet set = FilingSetAssembler.assemble(graph);
        assertEquals(2, set.count(FormTag.F8889));
        assertTrue(set.contains(FormTag.SCHEDULE_1));
        assertTrue(set.contains(FormTag.SCHEDULE_2));
        FieldTemplates.load().verify(set);
    }

    @Test
    public void testOnlySpouseHoldsHsa() {
        ReturnGraph graph = FormGraph.builder(2025).build(joint()
                .hsa(new HealthSavingsAccount("Spouse HSA", PersonRole.SPOUSE, CoverageType.SELF_ONLY, 1000, 0, 0))
                .build());
        F8889 f = graph.node(F8889.class);
        assertEquals(PersonRole.SPOUSE, f.personRole());
        assertEquals(0, f.copyIndex());
        assertTrue(f.copies().isEmpty());
    }
}
