package com.taxprep.fdg.scenario;

import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.RentalProperty;
import com.taxprep.fdg.model.ValidatedInformation;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ModificationApplierTest {
    private static final ValidatedInformation BASE = SampleReturns.singleFiler(50000, 5000);

    @Test
    public void testSetAdjustAppend() {
        ValidatedInformation derived = ModificationApplier.apply(BASE, List.of(
                Modification.set("Status", "taxPayer.filingStatus", FilingStatus.HOH),
                Modification.adjust("Raise", "w2s[0].income", 2500),
                Modification.append("Rental", "realEstate", new RentalProperty("1 Main St", 9000, 2000, 1000))));

        assertEquals(FilingStatus.HOH, derived.filingStatus());
        assertEquals(52500.0, derived.w2s().get(0).income(), 0.0);
        assertEquals(1, derived.realEstate().size());
        assertEquals("1 Main St", derived.realEstate().get(0).address());
    }

    @Test
    public void testAppliedInOrder() {
        ValidatedInformation derived = ModificationApplier.apply(BASE, List.of(
                Modification.set("Reset", "w2s[0].income", 1000),
                Modification.adjust("Raise", "w2s[0].income", 500)));
        assertEquals(1500.0, derived.w2s().get(0).income(), 0.0);

        ValidatedInformation reversed = ModificationApplier.apply(BASE, List.of(
                Modification.adjust("Raise", "w2s[0].income", 500),
                Modification.set("Reset", "w2s[0].income", 1000)));
        assertEquals(1000.0, reversed.w2s().get(0).income(), 0.0);
    }

    @Test
    public void testBaseUntouched() {
        ModificationApplier.apply(BASE, List.of(
                Modification.adjust("Raise", "w2s[0].income", 1),
                Modification.append("W-2", "w2s", SampleReturns.w2(PersonRole.PRIMARY, 100, 0))));
        assertEquals(50000.0, BASE.w2s().get(0).income(), 0.0);
        assertEquals(1, BASE.w2s().size());
    }

    @Test
    public void testAppendedElementBindsToRecord() {
        IncomeW2 w2 = SampleReturns.w2(PersonRole.SPOUSE, 30000, 3000);
        ValidatedInformation derived = ModificationApplier.apply(BASE, List.of(Modification.append("W-2", "w2s", w2)));
        assertEquals(w2, derived.w2s().get(1));
    }

    @Test
    public void testEmptyListIsIdentity() {
        assertEquals(BASE, ModificationApplier.apply(BASE, List.of()));
    }

    @Test
    public void testBadPaths() {
        assertRejected(Modification.set("x", "w2s[3].income", 1), "out of range");
        assertRejected(Modification.set("x", "nope", 1), "Unknown property");
        assertRejected(Modification.set("x", "w2s..income", 1), "Malformed");
        assertRejected(Modification.adjust("x", "taxPayer.filingStatus", 1), "not numeric");
        assertRejected(Modification.append("x", "w2s[0].income", 1), "not a list");
        assertRejected(Modification.set("x", "taxPayer.spouse.firstName", "Sam"), "Nothing at");
    }

    @Test
    public void testValueThatDoesNotBindIsRejected() {
        assertRejected(Modification.set("x", "taxPayer.filingStatus", "MARRIED"), "not valid");
    }

    @Test
    public void testPathParsing() {
        List<ModificationApplier.Step> steps = ModificationApplier.parse("a.b[2][0].c");
        assertEquals(5, steps.size());
        assertEquals("a", steps.get(0).field());
        assertEquals(2, steps.get(2).index());
        assertEquals(0, steps.get(3).index());
        assertEquals("c", steps.get(4).field());
    }

    private static void assertRejected(Modification m, String reason) {
        try {
            ModificationApplier.apply(BASE, List.of(m));
            fail("Expected rejection of " + m.fieldPath());
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(reason));
        }
    }
}
