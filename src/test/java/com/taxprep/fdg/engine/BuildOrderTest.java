package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.CyclicDependencyException;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.api.MissingDependencyException;
import com.taxprep.fdg.engine.CatalogFixtures.Detail;
import com.taxprep.fdg.engine.CatalogFixtures.Income;
import com.taxprep.fdg.engine.CatalogFixtures.Other;
import com.taxprep.fdg.engine.CatalogFixtures.Root;
import com.taxprep.fdg.forms.y2025.F1040;
import com.taxprep.fdg.forms.y2025.Forms2025;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class BuildOrderTest {

    @Test
    public void testDependenciesFirst() {
        BuildOrder order = BuildOrder.of(CatalogFixtures.small());
        // Other and Detail are ready at once; Other is declared first
        assertEquals(List.of("Other", "Detail", "Income", "Root"), order.names());
        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.childCount(1));
        assertEquals(1, order.parentCount(3));
        assertEquals(0, order.childCount(3));
    }

    @Test
    public void testDeterministic() {
        assertEquals(BuildOrder.of(CatalogFixtures.small()).names(), BuildOrder.of(CatalogFixtures.small()).names());
    }

    @Test
    public void testUndeclaredDependency() {
        FormCatalog catalog = FormCatalog.builder()
                .root(Root.class, FormTag.F1040, bc -> new Root(bc.formContext(), bc.require(Income.class)),
                        Income.class)
                .build();
        try {
            BuildOrder.of(catalog);
            fail("Expected MissingDependencyException");
        } catch (MissingDependencyException e) {
            assertTrue(e.getMessage().contains("Income"));
        }
    }

    @Test
    public void testCycle() {
        FormCatalog catalog = FormCatalog.builder()
                .root(Root.class, FormTag.F1040, bc -> new Root(bc.formContext(), bc.require(Income.class)),
                        Income.class)
                .attachment(Detail.class, FormTag.SCHEDULE_B, bc -> new Detail(bc.formContext()), Income.class)
                .worksheet(Income.class, FormTag.WORKSHEET_INCOME,
                        bc -> new Income(bc.formContext(), bc.require(Detail.class)), Detail.class)
                .attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()))
                .build();
        try {
            BuildOrder.of(catalog);
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Ordered 1 of 4"));
            assertTrue(e.getMessage().contains("Detail"));
            assertTrue(e.getMessage().contains("Income"));
        }
    }

    @Test
    public void testCatalogRules() {
        try {
            FormCatalog.builder().attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()))
                    .build();
            fail("Expected missing root");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("no root"));
        }
        try {
            FormCatalog.builder()
                    .attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()))
                    .attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()));
            fail("Expected duplicate type");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("Duplicate"));
        }
        try {
            FormCatalog.builder().attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()),
                    Other.class);
            fail("Expected self-dependency rejection");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("Self-dependency"));
        }
    }

    @Test
    public void testYearCatalogRootIsLast() {
        BuildOrder order = BuildOrder.of(Forms2025.catalog());
        assertEquals(15, order.size());
        assertSame(F1040.class, order.definition(order.size() - 1).type());
        assertEquals(0, order.childCount(order.size() - 1));
        List<String> names = order.names();
        assertTrue(names.indexOf("ScheduleC") < names.indexOf("ScheduleSE"));
        assertTrue(names.indexOf("Schedule1") < names.indexOf("IncomeWorksheet"));
        assertTrue(names.indexOf("IncomeWorksheet") < names.indexOf("ScheduleA"));
        assertTrue(names.indexOf("ScheduleA") < names.indexOf("TaxComputationWorksheet"));
    }
}
