package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.engine.FormCatalog;

/**
 * Form catalog for tax year 2025.
 *
 * <p>
 * Attachments are declared in attachment sequence order; worksheets last.
 */
public final class Forms2025 {
    private Forms2025() {
        // Catalog holder
    }

    public static final int TAX_YEAR = Federal2025.TAX_YEAR;

    private static final FormCatalog CATALOG = FormCatalog.builder()
            .root(F1040.class, FormTag.F1040,
                    bc -> new F1040(bc.formContext(), bc.require(IncomeWorksheet.class),
                            bc.require(TaxComputationWorksheet.class), bc.require(Schedule2.class),
                            bc.require(Schedule3.class), bc.require(Schedule8812.class)),
                    IncomeWorksheet.class, TaxComputationWorksheet.class, Schedule2.class, Schedule3.class,
                    Schedule8812.class)
            .attachment(Schedule1.class, FormTag.SCHEDULE_1,
                    bc -> new Schedule1(bc.formContext(), bc.require(ScheduleC.class), bc.require(ScheduleE.class),
                            bc.require(ScheduleSE.class), bc.require(F8889.class)),
                    ScheduleC.class, ScheduleE.class, ScheduleSE.class, F8889.class)
            .attachment(Schedule2.class, FormTag.SCHEDULE_2,
                    bc -> new Schedule2(bc.formContext(), bc.require(ScheduleSE.class), bc.require(F8889.class),
                            bc.require(IncomeWorksheet.class), bc.require(ScheduleE.class)),
                    ScheduleSE.class, F8889.class, IncomeWorksheet.class, ScheduleE.class)
            .attachment(Schedule3.class, FormTag.SCHEDULE_3,
                    bc -> new Schedule3(bc.formContext(), bc.require(TaxComputationWorksheet.class)),
                    TaxComputationWorksheet.class)
            .attachment(ScheduleA.class, FormTag.SCHEDULE_A,
                    bc -> new ScheduleA(bc.formContext(), bc.require(IncomeWorksheet.class),
                            bc.require(StandardDeductionWorksheet.class)),
                    IncomeWorksheet.class, StandardDeductionWorksheet.class)
            .attachment(ScheduleB.class, FormTag.SCHEDULE_B, bc -> new ScheduleB(bc.formContext()))
            .attachment(ScheduleC.class, FormTag.SCHEDULE_C, bc -> ScheduleC.create(bc.formContext()))
            .attachment(ScheduleD.class, FormTag.SCHEDULE_D, bc -> new ScheduleD(bc.formContext()))
            .attachment(ScheduleE.class, FormTag.SCHEDULE_E, bc -> ScheduleE.create(bc.formContext()))
            .attachment(ScheduleSE.class, FormTag.SCHEDULE_SE,
                    bc -> ScheduleSE.create(bc.formContext(), bc.require(ScheduleC.class)),
                    ScheduleC.class)
            .attachment(Schedule8812.class, FormTag.SCHEDULE_8812,
                    bc -> new Schedule8812(bc.formContext(), bc.require(IncomeWorksheet.class),
                            bc.require(TaxComputationWorksheet.class), bc.require(Schedule1.class),
                            bc.require(Schedule3.class)),
                    IncomeWorksheet.class, TaxComputationWorksheet.class, Schedule1.class, Schedule3.class)
            .attachment(F8889.class, FormTag.F8889, bc -> F8889.create(bc.formContext()))
            .worksheet(StandardDeductionWorksheet.class, FormTag.WORKSHEET_STANDARD_DEDUCTION,
                    bc -> new StandardDeductionWorksheet(bc.formContext()))
            .worksheet(IncomeWorksheet.class, FormTag.WORKSHEET_INCOME,
                    bc -> new IncomeWorksheet(bc.formContext(), bc.require(ScheduleB.class),
                            bc.require(ScheduleD.class), bc.require(Schedule1.class)),
                    ScheduleB.class, ScheduleD.class, Schedule1.class)
            .worksheet(TaxComputationWorksheet.class, FormTag.WORKSHEET_TAX_COMPUTATION,
                    bc -> new TaxComputationWorksheet(bc.formContext(), bc.require(IncomeWorksheet.class),
                            bc.require(ScheduleA.class), bc.require(StandardDeductionWorksheet.class),
                            bc.require(ScheduleD.class)),
                    IncomeWorksheet.class, ScheduleA.class, StandardDeductionWorksheet.class, ScheduleD.class)
            .trailer(root -> ((F1040) root).voucher())
            .build();

    public static FormCatalog catalog() {
        return CATALOG;
    }
}
