package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.TaxPayer;
import com.taxprep.fdg.model.ValidatedInformation;
import com.taxprep.fdg.node.FormContext;
import org.junit.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.*;

public class StandardDeductionWorksheetTest {

    private static StandardDeductionWorksheet worksheet(TaxPayer taxPayer, double wages) {
        ValidatedInformation info = ValidatedInformation.builder(2025)
                .taxPayer(taxPayer)
                .w2(SampleReturns.w2(PersonRole.PRIMARY, wages, 0))
                .build();
        return new StandardDeductionWorksheet(FormContext.of(info));
    }

    @Test
    public void testBaseAmounts() {
        assertEquals(15750.0, worksheet(SampleReturns.single(), 1).standardDeduction(), 0.0);
        TaxPayer joint = new TaxPayer(FilingStatus.MFJ, SampleReturns.primary(), SampleReturns.spouse(), List.of());
        assertEquals(31500.0, worksheet(joint, 1).standardDeduction(), 0.0);
        TaxPayer head = new TaxPayer(FilingStatus.HOH, SampleReturns.primary(), null, List.of());
        assertEquals(23625.0, worksheet(head, 1).standardDeduction(), 0.0);
    }

    @Test
    public void testSeniorAndBlindAllowances() {
        Person senior = new Person("Pat", "Lee", "222-33-4444", LocalDate.of(1955, 3, 1), true, false);
        StandardDeductionWorksheet ws = worksheet(new TaxPayer(FilingStatus.S, senior, null, List.of()), 1);
        assertEquals(2, ws.allowances());
        assertEquals(15750.0 + 2 * 2000, ws.standardDeduction(), 0.0);
    }

    @Test
    public void testBornOnJanuaryFirstCountsAsSenior() {
        Person turning = new Person("Pat", "Lee", "222-33-4444", LocalDate.of(1961, 1, 1), false, false);
        Person notYet = new Person("Pat", "Lee", "222-33-4444", LocalDate.of(1961, 1, 2), false, false);
        assertEquals(1, worksheet(new TaxPayer(FilingStatus.S, turning, null, List.of()), 1).allowances());
        assertEquals(0, worksheet(new TaxPayer(FilingStatus.S, notYet, null, List.of()), 1).allowances());
    }

    @Test
    public void testDependentFilerLimit() {
        Person dependent = new Person("Jo", "Doe", "333-44-5555", LocalDate.of(2006, 5, 5), false, true);
        TaxPayer taxPayer = new TaxPayer(FilingStatus.S, dependent, null, List.of());
        assertEquals(5000 + 450.0, worksheet(taxPayer, 5000).standardDeduction(), 0.0);
        assertEquals(1350.0, worksheet(taxPayer, 200).standardDeduction(), 0.0);
        assertEquals(15750.0, worksheet(taxPayer, 40000).standardDeduction(), 0.0);
    }
}
