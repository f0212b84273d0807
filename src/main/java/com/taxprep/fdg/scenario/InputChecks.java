package com.taxprep.fdg.scenario;

import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.TaxPayer;
import com.taxprep.fdg.model.ValidatedInformation;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistency checks on a derived input. A return with problems is still
 * calculated; the messages travel with its result.
 */
final class InputChecks {
    private InputChecks() {
        // Utility class
    }

    static List<String> errors(ValidatedInformation info, int expectedYear) {
        List<String> errors = new ArrayList<>();
        TaxPayer tp = info.taxPayer();
        if (info.taxYear() != expectedYear)
            errors.add("Tax year " + info.taxYear() + " does not match the " + expectedYear + " forms");
        if (tp.primaryPerson() == null)
            errors.add("Primary taxpayer is missing");
        if (tp.filingStatus() == FilingStatus.MFJ && !tp.hasSpouse())
            errors.add("Married filing jointly requires a spouse");
        if (tp.filingStatus() == FilingStatus.S && tp.hasSpouse())
            errors.add("Single filing status with a spouse on the return");
        if ((tp.filingStatus() == FilingStatus.HOH || tp.filingStatus() == FilingStatus.W)
                && tp.dependents().isEmpty())
            errors.add("Filing status " + tp.filingStatus() + " requires a dependent");
        if (!tp.hasSpouse()) {
            info.w2s().stream()
                    .filter(w -> w.personRole() == PersonRole.SPOUSE)
                    .forEach(w -> errors.add("W-2 from " + w.employer() + " belongs to a spouse not on the return"));
            info.businesses().stream()
                    .filter(b -> b.personRole() == PersonRole.SPOUSE)
                    .forEach(b -> errors.add("Business " + b.name() + " belongs to a spouse not on the return"));
            info.healthSavingsAccounts().stream()
                    .filter(h -> h.personRole() == PersonRole.SPOUSE)
                    .forEach(h -> errors.add("HSA " + h.label() + " belongs to a spouse not on the return"));
        }
        return errors;
    }
}
