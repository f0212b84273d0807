package com.taxprep.fdg;

import com.taxprep.fdg.model.Business;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.RentalProperty;
import com.taxprep.fdg.model.TaxPayer;
import com.taxprep.fdg.model.ValidatedInformation;

import java.time.LocalDate;
import java.util.List;

/** Input snapshots shared by the tests. */
public final class SampleReturns {
    private SampleReturns() {
    }

    public static Person primary() {
        return new Person("Alex", "Doe", "123-45-6789", LocalDate.of(1990, 4, 12), false, false);
    }

    public static Person spouse() {
        return new Person("Sam", "Doe", "987-65-4321", LocalDate.of(1991, 9, 3), false, false);
    }

    public static TaxPayer single() {
        return new TaxPayer(FilingStatus.S, primary(), null, List.of());
    }

    public static IncomeW2 w2(PersonRole role, double wages, double withheld) {
        return new IncomeW2("Acme", "Engineer", role, wages, wages, withheld, wages,
                Math.round(wages * 6.2) / 100.0, Math.round(wages * 1.45) / 100.0, 0, 0);
    }

    /** Single filer with one W-2. */
    public static ValidatedInformation singleFiler(double wages, double withheld) {
        return ValidatedInformation.builder(2025)
                .taxPayer(single())
                .w2(w2(PersonRole.PRIMARY, wages, withheld))
                .build();
    }

    public static Business business(String name, PersonRole owner, double receipts, double expenses) {
        return new Business(name, "12-3456789", "541511", owner, receipts, 0, 0, expenses);
    }

    public static RentalProperty rental(String address, double rents) {
        return new RentalProperty(address, rents, rents / 4, rents / 10);
    }
}
