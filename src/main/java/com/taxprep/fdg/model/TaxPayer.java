package com.taxprep.fdg.model;

import java.util.List;

/**
 * Filing identity. {@code spouse} is null when there is no spouse on the return.
 */
public record TaxPayer(FilingStatus filingStatus, Person primaryPerson, Person spouse,
        List<Dependent> dependents) {

    public TaxPayer {
        if (filingStatus == null)
            filingStatus = FilingStatus.S;
        dependents = dependents == null ? List.of() : List.copyOf(dependents);
    }

    public boolean hasSpouse() {
        return spouse != null;
    }
}
