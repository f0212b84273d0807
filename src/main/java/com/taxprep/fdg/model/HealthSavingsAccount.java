package com.taxprep.fdg.model;

public record HealthSavingsAccount(String label, PersonRole personRole, CoverageType coverageType,
        double contributions, double totalDistributions, double qualifiedDistributions) {

    public HealthSavingsAccount {
        if (personRole == null)
            personRole = PersonRole.PRIMARY;
        if (coverageType == null)
            coverageType = CoverageType.SELF_ONLY;
    }
}
