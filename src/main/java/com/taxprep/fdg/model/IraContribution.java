package com.taxprep.fdg.model;

/** Traditional IRA contribution for the year. */
public record IraContribution(String trustee, PersonRole personRole, double contributions) {

    public IraContribution {
        if (personRole == null)
            personRole = PersonRole.PRIMARY;
    }
}
