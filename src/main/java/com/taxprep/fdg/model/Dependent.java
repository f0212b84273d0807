package com.taxprep.fdg.model;

import java.time.LocalDate;

public record Dependent(String firstName, String lastName, String ssid, LocalDate dateOfBirth,
        String relationship) {

    /** Age on the last day of the given tax year, or -1 when the birth date is unknown. */
    public int ageAtEndOf(int taxYear) {
        if (dateOfBirth == null)
            return -1;
        return taxYear - dateOfBirth.getYear();
    }

    public boolean hasSsn() {
        return ssid != null && !ssid.isBlank();
    }
}
