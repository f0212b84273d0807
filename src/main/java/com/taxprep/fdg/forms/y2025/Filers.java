package com.taxprep.fdg.forms.y2025;

import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.ValidatedInformation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Who is filing: names, SSNs and ages of the primary taxpayer and spouse. */
final class Filers {
    private Filers() {
        // Utility class
    }

    static Person person(ValidatedInformation info, PersonRole role) {
        return role == PersonRole.SPOUSE ? info.taxPayer().spouse() : info.taxPayer().primaryPerson();
    }

    static String name(Person p) {
        if (p == null)
            return "";
        return ((p.firstName() == null ? "" : p.firstName()) + " "
                + (p.lastName() == null ? "" : p.lastName())).trim();
    }

    static String ssn(Person p) {
        return p == null || p.ssid() == null ? "" : p.ssid();
    }

    static String primaryName(ValidatedInformation info) {
        return name(info.taxPayer().primaryPerson());
    }

    static String primarySsn(ValidatedInformation info) {
        return ssn(info.taxPayer().primaryPerson());
    }

    /** Age on December 31 of the tax year, or -1 when unknown. */
    static int age(Person p, int taxYear) {
        if (p == null || p.dateOfBirth() == null)
            return -1;
        return taxYear - p.dateOfBirth().getYear();
    }

    /** Born before January 2 of the year the person turns 65 counts as 65. */
    static boolean isSenior(Person p, int taxYear) {
        return p != null && p.dateOfBirth() != null
                && p.dateOfBirth().isBefore(LocalDate.of(taxYear - 64, 1, 2));
    }

    /** Roles present on the return, primary first. */
    static List<PersonRole> roles(ValidatedInformation info) {
        List<PersonRole> roles = new ArrayList<>(2);
        roles.add(PersonRole.PRIMARY);
        if (info.taxPayer().hasSpouse())
            roles.add(PersonRole.SPOUSE);
        return roles;
    }

    /** A missing role on an input document belongs to the primary taxpayer. */
    static boolean belongsTo(PersonRole actual, PersonRole role) {
        return (actual == null ? PersonRole.PRIMARY : actual) == role;
    }
}
