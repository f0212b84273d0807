package com.taxprep.fdg.scenario;

import com.taxprep.fdg.data.Federal2025;
import com.taxprep.fdg.model.CoverageType;
import com.taxprep.fdg.model.Dependent;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.HealthSavingsAccount;
import com.taxprep.fdg.model.IncomeW2;
import com.taxprep.fdg.model.Person;
import com.taxprep.fdg.model.PersonRole;
import com.taxprep.fdg.model.ValidatedInformation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Common what-if questions expressed as modifications against a base input.
 */
public final class QuickScenarios {
    public static final double SPOUSE_WITHHOLDING_RATE = 0.15;
    public static final double SPOUSE_SS_RATE = 0.062;
    public static final double SPOUSE_MEDICARE_RATE = 0.0145;

    private QuickScenarios() {
        // Utility class
    }

    /**
     * Raises the primary taxpayer's 401(k) deferral to the annual limit on the
     * first W-2, lowering its taxable wages by the same amount.
     *
     * @throws IllegalArgumentException without a primary W-2, or when the
     *                                  deferral is already at the limit
     */
    public static QuickScenario maxOut401k(ValidatedInformation base) {
        List<IncomeW2> w2s = base.w2s();
        int first = -1;
        double deferred = 0;
        for (int i = 0; i < w2s.size(); i++) {
            if (w2s.get(i).personRole() != PersonRole.PRIMARY)
                continue;
            if (first < 0)
                first = i;
            deferred += w2s.get(i).box12D();
        }
        if (first < 0)
            throw new IllegalArgumentException("No W-2 for the primary taxpayer");
        double room = Federal2025.ELECTIVE_DEFERRAL_LIMIT - deferred;
        if (room <= 0)
            throw new IllegalArgumentException("401(k) deferral already at the limit");
        String w2 = "w2s[" + first + "]";
        return new QuickScenario("Max out 401(k)",
                "Contribute the " + (int) Federal2025.ELECTIVE_DEFERRAL_LIMIT + " elective deferral limit",
                List.of(Modification.adjust("401(k) deferral", w2 + ".box12D", room),
                        Modification.adjust("Wages after deferral", w2 + ".income", -room)));
    }

    /** Adds a five-year-old child with an SSN. */
    public static QuickScenario addChild(ValidatedInformation base) {
        Person primary = base.taxPayer().primaryPerson();
        String lastName = primary == null ? "Child" : primary.lastName();
        Dependent child = new Dependent("New", lastName, "000-00-0000",
                LocalDate.of(base.taxYear() - 5, 6, 1), "child");
        return new QuickScenario("Add child", "A new qualifying child under 17",
                List.of(Modification.append("New child", "taxPayer.dependents", child)));
    }

    /**
     * Raises the primary taxpayer's HSA contributions to the limit for the
     * coverage type, opening an account when there is none.
     */
    public static QuickScenario maxOutHsa(ValidatedInformation base, CoverageType coverage) {
        double limit = coverage == CoverageType.FAMILY ? Federal2025.HSA_LIMIT_FAMILY
                : Federal2025.HSA_LIMIT_SELF_ONLY;
        List<HealthSavingsAccount> hsas = base.healthSavingsAccounts();
        int first = -1;
        double contributed = 0;
        for (int i = 0; i < hsas.size(); i++) {
            if (hsas.get(i).personRole() != PersonRole.PRIMARY)
                continue;
            if (first < 0)
                first = i;
            contributed += hsas.get(i).contributions();
        }
        double room = limit - contributed;
        if (room <= 0)
            throw new IllegalArgumentException("HSA contributions already at the limit");
        List<Modification> mods = new ArrayList<>();
        if (first < 0) {
            mods.add(Modification.append("Open HSA", "healthSavingsAccounts",
                    new HealthSavingsAccount("HSA", PersonRole.PRIMARY, coverage, room, 0, 0)));
        } else {
            String hsa = "healthSavingsAccounts[" + first + "]";
            mods.add(Modification.set("Coverage", hsa + ".coverageType", coverage));
            mods.add(Modification.adjust("HSA contribution", hsa + ".contributions", room));
        }
        return new QuickScenario("Max out HSA", "Contribute the " + (int) limit + " HSA limit", mods);
    }

    /**
     * Spouse takes a job with the given wages; the return switches to married
     * filing jointly.
     */
    public static QuickScenario spouseStartsWorking(ValidatedInformation base, double wages) {
        List<Modification> mods = new ArrayList<>();
        if (!base.taxPayer().hasSpouse()) {
            Person primary = base.taxPayer().primaryPerson();
            mods.add(Modification.set("Spouse", "taxPayer.spouse",
                    new Person("Spouse", primary == null ? null : primary.lastName(), null, null, false, false)));
        }
        mods.add(Modification.set("Married filing jointly", "taxPayer.filingStatus", FilingStatus.MFJ));
        mods.add(Modification.append("Spouse W-2", "w2s",
                new IncomeW2("Spouse employer", null, PersonRole.SPOUSE, wages, wages,
                        round(wages * SPOUSE_WITHHOLDING_RATE), wages, round(wages * SPOUSE_SS_RATE),
                        round(wages * SPOUSE_MEDICARE_RATE), 0, 0)));
        return new QuickScenario("Spouse starts working", "Spouse earns " + (long) wages + " in wages", mods);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
