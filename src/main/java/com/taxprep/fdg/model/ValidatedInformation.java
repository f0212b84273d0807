package com.taxprep.fdg.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One tax year's validated, defaulted taxpayer snapshot.
 *
 * <p>
 * Instances are immutable: every list is copied on construction and a missing
 * list becomes an empty one. Numbers absent from the source document
 * deserialize to {@code 0}. {@code itemizedDeductions} stays null when the
 * taxpayer entered none.
 */
public record ValidatedInformation(
        int taxYear,
        TaxPayer taxPayer,
        List<IncomeW2> w2s,
        List<Interest1099> f1099Ints,
        List<Dividend1099> f1099Divs,
        List<Brokerage1099B> f1099Bs,
        List<Retirement1099R> f1099Rs,
        List<Government1099G> f1099Gs,
        List<Business> businesses,
        List<RentalProperty> realEstate,
        List<HealthSavingsAccount> healthSavingsAccounts,
        List<IraContribution> iraContributions,
        ItemizedDeductions itemizedDeductions,
        List<EstimatedTaxPayment> estimatedTaxes,
        double studentLoanInterest) {

    public ValidatedInformation {
        if (taxPayer == null)
            taxPayer = new TaxPayer(FilingStatus.S, null, null, List.of());
        w2s = copy(w2s);
        f1099Ints = copy(f1099Ints);
        f1099Divs = copy(f1099Divs);
        f1099Bs = copy(f1099Bs);
        f1099Rs = copy(f1099Rs);
        f1099Gs = copy(f1099Gs);
        businesses = copy(businesses);
        realEstate = copy(realEstate);
        healthSavingsAccounts = copy(healthSavingsAccounts);
        iraContributions = copy(iraContributions);
        estimatedTaxes = copy(estimatedTaxes);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public FilingStatus filingStatus() {
        return taxPayer.filingStatus();
    }

    public static Builder builder(int taxYear) {
        return new Builder(taxYear);
    }

    /** Fluent construction for callers and tests that do not start from JSON. */
    public static final class Builder {
        private final int taxYear;
        private TaxPayer taxPayer;
        private final ArrayList<IncomeW2> w2s = new ArrayList<>();
        private final ArrayList<Interest1099> ints = new ArrayList<>();
        private final ArrayList<Dividend1099> divs = new ArrayList<>();
        private final ArrayList<Brokerage1099B> bs = new ArrayList<>();
        private final ArrayList<Retirement1099R> rs = new ArrayList<>();
        private final ArrayList<Government1099G> gs = new ArrayList<>();
        private final ArrayList<Business> businesses = new ArrayList<>();
        private final ArrayList<RentalProperty> realEstate = new ArrayList<>();
        private final ArrayList<HealthSavingsAccount> hsas = new ArrayList<>();
        private final ArrayList<IraContribution> iras = new ArrayList<>();
        private final ArrayList<EstimatedTaxPayment> estimated = new ArrayList<>();
        private ItemizedDeductions itemized;
        private double studentLoanInterest;

        private Builder(int taxYear) {
            this.taxYear = taxYear;
        }

        public Builder taxPayer(TaxPayer taxPayer) {
            this.taxPayer = taxPayer;
            return this;
        }

        public Builder w2(IncomeW2 w2) {
            w2s.add(w2);
            return this;
        }

        public Builder interest(Interest1099 f) {
            ints.add(f);
            return this;
        }

        public Builder dividends(Dividend1099 f) {
            divs.add(f);
            return this;
        }

        public Builder brokerage(Brokerage1099B f) {
            bs.add(f);
            return this;
        }

        public Builder retirement(Retirement1099R f) {
            rs.add(f);
            return this;
        }

        public Builder unemployment(Government1099G f) {
            gs.add(f);
            return this;
        }

        public Builder business(Business b) {
            businesses.add(b);
            return this;
        }

        public Builder rental(RentalProperty p) {
            realEstate.add(p);
            return this;
        }

        public Builder hsa(HealthSavingsAccount h) {
            hsas.add(h);
            return this;
        }

        public Builder ira(IraContribution i) {
            iras.add(i);
            return this;
        }

        public Builder estimatedPayment(EstimatedTaxPayment p) {
            estimated.add(p);
            return this;
        }

        public Builder itemizedDeductions(ItemizedDeductions d) {
            this.itemized = d;
            return this;
        }

        public Builder studentLoanInterest(double amount) {
            this.studentLoanInterest = amount;
            return this;
        }

        public ValidatedInformation build() {
            return new ValidatedInformation(taxYear, taxPayer, w2s, ints, divs, bs, rs, gs, businesses,
                    realEstate, hsas, iras, itemized, estimated, studentLoanInterest);
        }
    }
}
