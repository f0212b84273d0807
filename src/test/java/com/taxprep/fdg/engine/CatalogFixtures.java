package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.BalanceDueSource;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.node.AbstractFormNode;
import com.taxprep.fdg.node.FormContext;
import com.taxprep.fdg.node.Line;

import java.util.List;

/** Minimal forms for exercising catalogs and build order. */
final class CatalogFixtures {
    private CatalogFixtures() {
    }

    static class Root extends AbstractFormNode implements BalanceDueSource {
        Income income;

        Root(FormContext context, Income income) {
            super(context, FormTag.F1040, 0);
            this.income = income;
        }

        private final Line<Double> owed = line("owed", () -> this.income.total() - 1000);

        @Override
        public double balanceDue() {
            return owed.get();
        }

        @Override
        public List<Object> fields() {
            return List.of(owed.get());
        }
    }

    static class Income extends AbstractFormNode {
        Detail detail;

        Income(FormContext context, Detail detail) {
            super(context, FormTag.WORKSHEET_INCOME, 0);
            this.detail = detail;
        }

        private final Line<Double> total = line("total", () -> this.detail.amount() * 2);

        double total() {
            return total.get();
        }

        @Override
        public List<Object> fields() {
            return List.of(total.get());
        }
    }

    static class Detail extends AbstractFormNode {
        Detail(FormContext context) {
            super(context, FormTag.SCHEDULE_B, 8);
        }

        private final Line<Double> amount = line("amount", () -> info.w2s().get(0).income());

        double amount() {
            return amount.get();
        }

        @Override
        public List<Object> fields() {
            return List.of(amount.get());
        }
    }

    static class Other extends AbstractFormNode {
        Other(FormContext context) {
            super(context, FormTag.SCHEDULE_1, 1);
        }

        @Override
        public List<Object> fields() {
            return List.of();
        }
    }

    /** Root <- Income <- Detail, plus an independent Other. */
    static FormCatalog small() {
        return FormCatalog.builder()
                .root(Root.class, FormTag.F1040, bc -> new Root(bc.formContext(), bc.require(Income.class)),
                        Income.class)
                .attachment(Other.class, FormTag.SCHEDULE_1, bc -> new Other(bc.formContext()))
                .attachment(Detail.class, FormTag.SCHEDULE_B, bc -> new Detail(bc.formContext()))
                .worksheet(Income.class, FormTag.WORKSHEET_INCOME,
                        bc -> new Income(bc.formContext(), bc.require(Detail.class)), Detail.class)
                .build();
    }
}
