package com.taxprep.fdg.scenario;

import com.taxprep.fdg.api.EvaluationListener;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.assembly.FieldTemplates;
import com.taxprep.fdg.assembly.FilingSet;
import com.taxprep.fdg.assembly.FilingSetAssembler;
import com.taxprep.fdg.engine.ReturnGraph;
import com.taxprep.fdg.engine.ReturnGraphBuilder;
import com.taxprep.fdg.forms.y2025.F1040;
import com.taxprep.fdg.forms.y2025.Forms2025;
import com.taxprep.fdg.forms.y2025.StandardDeductionWorksheet;
import com.taxprep.fdg.forms.y2025.TaxComputationWorksheet;
import com.taxprep.fdg.model.ValidatedInformation;
import com.taxprep.fdg.node.Lines;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * Runs one whole-return calculation: builds a fresh graph for the input,
 * assembles the filing set, evaluates every filed field and summarizes the
 * root form.
 */
@Log4j2
public final class ScenarioCalculator {
    private final ReturnGraphBuilder builder;
    private final FieldTemplates templates;
    private final Supplier<EvaluationListener> listeners;

    /**
     * @param templates field templates to verify against, or null to skip
     *                  verification
     */
    public ScenarioCalculator(ReturnGraphBuilder builder, FieldTemplates templates) {
        this(builder, templates, () -> EvaluationListener.NONE);
    }

    /**
     * @param listeners supplies the listener for each calculation; graphs are
     *                  evaluated on whichever thread calculates them
     */
    public ScenarioCalculator(ReturnGraphBuilder builder, FieldTemplates templates,
            Supplier<EvaluationListener> listeners) {
        this.builder = builder;
        this.templates = templates;
        this.listeners = listeners;
    }

    public TaxCalculationResult calculate(String scenarioId, String scenarioName, boolean baseline,
            ValidatedInformation info) {
        long start = System.nanoTime();
        List<String> errors = InputChecks.errors(info, Forms2025.TAX_YEAR);
        if (!errors.isEmpty())
            log.warn("Scenario {} has {} input problems: {}", scenarioId, errors.size(), errors);
        ReturnGraph graph = builder.build(info, listeners.get());
        FilingSet filingSet = FilingSetAssembler.assemble(graph);
        if (templates != null)
            templates.verify(filingSet);
        else
            for (FormNode form : filingSet.forms())
                form.fields();

        F1040 f1040 = graph.node(F1040.class);
        TaxComputationWorksheet tax = graph.node(TaxComputationWorksheet.class);
        double agi = f1040.agi();
        double totalTax = f1040.totalTax();
        double wages = f1040.wages();
        double effectiveRate = agi > 0 ? Math.round(totalTax / agi * 10000) / 100.0 : 0;

        TaxCalculationResult result = new TaxCalculationResult(
                scenarioId,
                scenarioName,
                baseline,
                info.taxYear(),
                info.filingStatus(),
                f1040.totalIncome(),
                wages,
                Lines.cents(f1040.totalIncome() - wages),
                agi,
                graph.node(StandardDeductionWorksheet.class).standardDeduction(),
                tax.itemized() ? f1040.deduction() : null,
                f1040.deduction(),
                tax.itemized(),
                f1040.taxableIncome(),
                f1040.taxBeforeCredits(),
                f1040.nonrefundableCredits(),
                totalTax,
                f1040.withholding(),
                f1040.estimatedPayments(),
                f1040.totalPayments(),
                Lines.orZero(f1040.refund()),
                Lines.orZero(f1040.amountOwed()),
                effectiveRate,
                f1040.marginalRate(),
                filingSet.formIds(),
                errors,
                errors.isEmpty(),
                Instant.now(),
                filingSet);
        log.debug("Calculated {} in {} us: tax {}, forms {}", scenarioId, (System.nanoTime() - start) / 1000,
                totalTax, result.filedForms());
        return result;
    }
}
