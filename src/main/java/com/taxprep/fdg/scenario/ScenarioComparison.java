package com.taxprep.fdg.scenario;

import java.util.List;

/** Baseline result and each compared scenario's differences from it. */
public record ScenarioComparison(TaxCalculationResult baseline, List<ScenarioDifference> scenarios) {

    public ScenarioComparison {
        scenarios = List.copyOf(scenarios);
    }
}
