package com.taxprep.fdg.web;

import com.taxprep.fdg.scenario.Scenario;
import com.taxprep.fdg.scenario.ScenarioState;

/** One row of the scenario listing. */
public record ScenarioSummary(String id, String name, String description, ScenarioState state,
        int modifications, boolean selected) {

    static ScenarioSummary of(Scenario s, ScenarioState state, boolean selected) {
        return new ScenarioSummary(s.id(), s.name(), s.description(), state, s.modifications().size(), selected);
    }
}
