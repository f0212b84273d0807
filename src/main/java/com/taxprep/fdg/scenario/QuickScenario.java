package com.taxprep.fdg.scenario;

import java.util.List;

/** A ready-made scenario: its name, description and modifications. */
public record QuickScenario(String name, String description, List<Modification> modifications) {

    public QuickScenario {
        modifications = List.copyOf(modifications);
    }
}
