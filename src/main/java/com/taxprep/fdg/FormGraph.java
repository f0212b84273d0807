package com.taxprep.fdg;

import com.taxprep.fdg.config.EngineConfig;
import com.taxprep.fdg.engine.FormCatalog;
import com.taxprep.fdg.engine.ReturnGraphBuilder;
import com.taxprep.fdg.forms.y2025.Forms2025;

/**
 * Entry point to the form dependency graph.
 *
 * <p>
 * A return is a graph of forms, schedules and worksheets built from one
 * validated input snapshot:
 * <ul>
 * <li><b>Forms</b> expose named lines, evaluated lazily and at most once.</li>
 * <li><b>Dependencies</b> are declared per form in a catalog and wired as
 * direct references in build order.</li>
 * <li><b>Assembly</b> picks the needed attachments and orders them for
 * filing.</li>
 * </ul>
 * What-if scenarios run on top through
 * {@link com.taxprep.fdg.scenario.ScenarioEngine}.
 */
public final class FormGraph {

    private FormGraph() {
        // Prevent instantiation of utility class
    }

    /**
     * Form catalog for a tax year.
     *
     * @throws IllegalArgumentException if the year is not supported
     */
    public static FormCatalog catalog(int taxYear) {
        if (taxYear == Forms2025.TAX_YEAR)
            return Forms2025.catalog();
        throw new IllegalArgumentException("Unsupported tax year: " + taxYear);
    }

    /** Graph builder for a tax year with the default evaluation depth limit. */
    public static ReturnGraphBuilder builder(int taxYear) {
        return new ReturnGraphBuilder(catalog(taxYear));
    }

    /** Graph builder configured from engine settings. */
    public static ReturnGraphBuilder builder(EngineConfig config) {
        return new ReturnGraphBuilder(catalog(config.getTaxYear()), config.getMaxEvaluationDepth());
    }
}
