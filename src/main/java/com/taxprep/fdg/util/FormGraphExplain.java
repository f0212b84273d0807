package com.taxprep.fdg.util;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.engine.BuildOrder;
import com.taxprep.fdg.engine.FormDefinition;
import com.taxprep.fdg.engine.FormRole;

/**
 * Diagnostic utility for inspecting a form catalog and the lines of built
 * forms.
 *
 * <p>
 * Intended for debugging sessions and error logs. Allocates strings and, for
 * {@link #explainForm}, evaluates every line of the form.
 */
public final class FormGraphExplain {
    private final BuildOrder order;

    public FormGraphExplain(BuildOrder order) {
        this.order = order;
    }

    /**
     * Dumps the build order with each form's dependencies.
     */
    public String dumpBuildOrder() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Catalog (").append(order.size()).append(" forms):\n");
        for (int i = 0; i < order.size(); i++) {
            FormDefinition<?> def = order.definition(i);
            sb.append("  [").append(i).append("] ").append(def.tag().id());
            if (def.role() != FormRole.ATTACHMENT)
                sb.append(" (").append(def.role()).append(')');
            if (order.parentCount(i) > 0) {
                sb.append(" <- ");
                for (int j = 0; j < def.dependsOn().size(); j++) {
                    sb.append(def.dependsOn().get(j).getSimpleName());
                    if (j < def.dependsOn().size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps every exposed line of a form with its value. Lines that fail are
     * shown with the error message.
     */
    public static String explainForm(FormNode form) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Form: ").append(form).append('\n')
                .append("  Type: ").append(form.getClass().getSimpleName()).append('\n')
                .append("  Sequence: ").append(form.sequenceIndex()).append('\n')
                .append("  Needed: ").append(form.isNeeded()).append('\n');
        for (String line : form.lineNames()) {
            sb.append("  ").append(line).append(" = ");
            try {
                sb.append(form.lineValue(line));
            } catch (RuntimeException e) {
                sb.append("<").append(e.getClass().getSimpleName()).append(": ").append(e.getMessage()).append('>');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid diagram of the catalog, with edges from each
     * dependency to the form that reads it.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");

        // 1. Nodes in build order
        for (FormDefinition<?> def : order.definitions()) {
            String safe = sanitize(def.tag().id());
            sb.append("  ").append(safe);
            switch (def.role()) {
                case ROOT -> sb.append("[[\"").append(def.tag().id()).append("\"]]");
                case WORKSHEET -> sb.append("(\"").append(def.tag().id()).append("\")");
                default -> sb.append("[\"").append(def.tag().id()).append("\"]");
            }
            sb.append(";\n");
        }

        // 2. Edges afterwards
        for (FormDefinition<?> def : order.definitions()) {
            for (Class<? extends FormNode> dep : def.dependsOn()) {
                FormDefinition<?> from = find(dep);
                sb.append("  ").append(sanitize(from.tag().id())).append(" --> ")
                        .append(sanitize(def.tag().id())).append(";\n");
            }
        }
        return sb.toString();
    }

    private FormDefinition<?> find(Class<?> type) {
        for (FormDefinition<?> def : order.definitions())
            if (def.type() == type)
                return def;
        throw new IllegalArgumentException("Not in build order: " + type.getSimpleName());
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
