package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.node.FormContext;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Every form of one return, built from one input snapshot.
 *
 * <p>
 * Nothing is evaluated at construction; lines compute on first read. A graph
 * is never reused across snapshots.
 */
public final class ReturnGraph {
    private final FormCatalog catalog;
    private final BuildOrder buildOrder;
    private final FormContext context;
    private final FormNode root;
    private final List<FormNode> attachments;
    private final List<FormNode> worksheets;
    private final Map<Class<?>, FormNode> nodes;

    ReturnGraph(FormCatalog catalog, BuildOrder buildOrder, FormContext context, FormNode root,
            List<FormNode> attachments, List<FormNode> worksheets, Map<Class<?>, FormNode> nodes) {
        this.catalog = catalog;
        this.buildOrder = buildOrder;
        this.context = context;
        this.root = root;
        this.attachments = List.copyOf(attachments);
        this.worksheets = List.copyOf(worksheets);
        this.nodes = Map.copyOf(nodes);
    }

    public FormNode root() {
        return root;
    }

    /** Attachments in catalog declaration order. */
    public List<FormNode> attachments() {
        return attachments;
    }

    public List<FormNode> worksheets() {
        return worksheets;
    }

    public BuildOrder buildOrder() {
        return buildOrder;
    }

    public FormCatalog catalog() {
        return catalog;
    }

    public FormContext context() {
        return context;
    }

    public Function<FormNode, FormNode> trailerFactory() {
        return catalog.trailerFactory();
    }

    /** Typed lookup of a built form. */
    public <T extends FormNode> T node(Class<T> type) {
        FormNode node = nodes.get(type);
        if (node == null)
            throw new IllegalArgumentException("Form not in graph: " + type.getSimpleName());
        return type.cast(node);
    }

    /** All built forms in build order. */
    public List<FormNode> nodes() {
        return buildOrder.definitions().stream().map(d -> nodes.get(d.type())).toList();
    }
}
