package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.EvaluationListener;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.GraphDefectException;
import com.taxprep.fdg.api.MissingDependencyException;
import com.taxprep.fdg.model.ValidatedInformation;
import com.taxprep.fdg.node.FormContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Builds {@link ReturnGraph}s for a catalog. The build order is computed once
 * per builder, so a catalog defect surfaces when the builder is created.
 */
@Log4j2
public final class ReturnGraphBuilder {
    private final FormCatalog catalog;
    private final BuildOrder buildOrder;
    private final int maxDepth;

    public ReturnGraphBuilder(FormCatalog catalog) {
        this(catalog, FormContext.DEFAULT_MAX_DEPTH);
    }

    public ReturnGraphBuilder(FormCatalog catalog, int maxDepth) {
        this.catalog = catalog;
        this.maxDepth = maxDepth;
        try {
            this.buildOrder = BuildOrder.of(catalog);
        } catch (GraphDefectException e) {
            log.error("Invalid form catalog: {}", e.getMessage());
            throw e;
        }
        log.info("Form catalog ready: {} forms, build order {}", buildOrder.size(), buildOrder.names());
    }

    public BuildOrder buildOrder() {
        return buildOrder;
    }

    public FormCatalog catalog() {
        return catalog;
    }

    public ReturnGraph build(ValidatedInformation info) {
        return build(info, EvaluationListener.NONE);
    }

    public ReturnGraph build(ValidatedInformation info, EvaluationListener listener) {
        FormContext context = new FormContext(info, listener, maxDepth);
        Map<Class<?>, FormNode> built = new HashMap<>();
        BuildContext bc = new BuildContext(context, built);

        for (FormDefinition<?> def : buildOrder.definitions()) {
            bc.enter(def);
            FormNode node = def.factory().apply(bc);
            if (node == null || !def.type().isInstance(node))
                throw new MissingDependencyException("Factory for " + def.name() + " returned " + node);
            built.put(def.type(), node);
        }

        FormNode root = null;
        List<FormNode> attachments = new ArrayList<>();
        List<FormNode> worksheets = new ArrayList<>();
        for (FormDefinition<?> def : catalog.definitions()) {
            FormNode node = built.get(def.type());
            switch (def.role()) {
                case ROOT -> root = node;
                case ATTACHMENT -> attachments.add(node);
                case WORKSHEET -> worksheets.add(node);
            }
        }
        log.debug("Built return graph for tax year {} ({} forms)", info.taxYear(), built.size());
        return new ReturnGraph(catalog, buildOrder, context, root, attachments, worksheets, built);
    }
}
