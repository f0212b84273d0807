package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.BalanceDueSource;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Declared set of forms for one tax year, in declaration order.
 *
 * <p>
 * Declaration order matters twice: it breaks ties in the build order and, for
 * attachments sharing a sequence index, it is the order in the filing set.
 */
public final class FormCatalog {
    private final List<FormDefinition<?>> definitions;
    private final FormDefinition<?> root;
    private final Function<FormNode, FormNode> trailerFactory;

    private FormCatalog(List<FormDefinition<?>> definitions, FormDefinition<?> root,
            Function<FormNode, FormNode> trailerFactory) {
        this.definitions = Collections.unmodifiableList(definitions);
        this.root = root;
        this.trailerFactory = trailerFactory;
    }

    public List<FormDefinition<?>> definitions() {
        return definitions;
    }

    public FormDefinition<?> root() {
        return root;
    }

    /** Builds the trailer for a root that owes a balance, or null if the catalog has none. */
    public Function<FormNode, FormNode> trailerFactory() {
        return trailerFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<FormDefinition<?>> definitions = new ArrayList<>();
        private FormDefinition<?> root;
        private Function<FormNode, FormNode> trailerFactory;

        @SafeVarargs
        public final <T extends FormNode & BalanceDueSource> Builder root(Class<T> type, FormTag tag,
                Function<BuildContext, T> factory, Class<? extends FormNode>... dependsOn) {
            if (root != null)
                throw new IllegalStateException("Root already declared: " + root.name());
            root = add(new FormDefinition<>(type, tag, FormRole.ROOT, List.of(dependsOn), factory));
            return this;
        }

        @SafeVarargs
        public final <T extends FormNode> Builder attachment(Class<T> type, FormTag tag,
                Function<BuildContext, T> factory, Class<? extends FormNode>... dependsOn) {
            add(new FormDefinition<>(type, tag, FormRole.ATTACHMENT, List.of(dependsOn), factory));
            return this;
        }

        @SafeVarargs
        public final <T extends FormNode> Builder worksheet(Class<T> type, FormTag tag,
                Function<BuildContext, T> factory, Class<? extends FormNode>... dependsOn) {
            add(new FormDefinition<>(type, tag, FormRole.WORKSHEET, List.of(dependsOn), factory));
            return this;
        }

        public Builder trailer(Function<FormNode, FormNode> factory) {
            this.trailerFactory = factory;
            return this;
        }

        private FormDefinition<?> add(FormDefinition<?> def) {
            for (FormDefinition<?> d : definitions)
                if (d.type() == def.type())
                    throw new IllegalArgumentException("Duplicate form type: " + def.name());
            definitions.add(def);
            return def;
        }

        public FormCatalog build() {
            if (root == null)
                throw new IllegalStateException("Catalog has no root form");
            return new FormCatalog(new ArrayList<>(definitions), root, trailerFactory);
        }
    }
}
