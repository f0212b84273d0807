package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.MissingDependencyException;
import com.taxprep.fdg.node.FormContext;

import java.util.Map;

/**
 * Handed to each form factory during graph construction. Gives access to the
 * shared {@link FormContext} and to siblings that were declared as dependencies
 * and have already been built.
 */
public final class BuildContext {
    private final FormContext formContext;
    private final Map<Class<?>, FormNode> built;
    private FormDefinition<?> current;

    BuildContext(FormContext formContext, Map<Class<?>, FormNode> built) {
        this.formContext = formContext;
        this.built = built;
    }

    void enter(FormDefinition<?> definition) {
        this.current = definition;
    }

    public FormContext formContext() {
        return formContext;
    }

    /**
     * Returns the built sibling of the given type.
     *
     * @throws MissingDependencyException if the form being built did not declare
     *                                    the type, or it has not been built yet
     */
    public <T extends FormNode> T require(Class<T> type) {
        if (current == null || !current.dependsOn().contains(type))
            throw new MissingDependencyException((current == null ? "<none>" : current.name())
                    + " requires undeclared dependency " + type.getSimpleName());
        FormNode node = built.get(type);
        if (node == null)
            throw new MissingDependencyException(current.name() + " requires " + type.getSimpleName()
                    + ", which has not been built");
        return type.cast(node);
    }
}
