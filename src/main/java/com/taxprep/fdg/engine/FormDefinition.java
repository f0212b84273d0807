package com.taxprep.fdg.engine;

import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;

import java.util.List;
import java.util.function.Function;

/**
 * One catalog entry: the node type, its role, the sibling types its factory
 * may {@link BuildContext#require require}, and the factory itself.
 *
 * @param <T> node type
 */
public record FormDefinition<T extends FormNode>(
        Class<T> type,
        FormTag tag,
        FormRole role,
        List<Class<? extends FormNode>> dependsOn,
        Function<BuildContext, T> factory) {

    public FormDefinition {
        if (type == null || tag == null || role == null || factory == null)
            throw new IllegalArgumentException("type, tag, role and factory are required");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (dependsOn.contains(type))
            throw new IllegalArgumentException("Self-dependency not allowed: " + type.getSimpleName());
    }

    public String name() {
        return type.getSimpleName();
    }
}
