package com.taxprep.fdg.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taxprep.fdg.io.Json;
import com.taxprep.fdg.model.ValidatedInformation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a scenario's input by applying its modifications, in order, to a
 * JSON tree of the base snapshot. The base is never mutated.
 *
 * <p>
 * Every failure to resolve a path or to bind the edited tree back to
 * {@link ValidatedInformation} is reported as an
 * {@link IllegalArgumentException}.
 */
public final class ModificationApplier {
    private static final Pattern SEGMENT = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)((?:\\[\\d+])*)");
    private static final Pattern INDEX = Pattern.compile("\\[(\\d+)]");

    private ModificationApplier() {
        // Utility class
    }

    public static ValidatedInformation apply(ValidatedInformation base, List<Modification> modifications) {
        ObjectNode tree = Json.mapper().valueToTree(base);
        for (Modification m : modifications)
            applyTo(tree, m);
        try {
            return Json.mapper().treeToValue(tree, ValidatedInformation.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Modified input is not valid: " + e.getMessage(), e);
        }
    }

    /** Applies one modification to a tree in place. */
    static void applyTo(ObjectNode root, Modification m) {
        List<Step> steps = parse(m.fieldPath());
        JsonNode parent = root;
        for (int i = 0; i < steps.size() - 1; i++) {
            parent = steps.get(i).resolve(parent, m.fieldPath());
        }
        Step last = steps.get(steps.size() - 1);
        JsonNode current = last.peek(parent, m.fieldPath());
        JsonNode value = m.value();

        switch (m.type()) {
            case SET -> last.put(parent, value, m.fieldPath());
            case ADJUST -> {
                if (value == null || !value.isNumber())
                    throw new IllegalArgumentException("ADJUST needs a numeric value: " + m.fieldPath());
                if (current != null && !current.isNull() && !current.isNumber())
                    throw new IllegalArgumentException("ADJUST target is not numeric: " + m.fieldPath());
                double base = current == null || current.isNull() ? 0 : current.asDouble();
                last.put(parent, DoubleNode.valueOf(base + value.asDouble()), m.fieldPath());
            }
            case APPEND -> {
                if (current == null || !current.isArray())
                    throw new IllegalArgumentException("APPEND target is not a list: " + m.fieldPath());
                ((ArrayNode) current).add(value);
            }
        }
    }

    static List<Step> parse(String path) {
        List<Step> steps = new ArrayList<>();
        for (String segment : path.split("\\.", -1)) {
            Matcher sm = SEGMENT.matcher(segment);
            if (!sm.matches())
                throw new IllegalArgumentException("Malformed modification path: " + path);
            steps.add(Step.ofField(sm.group(1)));
            Matcher im = INDEX.matcher(sm.group(2));
            while (im.find())
                steps.add(Step.ofIndex(Integer.parseInt(im.group(1))));
        }
        return steps;
    }

    /** One property name or list index of a path. */
    record Step(String field, int index) {

        static Step ofField(String name) {
            return new Step(name, -1);
        }

        static Step ofIndex(int i) {
            return new Step(null, i);
        }

        boolean isIndex() {
            return field == null;
        }

        JsonNode peek(JsonNode parent, String path) {
            if (isIndex()) {
                if (!parent.isArray())
                    throw new IllegalArgumentException("Not a list at [" + index + "] in " + path);
                if (index >= parent.size())
                    throw new IllegalArgumentException("Index " + index + " out of range in " + path);
                return parent.get(index);
            }
            if (!parent.isObject())
                throw new IllegalArgumentException("Not an object at '" + field + "' in " + path);
            if (!parent.has(field))
                throw new IllegalArgumentException("Unknown property '" + field + "' in " + path);
            return parent.get(field);
        }

        JsonNode resolve(JsonNode parent, String path) {
            JsonNode next = peek(parent, path);
            if (next == null || next.isNull())
                throw new IllegalArgumentException("Nothing at '" + this + "' in " + path);
            return next;
        }

        void put(JsonNode parent, JsonNode value, String path) {
            peek(parent, path);
            if (isIndex())
                ((ArrayNode) parent).set(index, value);
            else
                ((ObjectNode) parent).set(field, value);
        }

        @Override
        public String toString() {
            return isIndex() ? "[" + index + "]" : field;
        }
    }
}
