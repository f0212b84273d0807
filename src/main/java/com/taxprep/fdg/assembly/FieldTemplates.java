package com.taxprep.fdg.assembly;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taxprep.fdg.api.FormNode;
import com.taxprep.fdg.api.FormTag;
import com.taxprep.fdg.io.Json;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Number of fillable fields per form, keyed by tag id. A form's
 * {@code fields()} must match its template exactly.
 */
public final class FieldTemplates {
    private static final Logger log = LogManager.getLogger(FieldTemplates.class);

    public static final String DEFAULT_RESOURCE = "field-templates.json";

    private final Map<FormTag, Integer> fieldCounts;

    public FieldTemplates(Map<FormTag, Integer> fieldCounts) {
        this.fieldCounts = new EnumMap<>(FormTag.class);
        this.fieldCounts.putAll(fieldCounts);
    }

    /** Loads the templates bundled on the classpath. */
    public static FieldTemplates load() {
        return load(DEFAULT_RESOURCE);
    }

    public static FieldTemplates load(String resource) {
        try (InputStream in = FieldTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new FieldLayoutException("Field template resource not found: " + resource);
            Map<String, Integer> raw = Json.mapper().readValue(in, new TypeReference<Map<String, Integer>>() {
            });
            Map<FormTag, Integer> counts = new EnumMap<>(FormTag.class);
            raw.forEach((id, count) -> counts.put(FormTag.fromId(id), count));
            log.debug("Loaded {} field templates from {}", counts.size(), resource);
            return new FieldTemplates(counts);
        } catch (IOException e) {
            throw new FieldLayoutException("Unreadable field templates: " + resource, e);
        }
    }

    public int fieldCount(FormTag tag) {
        Integer count = fieldCounts.get(tag);
        if (count == null)
            throw new FieldLayoutException("No field template for " + tag.id());
        return count;
    }

    /**
     * @throws FieldLayoutException if the form's field count differs from its
     *                              template
     */
    public void verify(FormNode form) {
        int expected = fieldCount(form.tag());
        int actual = form.fields().size();
        if (actual != expected) {
            String msg = form.tag().id() + (form.copyIndex() > 0 ? "#" + form.copyIndex() : "")
                    + " produced " + actual + " fields, template has " + expected;
            log.error(msg);
            throw new FieldLayoutException(msg);
        }
    }

    public void verify(FilingSet set) {
        for (FormNode form : set.forms())
            verify(form);
    }
}
