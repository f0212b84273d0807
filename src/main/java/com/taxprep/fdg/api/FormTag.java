package com.taxprep.fdg.api;

/**
 * Stable form identifiers. The {@link #id()} is the key used by field templates
 * and by the JSON result payloads.
 */
public enum FormTag {
    F1040("f1040"),
    F1040V("f1040v"),
    SCHEDULE_1("f1040s1"),
    SCHEDULE_2("f1040s2"),
    SCHEDULE_3("f1040s3"),
    SCHEDULE_A("f1040sa"),
    SCHEDULE_B("f1040sb"),
    SCHEDULE_C("f1040sc"),
    SCHEDULE_D("f1040sd"),
    SCHEDULE_E("f1040se"),
    SCHEDULE_SE("f1040sse"),
    SCHEDULE_8812("f1040s8"),
    F8889("f8889"),
    WORKSHEET_STANDARD_DEDUCTION("ws-standard-deduction"),
    WORKSHEET_INCOME("ws-income"),
    WORKSHEET_TAX_COMPUTATION("ws-tax-computation");

    private final String id;

    FormTag(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static FormTag fromId(String id) {
        for (FormTag tag : values())
            if (tag.id.equals(id))
                return tag;
        throw new IllegalArgumentException("Unknown form tag: " + id);
    }
}
