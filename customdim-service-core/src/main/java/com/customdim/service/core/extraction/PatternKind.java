package com.customdim.service.core.extraction;

/** How an extraction source interprets the rule pattern. */
public enum PatternKind {
    /** Regular expression with exactly one capturing group; the group is the extracted value. */
    CAPTURE_GROUP,
    /** Name of a URL query parameter; its value is the extracted value. */
    PARAMETER_NAME
}
