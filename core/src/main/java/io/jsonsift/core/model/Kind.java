package io.jsonsift.core.model;

/**
 * Kind of a query result. The declaration order is the ordering rank used by
 * {@link Value#less(Value, boolean)}: {@code NULL < FALSE < NUMBER < STRING < TRUE < JSON}.
 */
public enum Kind {
    NULL,
    FALSE,
    NUMBER,
    STRING,
    TRUE,
    /** An object or an array; the raw text tells which. */
    JSON
}
