package io.jsonsift.cli.io;

import io.jsonsift.core.error.JsonSiftException;

/** Thrown when the document to query cannot be read; {@link #source()} names the input. */
public final class DocumentReadException extends JsonSiftException {

    private static final long serialVersionUID = 1L;

    public DocumentReadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }

    public DocumentReadException(String message, String source) {
        super(message, source);
    }
}
