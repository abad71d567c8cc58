package org.pragmatica.plorth.error;

import static java.util.Objects.requireNonNull;

/**
 * Unchecked carrier for a {@link SyntaxError}.
 */
public final class SyntaxTreeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final SyntaxError error;

    public SyntaxTreeException(SyntaxError error) {
        super(requireNonNull(error, "error").message());
        this.error = error;
    }

    public SyntaxError error() {
        return error;
    }
}
