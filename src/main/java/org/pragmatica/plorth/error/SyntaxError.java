package org.pragmatica.plorth.error;

import org.pragmatica.plorth.tree.Position;
import org.pragmatica.plorth.tree.SyntaxNode.Kind;

/**
 * Structural error raised while assembling syntax nodes.
 */
public sealed interface SyntaxError {
    Position position();

    String message();

    /**
     * Word payload is not a symbol.
     */
    record NotASymbol(
    Position position,
    Kind found) implements SyntaxError {
        @Override
        public String message() {
            return "Word at " + position + " must name a symbol, found " + found.displayName();
        }
    }

    /**
     * Composite closed while none is open.
     */
    record UnbalancedEnd(Position position) implements SyntaxError {
        @Override
        public String message() {
            return "Unbalanced end at " + position + ": no open array, object or quote";
        }
    }

    /**
     * Closing token does not match the innermost open composite.
     *
     * @param position position of the closing token
     * @param expected kind of the innermost open composite
     * @param found    kind the closing token belongs to
     */
    record MismatchedEnd(
    Position position,
    Kind expected,
    Kind found) implements SyntaxError {
        @Override
        public String message() {
            return "Mismatched end of " + found.displayName() + " at " + position
                   + ", expected end of " + expected.displayName();
        }
    }

    /**
     * Program completed while a composite is still open.
     *
     * @param position where the open composite started
     * @param kind     kind of the open composite
     */
    record UnclosedComposite(
    Position position,
    Kind kind) implements SyntaxError {
        @Override
        public String message() {
            return "Unclosed " + kind.displayName() + " started at " + position;
        }
    }

    /**
     * Object value supplied without a key.
     */
    record MissingKey(
    Position position,
    Kind found) implements SyntaxError {
        @Override
        public String message() {
            return "Missing key for " + found.displayName() + " value at " + position;
        }
    }

    /**
     * Object key left without a value.
     *
     * @param position the next key or the closing token found instead of a value
     * @param key      key still waiting for its value
     */
    record DanglingKey(
    Position position,
    String key) implements SyntaxError {
        @Override
        public String message() {
            return "Key '" + key + "' has no value at " + position;
        }
    }

    /**
     * Key supplied while the innermost composite is not an object.
     */
    record KeyOutsideObject(
    Position position,
    String key) implements SyntaxError {
        @Override
        public String message() {
            return "Key '" + key + "' outside of object at " + position;
        }
    }

    /**
     * Composite nesting exceeds the configured limit.
     */
    record DepthExceeded(
    Position position,
    int limit) implements SyntaxError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " at " + position;
        }
    }
}
