package org.pragmatica.plorth.tree;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A position in Plorth source text: optional file name plus line and column.
 * Values come from the scanner as-is; no arithmetic is done on them here.
 */
public record Position(Optional<String> file, int line, int column) {

    public static final Position START = new Position(Optional.empty(), 1, 1);

    public Position {
        requireNonNull(file, "file");
    }

    public static Position at(int line, int column) {
        return new Position(Optional.empty(), line, column);
    }

    public static Position at(String file, int line, int column) {
        return new Position(Optional.of(file), line, column);
    }

    @Override
    public String toString() {
        return file.map(name -> name + ":").orElse("") + line + ":" + column;
    }
}
