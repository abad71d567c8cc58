package org.pragmatica.plorth.build;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Syntax tree builder configuration options.
 *
 * @param maxDepth maximum number of simultaneously open arrays, objects and quotes
 */
public record BuilderConfig(int maxDepth) {
    public static final BuilderConfig DEFAULT = new BuilderConfig(256);

    public BuilderConfig {
        checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
    }

    public BuilderConfig withMaxDepth(int maxDepth) {
        return new BuilderConfig(maxDepth);
    }
}
