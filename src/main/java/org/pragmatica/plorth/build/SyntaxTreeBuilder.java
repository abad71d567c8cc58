package org.pragmatica.plorth.build;

import com.google.common.collect.ImmutableList;
import org.pragmatica.plorth.error.SyntaxError;
import org.pragmatica.plorth.error.SyntaxTreeException;
import org.pragmatica.plorth.tree.Position;
import org.pragmatica.plorth.tree.SyntaxNode;
import org.pragmatica.plorth.tree.SyntaxNode.Kind;
import org.pragmatica.plorth.tree.SyntaxNode.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Mutable assembler that turns the parser's event stream into immutable syntax nodes.
 *
 * <p>Leaves are appended to the innermost open composite (or to the program when
 * nothing is open); {@link #endArray(Position)}, {@link #endObject(Position)} and
 * {@link #endQuote(Position)} freeze the innermost composite and append it to its parent. Nodes are therefore created bottom-up in source order.
 *
 * <p>Example:
 * <pre>{@code
 * var program = SyntaxTreeBuilder.create()
 *     .beginArray(p1)
 *         .string(p2, "a")
 *         .string(p3, "b")
 *     .endArray(p4)
 *     .build();
 * }</pre>
 *
 * <p>Every failed call throws {@link SyntaxTreeException} and leaves the builder unchanged.
 * Instances are not thread-safe.
 */
public final class SyntaxTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeBuilder.class);

    private final BuilderConfig config;
    private final Deque<Frame> open;
    private final List<SyntaxNode> program;

    private SyntaxTreeBuilder(BuilderConfig config) {
        this.config = config;
        this.open = new ArrayDeque<>();
        this.program = new ArrayList<>();
    }

    public static SyntaxTreeBuilder create() {
        return create(BuilderConfig.DEFAULT);
    }

    public static SyntaxTreeBuilder create(BuilderConfig config) {
        return new SyntaxTreeBuilder(requireNonNull(config, "config"));
    }

    // === Leaves ===

    public SyntaxTreeBuilder string(Position position, String value) {
        return node(SyntaxNode.string(position, value));
    }

    public SyntaxTreeBuilder symbol(Position position, String id) {
        return node(SyntaxNode.symbol(position, id));
    }

    public SyntaxTreeBuilder word(Position position, String id) {
        return node(SyntaxNode.word(position, id));
    }

    /**
     * Word whose name token sits apart from the {@code :} that introduces it.
     *
     * @param position       position of the {@code :}
     * @param symbolPosition position of the name token
     */
    public SyntaxTreeBuilder word(Position position, Position symbolPosition, String id) {
        return node(SyntaxNode.word(position, SyntaxNode.symbol(symbolPosition, id)));
    }

    /**
     * Append an already constructed node.
     */
    public SyntaxTreeBuilder node(SyntaxNode node) {
        requireNonNull(node, "node");
        var frame = open.peek();
        if (frame == null) {
            program.add(node);
            return this;
        }
        ensureKeyFor(frame, node.position(), node.kind());
        frame.add(node);
        return this;
    }

    // === Composites ===

    public SyntaxTreeBuilder beginArray(Position position) {
        return begin(Kind.ARRAY, position);
    }

    public SyntaxTreeBuilder beginObject(Position position) {
        return begin(Kind.OBJECT, position);
    }

    public SyntaxTreeBuilder beginQuote(Position position) {
        return begin(Kind.QUOTE, position);
    }

    /**
     * Set the key of the next value appended to the innermost object.
     */
    public SyntaxTreeBuilder key(Position position, String key) {
        requireNonNull(position, "position");
        requireNonNull(key, "key");
        var frame = open.peek();
        if (frame == null || frame.kind != Kind.OBJECT) {
            throw fail(new SyntaxError.KeyOutsideObject(position, key));
        }
        if (frame.pendingKey != null) {
            throw fail(new SyntaxError.DanglingKey(position, frame.pendingKey));
        }
        frame.pendingKey = key;
        return this;
    }

    public SyntaxTreeBuilder endArray(Position position) {
        return end(position, Kind.ARRAY);
    }

    public SyntaxTreeBuilder endObject(Position position) {
        return end(position, Kind.OBJECT);
    }

    public SyntaxTreeBuilder endQuote(Position position) {
        return end(position, Kind.QUOTE);
    }

    /**
     * Close the innermost composite, whatever its kind.
     * Parsers that know which bracket they saw should use the typed closers.
     *
     * @param position position of the closing token
     */
    public SyntaxTreeBuilder end(Position position) {
        requireNonNull(position, "position");
        var frame = open.peek();
        if (frame == null) {
            throw fail(new SyntaxError.UnbalancedEnd(position));
        }
        return close(frame, position);
    }

    private SyntaxTreeBuilder end(Position position, Kind kind) {
        requireNonNull(position, "position");
        var frame = open.peek();
        if (frame == null) {
            throw fail(new SyntaxError.UnbalancedEnd(position));
        }
        if (frame.kind != kind) {
            throw fail(new SyntaxError.MismatchedEnd(position, frame.kind, kind));
        }
        return close(frame, position);
    }

    private SyntaxTreeBuilder close(Frame frame, Position position) {
        if (frame.pendingKey != null) {
            throw fail(new SyntaxError.DanglingKey(position, frame.pendingKey));
        }
        var node = frame.toNode();
        open.pop();
        log.trace("Closed {} at {} with {} entries", node.kind().displayName(), node.position(), frame.size());
        // Parent was checked for a pending key in begin()
        var parent = open.peek();
        if (parent == null) {
            program.add(node);
        } else {
            parent.add(node);
        }
        return this;
    }

    /**
     * Number of composites currently open.
     */
    public int depth() {
        return open.size();
    }

    /**
     * Finish the program and reset the builder for reuse.
     *
     * @return top-level nodes in source order
     */
    public List<SyntaxNode> build() {
        if (!open.isEmpty()) {
            var outermost = open.peekLast();
            throw fail(new SyntaxError.UnclosedComposite(outermost.position, outermost.kind));
        }
        var result = ImmutableList.copyOf(program);
        program.clear();
        log.debug("Built program with {} top-level nodes", result.size());
        return result;
    }

    private SyntaxTreeBuilder begin(Kind kind, Position position) {
        requireNonNull(position, "position");
        if (open.size() >= config.maxDepth()) {
            throw fail(new SyntaxError.DepthExceeded(position, config.maxDepth()));
        }
        var parent = open.peek();
        if (parent != null) {
            ensureKeyFor(parent, position, kind);
        }
        open.push(new Frame(kind, position));
        log.trace("Opened {} at {} (depth {})", kind.displayName(), position, open.size());
        return this;
    }

    private static void ensureKeyFor(Frame frame, Position position, Kind kind) {
        if (frame.kind == Kind.OBJECT && frame.pendingKey == null) {
            throw fail(new SyntaxError.MissingKey(position, kind));
        }
    }

    private static SyntaxTreeException fail(SyntaxError error) {
        log.debug("Rejected: {}", error.message());
        return new SyntaxTreeException(error);
    }

    /**
     * Composite under construction.
     */
    private static final class Frame {
        private final Kind kind;
        private final Position position;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final List<Property> properties = new ArrayList<>();
        private String pendingKey;

        private Frame(Kind kind, Position position) {
            this.kind = kind;
            this.position = position;
        }

        private void add(SyntaxNode node) {
            if (kind == Kind.OBJECT) {
                properties.add(Property.of(pendingKey, node));
                pendingKey = null;
            } else {
                children.add(node);
            }
        }

        private int size() {
            return kind == Kind.OBJECT ? properties.size() : children.size();
        }

        private SyntaxNode toNode() {
            return switch (kind) {
                case ARRAY -> SyntaxNode.array(position, children);
                case OBJECT -> SyntaxNode.object(position, properties);
                case QUOTE -> SyntaxNode.quote(position, children);
                case STRING, SYMBOL, WORD -> throw new IllegalStateException("Not a composite: " + kind);
            };
        }
    }
}
