package org.pragmatica.plorth.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.plorth.error.SyntaxError;
import org.pragmatica.plorth.error.SyntaxTreeException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Syntax tree node of a Plorth program: array, object and quote literals, strings,
 * symbols and word definitions.
 *
 * <p>Nodes are immutable once constructed and may be shared freely between containers
 * and threads. A composite can only reference nodes built before it, so trees are
 * always acyclic.
 *
 * <p>Consumers dispatch either on {@link #kind()} or, type-safely, through
 * {@link #accept(Visitor)}.
 */
public sealed interface SyntaxNode {
    /**
     * Where in source code the node was found.
     */
    Position position();

    /**
     * Discriminator of the variant.
     */
    Kind kind();

    /**
     * Invoke the visitor method matching this node's variant.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Node kinds, tagged with the character that introduces them in source.
     */
    enum Kind {
        ARRAY('[', "array"),
        OBJECT('{', "object"),
        QUOTE('(', "quote"),
        STRING('"', "string"),
        SYMBOL('s', "symbol"),
        WORD(':', "word");

        private final char tag;
        private final String displayName;

        Kind(char tag, String displayName) {
            this.tag = tag;
            this.displayName = displayName;
        }

        public char tag() {
            return tag;
        }

        public String displayName() {
            return displayName;
        }

        public static Optional<Kind> fromTag(char tag) {
            return Arrays.stream(values())
                         .filter(kind -> kind.tag == tag)
                         .findFirst();
        }
    }

    /**
     * Exhaustive dispatch over node variants.
     */
    interface Visitor<R> {
        R visitArray(ArrayNode node);

        R visitObject(ObjectNode node);

        R visitQuote(QuoteNode node);

        R visitString(StringNode node);

        R visitSymbol(SymbolNode node);

        R visitWord(WordNode node);
    }

    // === Composites ===

    /**
     * Array literal: {@code [ e1, e2, ... ]}
     */
    record ArrayNode(
    Position position,
    List<SyntaxNode> elements) implements SyntaxNode {
        public ArrayNode {
            requireNonNull(position, "position");
            elements = ImmutableList.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * Object literal: {@code { "key": value, ... }}. Keys keep insertion order and may repeat.
     */
    record ObjectNode(
    Position position,
    List<Property> properties) implements SyntaxNode {
        public ObjectNode {
            requireNonNull(position, "position");
            properties = ImmutableList.copyOf(properties);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    /**
     * Quote literal: {@code ( ... )}, a block of code executed later.
     */
    record QuoteNode(
    Position position,
    List<SyntaxNode> children) implements SyntaxNode {
        public QuoteNode {
            requireNonNull(position, "position");
            children = ImmutableList.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.QUOTE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuote(this);
        }
    }

    /**
     * Key/value pair of an object literal.
     */
    record Property(
    String key,
    SyntaxNode value) {
        public Property {
            requireNonNull(key, "key");
            requireNonNull(value, "value");
        }

        public static Property of(String key, SyntaxNode value) {
            return new Property(key, value);
        }
    }

    // === Leaves ===

    /**
     * String literal.
     */
    record StringNode(
    Position position,
    String value) implements SyntaxNode {
        public StringNode {
            requireNonNull(position, "position");
            requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * Symbol. The identifier is stored as scanned, without lexical checks.
     */
    record SymbolNode(
    Position position,
    String id) implements SyntaxNode {
        public SymbolNode {
            requireNonNull(position, "position");
            requireNonNull(id, "id");
        }

        @Override
        public Kind kind() {
            return Kind.SYMBOL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    /**
     * Word definition: {@code : name}. Always backed by a symbol.
     */
    record WordNode(
    Position position,
    SymbolNode symbol) implements SyntaxNode {
        public WordNode {
            requireNonNull(position, "position");
            requireNonNull(symbol, "symbol");
        }

        @Override
        public Kind kind() {
            return Kind.WORD;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWord(this);
        }
    }

    // === Factories ===

    static ArrayNode array(Position position, List<? extends SyntaxNode> elements) {
        return new ArrayNode(position, ImmutableList.copyOf(elements));
    }

    static ArrayNode array(Position position, SyntaxNode... elements) {
        return new ArrayNode(position, ImmutableList.copyOf(elements));
    }

    static ObjectNode object(Position position, List<Property> properties) {
        return new ObjectNode(position, properties);
    }

    static ObjectNode object(Position position, Property... properties) {
        return new ObjectNode(position, ImmutableList.copyOf(properties));
    }

    static QuoteNode quote(Position position, List<? extends SyntaxNode> children) {
        return new QuoteNode(position, ImmutableList.copyOf(children));
    }

    static QuoteNode quote(Position position, SyntaxNode... children) {
        return new QuoteNode(position, ImmutableList.copyOf(children));
    }

    static StringNode string(Position position, String value) {
        return new StringNode(position, value);
    }

    static SymbolNode symbol(Position position, String id) {
        return new SymbolNode(position, id);
    }

    static WordNode word(Position position, SymbolNode symbol) {
        return new WordNode(position, symbol);
    }

    /**
     * Word over the symbol {@code id}, located at the same position.
     */
    static WordNode word(Position position, String id) {
        return new WordNode(position, new SymbolNode(position, id));
    }

    /**
     * Word over a node whose variant is only known at runtime.
     *
     * @throws SyntaxTreeException with {@link SyntaxError.NotASymbol} if {@code name} is not a symbol
     */
    static WordNode word(Position position, SyntaxNode name) {
        requireNonNull(position, "position");
        requireNonNull(name, "name");
        if (name instanceof SymbolNode symbol) {
            return new WordNode(position, symbol);
        }
        throw new SyntaxTreeException(new SyntaxError.NotASymbol(position, name.kind()));
    }
}
