package org.pragmatica.sgf.parser;

import org.pragmatica.sgf.error.GrammarError;
import org.pragmatica.sgf.tree.NodeAllocator;
import org.pragmatica.sgf.tree.Property;
import org.pragmatica.sgf.tree.SgfNode;
import org.pragmatica.sgf.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resumable SGF parser.
 *
 * <p>Each {@link #nextNode()} call continues from where the previous one stopped and returns
 * at most one node whose properties have just been completed. Callers must keep calling
 * until the result is empty: unmatched parentheses are only detected at end of input.
 *
 * <p>Example:
 * <pre>{@code
 * var arena = new NodeArena();
 * var parser = new SgfParser(new StringCharSource("(;B[a](;W[b])(;W[c]))"), arena);
 * while (parser.nextNode().isPresent()) {
 * }
 * var root = parser.root().orElseThrow();
 * }</pre>
 */
public final class SgfParser {
    private static final Logger log = LoggerFactory.getLogger(SgfParser.class);

    private static final Set<TokenKind> EXPECT_LEFT_PAREN = frozen(EnumSet.of(TokenKind.LEFT_PAREN));
    private static final Set<TokenKind> EXPECT_SEMICOLON = frozen(EnumSet.of(TokenKind.SEMICOLON));
    private static final Set<TokenKind> EXPECT_TAG = frozen(EnumSet.of(TokenKind.TAG));
    private static final Set<TokenKind> EXPECT_VALUE = frozen(EnumSet.of(TokenKind.VALUE));
    private static final Set<TokenKind> AFTER_RIGHT_PAREN = frozen(EnumSet.of(TokenKind.LEFT_PAREN,
                                                                              TokenKind.RIGHT_PAREN));
    private static final Set<TokenKind> AFTER_VALUE = frozen(EnumSet.range(TokenKind.LEFT_PAREN, TokenKind.VALUE));

    // Stack element
    private sealed interface Frame {
        record LeftParen(SourceSpan span) implements Frame {}

        record NodeMarker(SgfNode node) implements Frame {}
    }

    private final SgfLexer lexer;
    private final NodeAllocator allocator;
    private final Deque<Frame> stack;
    private final SgfNode dummyRoot;
    private SgfNode current;
    private Set<TokenKind> allowed;

    // Property being accumulated for the current node
    private String pendingTag;
    private SourceSpan pendingSpan;
    private final List<String> pendingValues;

    private long nextId;
    private SgfNode root;
    private boolean finished;

    public SgfParser(CharSource source, NodeAllocator allocator) {
        this(new SgfLexer(source), allocator);
    }

    public SgfParser(SgfLexer lexer, NodeAllocator allocator) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.stack = new ArrayDeque<>();
        this.dummyRoot = allocator.allocate();
        this.current = dummyRoot;
        this.allowed = EXPECT_LEFT_PAREN;
        this.pendingValues = new ArrayList<>();
        this.nextId = 0;
        this.finished = false;
    }

    /**
     * Advance to the next completed node.
     *
     * @return the completed node, or empty once the input is exhausted and validated
     * @throws org.pragmatica.sgf.error.LexicalError on malformed characters
     * @throws GrammarError                         on tokens the grammar does not allow here
     */
    public Optional<SgfNode> nextNode() {
        if (finished) {
            return Optional.empty();
        }
        while (true) {
            var token = lexer.nextToken();
            if (token instanceof SgfToken.Eof) {
                finish();
                return Optional.empty();
            }
            if (!allowed.contains(token.kind())) {
                throw unexpected(token);
            }

            SgfNode completed = null;
            if (token instanceof SgfToken.LeftParen leftParen) {
                openBranch(leftParen);
            } else if (token instanceof SgfToken.RightParen rightParen) {
                completed = closeBranch(rightParen);
            } else if (token instanceof SgfToken.Semicolon semicolon) {
                completed = startNode(semicolon);
            } else if (token instanceof SgfToken.Tag tag) {
                startProperty(tag);
            } else if (token instanceof SgfToken.Value value) {
                addValue(value);
            }

            if (completed != null) {
                log.trace("Completed node {} with {} properties", completed.id(), completed.properties().size());
                return Optional.of(completed);
            }
        }
    }

    /**
     * The game-tree root, available once {@link #nextNode()} has returned empty.
     */
    public Optional<SgfNode> root() {
        return Optional.ofNullable(root);
    }

    public boolean isFinished() {
        return finished;
    }

    private void openBranch(SgfToken.LeftParen token) {
        stack.push(new Frame.NodeMarker(current));
        stack.push(new Frame.LeftParen(token.span()));
        allowed = EXPECT_SEMICOLON;
    }

    private SgfNode closeBranch(SgfToken.RightParen token) {
        if (stack.isEmpty()) {
            throw new GrammarError("Unmatched right parenthesis", token.span(), "no open '(' left");
        }
        var completed = flushPending();

        // pop until '('
        while (!(stack.pop() instanceof Frame.LeftParen)) {
            if (stack.isEmpty()) {
                throw new GrammarError("Unmatched right parenthesis", token.span(), "no open '(' left");
            }
        }
        if (stack.pop() instanceof Frame.NodeMarker marker) {
            current = marker.node();
        } else {
            throw new IllegalStateException("Parser stack corrupted: '(' without enclosing node");
        }

        allowed = AFTER_RIGHT_PAREN;
        return completed;
    }

    private SgfNode startNode(SgfToken.Semicolon token) {
        var completed = flushPending();
        if (current == dummyRoot && dummyRoot.childCount() > 0) {
            throw new GrammarError("Multiple game trees", token.span(), "only one root game tree is supported");
        }

        stack.push(new Frame.NodeMarker(current));
        var node = allocator.allocate();
        node.assignId(nextId++);
        current.addChild(node);
        current = node;

        allowed = EXPECT_TAG;
        return completed;
    }

    private void startProperty(SgfToken.Tag token) {
        flushPending();
        pendingTag = token.name();
        pendingSpan = token.span();
        allowed = EXPECT_VALUE;
    }

    private void addValue(SgfToken.Value token) {
        pendingValues.add(token.text());
        pendingSpan = pendingSpan.merge(token.span());
        allowed = AFTER_VALUE;
    }

    /**
     * Store the pending property into the current node.
     *
     * @return the current node if a property was stored, otherwise {@code null}
     */
    private SgfNode flushPending() {
        if (pendingValues.isEmpty()) {
            return null;
        }
        current.addProperty(new Property(pendingTag, pendingValues, pendingSpan));
        pendingValues.clear();
        pendingTag = null;
        pendingSpan = null;
        return current;
    }

    private void finish() {
        finished = true;

        // innermost unclosed '(' is the one nearest the top
        Frame.LeftParen unmatched = null;
        while (!stack.isEmpty()) {
            if (stack.pop() instanceof Frame.LeftParen leftParen) {
                unmatched = leftParen;
                break;
            }
        }
        if (unmatched != null) {
            throw new GrammarError("Unmatched left parenthesis", unmatched.span(), "this '(' is never closed");
        }

        root = dummyRoot.firstChild()
                        .map(SgfNode::detach)
                        .orElse(null);
        allocator.deallocate(dummyRoot);
    }

    private GrammarError unexpected(SgfToken token) {
        var found = switch (token.kind()) {
            case TAG -> "tag " + token.text();
            case VALUE -> "value [" + token.text() + "]";
            default -> token.kind().display();
        };
        var expected = allowed.stream()
                              .map(TokenKind::display)
                              .collect(Collectors.joining(" or "));
        return new GrammarError("Unexpected " + found, token.span(), "expected " + expected);
    }

    private static Set<TokenKind> frozen(EnumSet<TokenKind> kinds) {
        return Collections.unmodifiableSet(kinds);
    }
}
