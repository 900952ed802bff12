package org.pragmatica.sgf;

import org.pragmatica.sgf.error.Diagnostic;
import org.pragmatica.sgf.error.GrammarError;
import org.pragmatica.sgf.error.SgfException;
import org.pragmatica.sgf.parser.CharSource;
import org.pragmatica.sgf.parser.ParserConfig;
import org.pragmatica.sgf.parser.ProgressListener;
import org.pragmatica.sgf.parser.ReaderCharSource;
import org.pragmatica.sgf.parser.SgfLexer;
import org.pragmatica.sgf.parser.SgfParser;
import org.pragmatica.sgf.parser.StringCharSource;
import org.pragmatica.sgf.proof.ProofAnnotator;
import org.pragmatica.sgf.proof.PropertyInterpreter;
import org.pragmatica.sgf.tree.GameTree;
import org.pragmatica.sgf.tree.SourceLocation;
import org.pragmatica.sgf.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point for loading annotated game trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tree = SgfTreeLoader.loadFromString("(;B[aa]C[solver_status: WIN](;W[bb]))");
 * var root = tree.root().orElseThrow();
 * long proofSize = root.proofSize();
 *
 * var quiet = SgfTreeLoader.builder()
 *                          .annotate(false)
 *                          .loadFromFile(Path.of("game.sgf"));
 * }</pre>
 *
 * <p>A failed load yields no tree: nodes allocated before the failure are released and the
 * error is rethrown.
 */
public final class SgfTreeLoader {
    private static final Logger log = LoggerFactory.getLogger(SgfTreeLoader.class);

    private SgfTreeLoader() {}

    public static GameTree loadFromString(String sgf) {
        return loadFromString(sgf, ParserConfig.DEFAULT);
    }

    public static GameTree loadFromString(String sgf, ParserConfig config) {
        var source = new StringCharSource(sgf);
        try {
            return load(source, source.length(), config);
        } catch (SgfException e) {
            if (log.isDebugEnabled()) {
                log.debug("Rejected SGF text: {}", e.diagnostic().highlight(sgf, config.contextWidth(), ">>", "<<"));
            }
            throw e;
        }
    }

    public static GameTree loadFromFile(Path path) throws IOException {
        return loadFromFile(path, ParserConfig.DEFAULT);
    }

    public static GameTree loadFromFile(Path path, ParserConfig config) throws IOException {
        log.debug("Loading game tree from {}", path);
        try (var source = ReaderCharSource.open(path)) {
            return load(source, Files.size(path), config);
        }
    }

    /**
     * Parse the whole stream, interpret the solver properties and annotate proof sizes.
     *
     * @param length total input length for progress reporting, 0 when unknown
     * @throws org.pragmatica.sgf.error.LexicalError               on malformed characters
     * @throws GrammarError                                       on malformed structure or empty input
     * @throws org.pragmatica.sgf.error.InconsistentTreeException on contradictory solver metadata
     */
    public static GameTree load(CharSource source, long length, ParserConfig config) {
        var tree = new GameTree();
        try {
            var parser = new SgfParser(new SgfLexer(source, length, config.progressListener()), tree.arena());
            var node = parser.nextNode();
            while (node.isPresent()) {
                PropertyInterpreter.interpret(node.get());
                node = parser.nextNode();
            }

            var root = parser.root()
                             .orElseThrow(() -> new GrammarError("No game tree found",
                                                                 SourceSpan.at(SourceLocation.START),
                                                                 "expected '('"));
            tree.setRoot(root);
            if (config.annotate()) {
                ProofAnnotator.annotate(tree);
            }
            log.debug("Loaded game tree: {} nodes", tree.size());
            return tree;
        } catch (RuntimeException e) {
            log.debug("Discarding partial game tree of {} nodes: {}", tree.size(), e.getMessage());
            tree.reset();
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean annotate = true;
        private ProgressListener progressListener = ProgressListener.NONE;
        private int contextWidth = Diagnostic.DEFAULT_CONTEXT_WIDTH;

        private Builder() {}

        public Builder annotate(boolean enabled) {
            this.annotate = enabled;
            return this;
        }

        public Builder progress(ProgressListener listener) {
            this.progressListener = listener;
            return this;
        }

        public Builder contextWidth(int width) {
            this.contextWidth = width;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(annotate, progressListener, contextWidth);
        }

        public GameTree loadFromString(String sgf) {
            return SgfTreeLoader.loadFromString(sgf, config());
        }

        public GameTree loadFromFile(Path path) throws IOException {
            return SgfTreeLoader.loadFromFile(path, config());
        }
    }
}
