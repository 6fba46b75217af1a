package com.codeshift.translator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeshift.translator.codegen.emitter.ScopedEmitter;
import com.codeshift.translator.codegen.exception.MalformedTreeException;
import com.codeshift.translator.codegen.walker.SyntaxTreeWalker;
import com.codeshift.translator.io.FileWriteUtil;
import com.codeshift.translator.io.SyntaxTreeReader;
import com.codeshift.translator.model.NodeKind;
import com.codeshift.translator.model.SyntaxNode;

/**
 * Runs a translation: reads the tree document, walks it with a fresh emitter and writes the
 * rendered text. Output is all-or-nothing.
 */
public class TranslationService {
    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    private final TranslatorConfig config;

    public TranslationService(TranslatorConfig config) {
        this.config = config;
    }

    /**
     * Translates an in-memory tree. Every call uses its own emitter, so repeated calls on the
     * same tree produce identical lines.
     *
     * @throws MalformedTreeException if the tree is missing a required attribute
     */
    public List<String> translateTree(SyntaxNode root) {
        return walk(root).getLines();
    }

    /**
     * Same as {@link #translateTree(SyntaxNode)}, joined with the configured line separator.
     */
    public String translateToString(SyntaxNode root) {
        return walk(root).render();
    }

    /**
     * Translates {@code inputFile} into {@code outputFile} as configured.
     */
    public TranslationResult translate() {
        long start = System.currentTimeMillis();
        Path input = config.getInputFile();
        if (input == null) {
            return TranslationResult.failure("No input file configured");
        }
        Path output = config.getOutputFile() != null
                ? config.getOutputFile()
                : FileWriteUtil.withExtension(input, "ts");

        try {
            log.info("Reading syntax tree: {}", input);
            SyntaxNode root = SyntaxTreeReader.read(input);

            ScopedEmitter emitter = new ScopedEmitter(config);
            SyntaxTreeWalker walker = new SyntaxTreeWalker(emitter);
            walker.visit(root);
            log.info("Emitted {} lines", emitter.getLineCount());

            boolean written = false;
            if (config.isDryRun()) {
                log.info("Dry run, skipping write of {}", output);
            } else {
                if (Files.exists(output) && !config.isForce()) {
                    return TranslationResult.failure(
                            "Output file already exists: " + output + ". Use --force to overwrite.");
                }
                FileWriteUtil.safeWriteString(output, emitter.render() + config.getLineSeparator());
                written = true;
                log.info("Wrote {}", output.toAbsolutePath());
            }

            return TranslationResult.builder()
                    .success(true)
                    .outputPath(output)
                    .written(written)
                    .lines(emitter.getLines())
                    .stats(buildStats(walker, emitter, System.currentTimeMillis() - start))
                    .build();

        } catch (MalformedTreeException e) {
            log.error("Malformed syntax tree in {}: {}", input, e.getMessage());
            return TranslationResult.failure("Malformed syntax tree: " + e.getMessage());
        } catch (IOException e) {
            log.error("Translation of {} failed", input, e);
            return TranslationResult.failure("I/O error: " + e.getMessage());
        }
    }

    private ScopedEmitter walk(SyntaxNode root) {
        ScopedEmitter emitter = new ScopedEmitter(config);
        new SyntaxTreeWalker(emitter).visit(root);
        return emitter;
    }

    private static TranslationStats buildStats(SyntaxTreeWalker walker, ScopedEmitter emitter, long elapsed) {
        int statements = walker.getVisitCount(NodeKind.RETURN)
                + walker.getVisitCount(NodeKind.EXPRESSION_STATEMENT)
                + walker.getVisitCount(NodeKind.VARIABLE_DECLARATION)
                + walker.getVisitCount(NodeKind.TRY);

        return TranslationStats.builder()
                .namespaceCount(walker.getVisitCount(NodeKind.NAMESPACE))
                .classCount(walker.getVisitCount(NodeKind.CLASS))
                .fieldCount(walker.getVisitCount(NodeKind.FIELD))
                .propertyCount(walker.getVisitCount(NodeKind.PROPERTY))
                .methodCount(walker.getVisitCount(NodeKind.METHOD))
                .statementCount(statements)
                .lineCount(emitter.getLineCount())
                .translationTimeMillis(elapsed)
                .build();
    }
}
