package com.codeshift.translator.codegen.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.codeshift.translator.codegen.TranslatorConfig;

/**
 * Owns the output of one translation run: an append-only list of lines and the current
 * indentation depth.
 *
 * Depth only changes through {@link #openScope()} and the returned {@link IndentedScope}, so
 * callers should always open scopes in try-with-resources:
 *
 * <pre>
 * emitter.emitLine("try");
 * try (IndentedScope scope = emitter.openScope()) {
 *     ...
 * }
 * </pre>
 *
 * Instances are not thread-safe; use one emitter per run.
 */
public class ScopedEmitter {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final List<String> lines = new ArrayList<>();
    private final int indentWidth;
    private final String lineSeparator;
    private int depth;

    public ScopedEmitter() {
        this(DEFAULT_INDENT_WIDTH, System.lineSeparator());
    }

    public ScopedEmitter(TranslatorConfig config) {
        this(config.getIndentWidth(), config.getLineSeparator());
    }

    public ScopedEmitter(int indentWidth, String lineSeparator) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must be >= 0. Got: " + indentWidth);
        }
        this.indentWidth = indentWidth;
        this.lineSeparator = lineSeparator != null ? lineSeparator : System.lineSeparator();
    }

    /**
     * Appends {@code text} indented to the current depth.
     */
    public void emitLine(String text) {
        lines.add(indentation() + (text != null ? text : ""));
    }

    /**
     * Appends a {@link String#format} rendering of {@code template}, indented to the current depth.
     */
    public void emitFormatted(String template, Object... args) {
        emitLine(String.format(Locale.ROOT, template, args));
    }

    /**
     * Appends one statement that spans several physical lines. The first segment is indented to
     * the current depth; every following segment gets an extra {@code alignment} spaces so it
     * lines up under the first one.
     */
    public void emitContinued(List<String> segments, int alignment) {
        if (segments.isEmpty()) {
            return;
        }
        emitLine(segments.get(0));
        String padding = " ".repeat(Math.max(alignment, 0));
        for (int i = 1; i < segments.size(); i++) {
            emitLine(padding + segments.get(i));
        }
    }

    /**
     * Emits an open brace at the current depth and indents one level. The brace is closed and
     * the depth restored when the returned scope is closed.
     */
    public IndentedScope openScope() {
        emitLine("{");
        depth++;
        return new IndentedScope(this);
    }

    void closeScope() {
        if (depth == 0) {
            throw new IllegalStateException("No open scope to close");
        }
        depth--;
        emitLine("}");
    }

    public String indentation() {
        return " ".repeat(depth * indentWidth);
    }

    public int getDepth() {
        return depth;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    public int getLineCount() {
        return lines.size();
    }

    /**
     * Snapshot of the lines emitted so far, in order.
     */
    public List<String> getLines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    /**
     * The lines joined by the configured line separator. Does not reset the emitter.
     */
    public String render() {
        return String.join(lineSeparator, lines);
    }
}
