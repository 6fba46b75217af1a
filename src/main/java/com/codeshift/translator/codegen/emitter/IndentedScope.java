package com.codeshift.translator.codegen.emitter;

/**
 * Handle for one brace-delimited region opened by {@link ScopedEmitter#openScope()}.
 *
 * Closing it dedents and emits the closing brace. Closing twice has no further effect.
 */
public final class IndentedScope implements AutoCloseable {

    private final ScopedEmitter emitter;
    private boolean closed;

    IndentedScope(ScopedEmitter emitter) {
        this.emitter = emitter;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        emitter.closeScope();
    }
}
