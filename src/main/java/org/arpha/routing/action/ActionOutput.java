package org.arpha.routing.action;

/**
 * Collects the incidental output written during a single action invocation. A fresh instance
 * is opened for every call and closed right after it, so output never leaks between calls.
 */
public class ActionOutput implements AutoCloseable {

    private final StringBuilder buffer = new StringBuilder();
    private boolean closed;

    public static ActionOutput open() {
        return new ActionOutput();
    }

    public ActionOutput write(Object value) {
        ensureOpen();
        if (value != null) {
            buffer.append(value);
        }
        return this;
    }

    public ActionOutput writef(String format, Object... args) {
        return write(String.format(format, args));
    }

    public String contents() {
        return buffer.toString();
    }

    /**
     * Returns what was written so far and empties the buffer.
     */
    public String drain() {
        String contents = buffer.toString();
        buffer.setLength(0);
        return contents;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        buffer.setLength(0);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Action output already closed");
        }
    }

}
