package io.github.relcsv.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates non-fatal diagnostics during one inference run.
 *
 * <p>Tracks the JSON path of the node being visited so every diagnostic can point
 * back into the source document. Path segments are pushed with {@link #pushField(String)}
 * or {@link #pushIndex(int)} and popped when the returned context is closed.</p>
 */
public class InferenceDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(InferenceDiagnostics.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Deque<String> path = new ArrayDeque<>();

    /**
     * Pushes an object field onto the path stack.
     */
    public PathContext pushField(String fieldName) {
        path.push("." + fieldName);
        return new PathContext(this);
    }

    /**
     * Pushes an array index onto the path stack.
     */
    public PathContext pushIndex(int index) {
        path.push("[" + index + "]");
        return new PathContext(this);
    }

    void pop() {
        if (!path.isEmpty()) {
            path.pop();
        }
    }

    /**
     * Returns the current location as a JSON path, e.g. {@code $.store.books[1]}.
     */
    public String getCurrentPath() {
        StringBuilder sb = new StringBuilder("$");
        Iterator<String> it = path.descendingIterator();
        while (it.hasNext()) {
            sb.append(it.next());
        }
        return sb.toString();
    }

    /**
     * Records a diagnostic at the current path and logs it.
     */
    public void warn(Diagnostic.Kind kind, String tableName, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, getCurrentPath(), tableName, message);
        diagnostics.add(diagnostic);
        LOG.warn("{}", diagnostic);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream()
                .filter(d -> d.kind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * Formats all diagnostics into a single string.
     */
    public String format() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("; "));
    }

    /**
     * AutoCloseable context that pops one path segment when closed.
     */
    public static class PathContext implements AutoCloseable {
        private final InferenceDiagnostics diagnostics;

        PathContext(InferenceDiagnostics diagnostics) {
            this.diagnostics = diagnostics;
        }

        @Override
        public void close() {
            diagnostics.pop();
        }
    }
}
