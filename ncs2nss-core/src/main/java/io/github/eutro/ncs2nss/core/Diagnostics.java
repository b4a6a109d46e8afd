package io.github.eutro.ncs2nss.core;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one decompilation, in the order they were reported.
 */
public final class Diagnostics {
    private static final Logger LOGGER = System.getLogger(Diagnostics.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(DiagnosticKind kind, int offset, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, offset, message);
        LOGGER.log(kind == DiagnosticKind.REPAIR_APPLIED ? Level.DEBUG : Level.WARNING, "{0}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public void report(DiagnosticKind kind, String message) {
        report(kind, Diagnostic.NO_OFFSET, message);
    }

    public List<Diagnostic> list() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean has(DiagnosticKind kind) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) return true;
        }
        return false;
    }

    public int count(DiagnosticKind kind) {
        int n = 0;
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) n++;
        }
        return n;
    }
}
