package com.spectrace.tg.util;

import java.util.Arrays;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticListener;

/**
 * Fans diagnostics out to several {@link DiagnosticListener}s, in the order
 * they were added.
 */
public class CompositeDiagnosticListener implements DiagnosticListener {
    private DiagnosticListener[] listeners = new DiagnosticListener[0];

    public CompositeDiagnosticListener(DiagnosticListener... initial) {
        for (DiagnosticListener l : initial)
            add(l);
    }

    public CompositeDiagnosticListener add(DiagnosticListener listener) {
        DiagnosticListener[] old = listeners;
        DiagnosticListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        for (DiagnosticListener l : listeners)
            l.onDiagnostic(diagnostic);
    }

    @Override
    public void onPassComplete(String pass, int diagnostics) {
        for (DiagnosticListener l : listeners)
            l.onPassComplete(pass, diagnostics);
    }
}
