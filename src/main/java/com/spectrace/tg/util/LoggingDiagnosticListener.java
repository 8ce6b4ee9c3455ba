package com.spectrace.tg.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticListener;

/**
 * Logs each diagnostic at the Log4j level matching its severity, and each
 * completed build pass at DEBUG.
 */
public class LoggingDiagnosticListener implements DiagnosticListener {
    private static final Logger log = LogManager.getLogger(LoggingDiagnosticListener.class);

    @Override
    public void onDiagnostic(Diagnostic d) {
        Level level = switch (d.severity()) {
            case ERROR -> Level.ERROR;
            case WARNING -> Level.WARN;
            case INFO -> Level.INFO;
        };
        log.log(level, "{} {}{}", d.kind(), d.message(), d.location() != null ? " (" + d.location() + ")" : "");
    }

    @Override
    public void onPassComplete(String pass, int diagnostics) {
        log.debug("Pass {} complete: {} diagnostics", pass, diagnostics);
    }
}
