package com.spectrace.tg.util;

import java.util.ArrayList;
import java.util.List;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticKind;
import com.spectrace.tg.api.DiagnosticListener;
import com.spectrace.tg.api.SourceLocation;

import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeDiagnosticListenerTest {

    private static final class Recorder implements DiagnosticListener {
        final String name;
        final List<String> log;

        Recorder(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void onDiagnostic(Diagnostic diagnostic) {
            log.add(name + ":" + diagnostic.kind());
        }

        @Override
        public void onPassComplete(String pass, int diagnostics) {
            log.add(name + ":" + pass + "=" + diagnostics);
        }
    }

    @Test
    public void testFanOutInOrder() {
        List<String> log = new ArrayList<>();
        CompositeDiagnosticListener composite = new CompositeDiagnosticListener(new Recorder("a", log));
        composite.add(new Recorder("b", log));
        assertEquals(2, composite.size());

        composite.onDiagnostic(Diagnostic.warning(DiagnosticKind.BROKEN_REFERENCE, "missing",
                SourceLocation.at("spec/dev.md", 3), "REQ-d00001"));
        composite.onPassComplete("resolve", 1);

        assertEquals(List.of("a:BROKEN_REFERENCE", "b:BROKEN_REFERENCE", "a:resolve=1", "b:resolve=1"), log);
    }

    @Test
    public void testEmpty() {
        CompositeDiagnosticListener composite = new CompositeDiagnosticListener();
        assertEquals(0, composite.size());
        // No listeners, nothing to do
        composite.onPassComplete("classify", 0);
    }

    @Test
    public void testDefaultPassCallback() {
        List<Diagnostic> seen = new ArrayList<>();
        CompositeDiagnosticListener composite = new CompositeDiagnosticListener(seen::add);
        composite.onPassComplete("cycles", 0);
        composite.onDiagnostic(Diagnostic.info(DiagnosticKind.BROKEN_REFERENCE, "x", null));
        assertEquals(1, seen.size());
    }
}
