package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.api.SourceLocation;

/**
 * Per-unit state handed to every parser: where the text came from, the id
 * grammar, and a sink for parse warnings.
 */
public final class ParseContext {
    private final SourceUnit unit;
    private final IdPatterns ids;
    private final List<ParseWarning> warnings = new ArrayList<>();

    public ParseContext(SourceUnit unit, IdPatterns ids) {
        this.unit = unit;
        this.ids = ids;
    }

    public String path() {
        return unit.path();
    }

    public SourceDomain domain() {
        return unit.domain();
    }

    public SourceUnit unit() {
        return unit;
    }

    public IdPatterns ids() {
        return ids;
    }

    public SourceLocation location(int line) {
        return SourceLocation.at(unit.path(), line);
    }

    public SourceLocation location(int line, int endLine) {
        return new SourceLocation(unit.path(), line, endLine);
    }

    public void warn(String parser, int line, String message) {
        warnings.add(new ParseWarning(parser, message, location(line)));
    }

    public List<ParseWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
