package com.spectrace.tg.io;

import java.util.List;

/**
 * Everything the pipeline extracted from one source unit.
 *
 * @param unit                the unit that was parsed
 * @param fragments           fragments in ascending start-line order, remainders included
 * @param warnings            parse warnings raised by any parser
 * @param expectedBrokenLinks the file's expected-broken-links budget, 0 if undeclared
 * @param failure             message of the parser exception that aborted the unit, or null
 */
public record ParsedUnit(SourceUnit unit, List<ContentFragment> fragments, List<ParseWarning> warnings,
        int expectedBrokenLinks, String failure) {

    public ParsedUnit {
        fragments = List.copyOf(fragments);
        warnings = List.copyOf(warnings);
    }

    static ParsedUnit failed(SourceUnit unit, List<ParseWarning> warnings, String failure) {
        return new ParsedUnit(unit, List.of(), warnings, 0, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String path() {
        return unit.path();
    }

    public List<ContentFragment> fragmentsOfType(FragmentType type) {
        return fragments.stream().filter(f -> f.type() == type).toList();
    }
}
