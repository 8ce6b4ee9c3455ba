package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * The result of one parser claiming a set of lines.
 *
 * The claimed lines need not be contiguous (a test reference comment and the
 * test declaration a few lines below it form one fragment). {@link #startLine()}
 * and {@link #endLine()} give the span, {@link #lines()} the exact claim.
 */
public record ContentFragment(FragmentType type, List<Integer> lines, String rawText, Map<String, Object> fields,
        List<AssertionRecord> assertions, List<SectionRecord> sections, List<PendingLink> links) {
    public static final String RESULTS = "results";

    public ContentFragment {
        lines = List.copyOf(new TreeSet<>(lines));
        if (lines.isEmpty())
            throw new IllegalArgumentException("A fragment must claim at least one line");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        assertions = List.copyOf(assertions);
        sections = List.copyOf(sections);
        links = List.copyOf(links);
    }

    public int startLine() {
        return lines.get(0);
    }

    public int endLine() {
        return lines.get(lines.size() - 1);
    }

    /** String field value, or null. */
    public String field(String name) {
        Object v = fields.get(name);
        return v == null ? null : v.toString();
    }

    /** Test outcomes carried by a TEST_RESULT fragment; empty for every other type. */
    @SuppressWarnings("unchecked")
    public List<TestResultRecord> results() {
        Object v = fields.get(RESULTS);
        return v instanceof List<?> ? (List<TestResultRecord>) v : List.of();
    }

    public static Builder builder(FragmentType type) {
        return new Builder(type);
    }

    /** Accumulates a fragment while a parser walks its claim. */
    public static final class Builder {
        private final FragmentType type;
        private final List<Integer> lines = new ArrayList<>();
        private final List<String> text = new ArrayList<>();
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final List<AssertionRecord> assertions = new ArrayList<>();
        private final List<SectionRecord> sections = new ArrayList<>();
        private final List<PendingLink> links = new ArrayList<>();

        private Builder(FragmentType type) {
            this.type = type;
        }

        public Builder line(NumberedLine line) {
            lines.add(line.number());
            text.add(line.text());
            return this;
        }

        public Builder lines(List<NumberedLine> claimed) {
            claimed.forEach(this::line);
            return this;
        }

        public Builder field(String name, Object value) {
            if (value != null)
                fields.put(name, value);
            return this;
        }

        public Builder assertion(AssertionRecord a) {
            assertions.add(a);
            return this;
        }

        public Builder section(SectionRecord s) {
            sections.add(s);
            return this;
        }

        public Builder link(PendingLink link) {
            links.add(link);
            return this;
        }

        public boolean hasLinks() {
            return !links.isEmpty();
        }

        public ContentFragment build() {
            return new ContentFragment(type, lines, String.join("\n", text), fields, assertions, sections, links);
        }
    }
}
