package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled form of the configured id grammar, shared by parsers and the
 * reference resolver.
 */
public final class IdPatterns {
    private final TraceConfig config;
    private final String prefix;
    private final Pattern requirementId;
    private final Pattern requirementHeader;
    private final Pattern journeyHeader;
    private final Pattern journeyId;
    private final Pattern suffixedReference;
    private final Pattern assertionLabel;
    private final Pattern testNameReference;
    private final Pattern idToken;

    private IdPatterns(TraceConfig config) {
        TraceConfig.IdGrammar g = config.getIds();
        this.config = config;
        this.prefix = g.getPrefix();
        try {
            String id = "(?:" + g.getPattern() + ")";
            String label = "(?:" + g.getAssertionLabelPattern() + ")";
            String jny = Pattern.quote(g.getJourneyPrefix()) + "-[A-Za-z0-9][A-Za-z0-9-]*";
            this.requirementId = Pattern.compile(id);
            this.requirementHeader = Pattern.compile("^#+\\s*(?<id>" + id + "):\\s*(?<title>.+?)\\s*$");
            this.journeyHeader = Pattern.compile("^#+\\s*(?<id>" + jny + "):\\s*(?<title>.+?)\\s*$");
            this.journeyId = Pattern.compile(jny);
            this.suffixedReference = Pattern.compile("^(?<base>" + id + ")(?<labels>(?:-" + label + ")+)$",
                    Pattern.CASE_INSENSITIVE);
            this.assertionLabel = Pattern.compile(label);
            // REQ_p00001_A style tokens inside identifiers; an assertion letter must not run into a lowercase word
            this.testNameReference = Pattern.compile(Pattern.quote(prefix)
                    + "[-_](?<body>(?:[A-Z]{2,4}[-_])?[a-z]\\d+(?:[-_][A-Z](?![a-z]))*)");
            this.idToken = Pattern.compile(Pattern.quote(prefix) + "[-_][A-Za-z0-9]", Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid id grammar: " + e.getDescription(), e);
        }
    }

    public static IdPatterns of(TraceConfig config) {
        return new IdPatterns(config);
    }

    public TraceConfig config() {
        return config;
    }

    public String prefix() {
        return prefix;
    }

    public boolean isRequirementId(String id) {
        return requirementId.matcher(id).matches();
    }

    public boolean isJourneyId(String id) {
        return journeyId.matcher(id).matches();
    }

    public boolean isAssertionLabel(String label) {
        return assertionLabel.matcher(label).matches();
    }

    /** Whether the text contains anything that looks like a requirement reference. */
    public boolean mentionsRequirement(String text) {
        return idToken.matcher(text).find();
    }

    public Matcher requirementHeader(String line) {
        return requirementHeader.matcher(line);
    }

    public Matcher journeyHeader(String line) {
        return journeyHeader.matcher(line);
    }

    /** Level name implied by the type letter of an id such as REQ-d00001, or null. */
    public String levelOf(String id) {
        int dash = id.lastIndexOf('-');
        if (dash < 0 || dash + 1 >= id.length())
            return null;
        String code = id.substring(dash + 1, dash + 2).toLowerCase(Locale.ROOT);
        return config.getIds().getLevelCodes().get(code);
    }

    /** Prefixes a shorthand reference such as {@code p00001} with the configured prefix. */
    public String qualify(String ref) {
        String r = ref.trim();
        if (r.regionMatches(true, 0, prefix + "-", 0, prefix.length() + 1)
                || r.regionMatches(true, 0, prefix + "_", 0, prefix.length() + 1)
                || r.regionMatches(true, 0, config.getIds().getJourneyPrefix() + "-", 0,
                        config.getIds().getJourneyPrefix().length() + 1))
            return r;
        return prefix + "-" + r;
    }

    /**
     * Splits a reference with a multi-assertion suffix.
     *
     * @return base id followed by the labels, or just the reference if it has no suffix
     */
    public List<String> splitSuffixed(String ref) {
        List<String> out = new ArrayList<>();
        Matcher m = suffixedReference.matcher(ref);
        if (!m.matches()) {
            out.add(ref);
            return out;
        }
        out.add(m.group("base"));
        for (String label : m.group("labels").split("-"))
            if (!label.isEmpty())
                out.add(label.toUpperCase(Locale.ROOT));
        return out;
    }

    /** Requirement references embedded in a test or result name, normalized to dashed form. */
    public List<String> referencesInName(String name) {
        List<String> refs = new ArrayList<>();
        Matcher m = testNameReference.matcher(name);
        while (m.find()) {
            String ref = prefix + "-" + m.group("body").replace('_', '-');
            if (!refs.contains(ref))
                refs.add(ref);
        }
        return refs;
    }
}
