package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spectrace.tg.api.NodeKind;

import lombok.Data;

/**
 * Read-only configuration of a trace build.
 *
 * Every field has a working default, so {@code new TraceConfig()} builds a
 * graph for the conventional REQ-p00001 / REQ-o00001 / REQ-d00001 id scheme.
 * {@link TraceConfigLoader} overlays a JSON document onto these defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TraceConfig {
    private IdGrammar ids = new IdGrammar();

    /** Hierarchy rank per level name; lower is higher in the hierarchy. */
    private Map<String, Integer> levels = defaultLevels();

    /** Level name to the levels it may implement. */
    private Map<String, List<String>> allowedImplements = defaultAllowedImplements();

    /** Statuses whose nodes are skipped when rolling metrics up into a parent. */
    private List<String> excludedStatuses = new ArrayList<>(List.of("Deprecated", "Superseded", "Draft"));

    /** Child kinds that do not make a parentless node a meaningful root. */
    private List<NodeKind> satelliteKinds = new ArrayList<>(List.of(NodeKind.ASSERTION, NodeKind.TEST_RESULT));

    /** When set, a requirement implementing a whole parent requirement infers coverage of all its assertions. */
    private boolean strictMode;

    private boolean allowCycles;
    private boolean allowOrphans;

    /** Keep a duplicate id under {@code id__conflict} instead of rejecting it. */
    private boolean retainConflicts = true;

    /** How many leading lines of a file are searched for the expected-broken-links marker. */
    private int markerHeaderLines = 20;

    /** Compare a requirement's declared hash against its body and warn on mismatch. */
    private boolean verifyHashes = true;

    /** Requirement and journey id grammar. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class IdGrammar {
        private String prefix = "REQ";
        /** Full requirement id, including prefix. An optional associate segment such as REQ-CAL-d00001 is allowed. */
        private String pattern = "REQ-(?:[A-Z]{2,4}-)?[a-z]\\d{5}";
        private String journeyPrefix = "JNY";
        private String assertionLabelPattern = "[A-Z]|\\d+";
        /** Type letter in the id to level name. */
        private Map<String, String> levelCodes = new LinkedHashMap<>(Map.of("p", "PRD", "o", "OPS", "d", "DEV"));
    }

    private static Map<String, Integer> defaultLevels() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("PRD", 1);
        m.put("OPS", 2);
        m.put("DEV", 3);
        return m;
    }

    private static Map<String, List<String>> defaultAllowedImplements() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("PRD", List.of("PRD"));
        m.put("OPS", List.of("PRD", "OPS"));
        m.put("DEV", List.of("PRD", "OPS", "DEV"));
        return m;
    }

    /** Canonical level name for a raw level or type letter, or the raw value if unknown. */
    public String resolveLevel(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String code = ids.getLevelCodes().get(raw.toLowerCase(Locale.ROOT));
        if (code != null)
            return code;
        for (String level : levels.keySet())
            if (level.equalsIgnoreCase(raw))
                return level;
        return raw;
    }

    public boolean isExcludedStatus(String status) {
        if (status == null)
            return false;
        for (String s : excludedStatuses)
            if (s.equalsIgnoreCase(status))
                return true;
        return false;
    }

    /** Whether a requirement at {@code childLevel} may implement one at {@code parentLevel}. Unknown levels pass. */
    public boolean mayImplement(String childLevel, String parentLevel) {
        if (childLevel == null || parentLevel == null)
            return true;
        List<String> allowed = allowedImplements.get(childLevel);
        if (allowed == null || !levels.containsKey(parentLevel))
            return true;
        return allowed.contains(parentLevel);
    }
}
