package com.spectrace.tg.io;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the {@code expected-broken-links N} marker in a file header.
 *
 * The marker may be written in any common comment syntax:
 *
 * <pre>
 * # spectrace: expected-broken-links 2
 * // spectrace: expected-broken-links 2
 * &lt;!-- elspais: expected-broken-links 2 --&gt;
 * </pre>
 */
public final class ExpectedBrokenLinksMarker {
    private static final Pattern MARKER = Pattern.compile(
            "^\\s*(?:#+|//|--|/\\*+|\\*|<!--)\\s*(?:spectrace|elspais)\\s*:\\s*expected-broken-links\\s+(\\d+)",
            Pattern.CASE_INSENSITIVE);

    private static final String NAME = "marker";

    private ExpectedBrokenLinksMarker() {
        // Utility class
    }

    /**
     * @param unit        the source unit
     * @param headerLines how many leading lines to search
     * @return the declared count, or 0 when the header declares none or the
     *         count does not fit an int
     */
    public static int find(SourceUnit unit, int headerLines) {
        return find(unit, headerLines, null);
    }

    /** As {@link #find(SourceUnit, int)}, reporting an out of range count to the context. */
    static int find(SourceUnit unit, int headerLines, ParseContext context) {
        int limit = Math.min(headerLines, unit.lineCount());
        for (int n = 1; n <= limit; n++) {
            Matcher m = MARKER.matcher(unit.line(n));
            if (!m.find())
                continue;
            try {
                return Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                if (context != null)
                    context.warn(NAME, n, "expected-broken-links count " + m.group(1) + " is out of range; ignored");
                return 0;
            }
        }
        return 0;
    }
}
