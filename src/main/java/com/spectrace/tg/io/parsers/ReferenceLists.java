package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.SourceLocation;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.PendingLink;

/** Splitting of comma-separated reference lists shared by the reference parsers. */
final class ReferenceLists {
    private static final Set<String> NO_REFERENCE = Set.of("-", "null", "none", "x", "n/a");

    private ReferenceLists() {
        // Utility class
    }

    /** References in a list such as {@code REQ-p00001, p00002-A}; placeholders like "-" yield nothing. */
    static List<String> split(String value) {
        List<String> refs = new ArrayList<>();
        if (value == null)
            return refs;
        for (String part : value.split("[,;]")) {
            String ref = part.strip();
            if (ref.endsWith("."))
                ref = ref.substring(0, ref.length() - 1);
            if (!ref.isEmpty() && !NO_REFERENCE.contains(ref.toLowerCase(Locale.ROOT)))
                refs.add(ref);
        }
        return refs;
    }

    /** Adds one pending link per reference in {@code value}. */
    static void addLinks(ContentFragment.Builder fragment, String sourceId, String value, EdgeKind kind,
            IdPatterns ids, SourceLocation location) {
        for (String ref : split(value))
            fragment.link(PendingLink.parse(sourceId, ref, kind, ids, location));
    }
}
