package com.spectrace.tg.api;

public enum DiagnosticKind {
    DUPLICATE_ID,
    BROKEN_REFERENCE,
    SUPPRESSED_REFERENCE,
    CYCLE,
    ORPHAN,
    INVALID_RELATIONSHIP_KIND,
    PARSE_WARNING,
    PARSE_FAILURE,
    UNLINKED_TEST_RESULT
}
