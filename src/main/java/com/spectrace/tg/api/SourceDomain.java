package com.spectrace.tg.api;

/** What a source unit holds; selects the parser set run over it. */
public enum SourceDomain {
    SPEC, CODE, TEST, RESULT
}
