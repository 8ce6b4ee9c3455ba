package com.spectrace.tg.api;

/** Outcome of resolving one reference. */
public enum Resolution {
    RESOLVED, BROKEN, SUPPRESSED
}
