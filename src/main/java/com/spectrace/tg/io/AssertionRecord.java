package com.spectrace.tg.io;

/** One labelled assertion inside a requirement block. */
public record AssertionRecord(String label, String text, int line) {
}
