package com.spectrace.tg.io;

/**
 * Non-normative text inside a requirement block: the preamble before the first
 * heading, or a named {@code ##} section other than Assertions.
 */
public record SectionRecord(String heading, String content, int line, int endLine) {
}
