package com.spectrace.tg.io;

/** A line of source text with its 1-based line number. */
public record NumberedLine(int number, String text) {
}
