package com.spectrace.tg.io;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.spectrace.tg.api.SourceDomain;

/**
 * One source file's text plus its context descriptor.
 *
 * The walker that finds files and reads them lives outside this library; by
 * the time a unit exists its text is fully in memory.
 *
 * @param path   path relative to the repository root, used in node ids and locations
 * @param domain what the file holds
 * @param lines  file content split on line breaks; line {@code n} is {@code lines.get(n - 1)}
 */
public record SourceUnit(String path, SourceDomain domain, List<String> lines) {

    public SourceUnit {
        lines = List.copyOf(lines);
    }

    public static SourceUnit of(String path, SourceDomain domain, String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.endsWith("\n"))
            normalized = normalized.substring(0, normalized.length() - 1);
        List<String> lines = normalized.isEmpty() ? List.of() : Arrays.asList(normalized.split("\n", -1));
        return new SourceUnit(path, domain, lines);
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int number) {
        return lines.get(number - 1);
    }

    /** Extension without the dot, lower case, or empty. */
    public String extension() {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
