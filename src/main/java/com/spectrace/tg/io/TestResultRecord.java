package com.spectrace.tg.io;

/**
 * One test outcome read from a result file.
 *
 * @param id        node id, unique within the result file
 * @param name      test name as reported
 * @param classname suite or class, may be empty
 * @param status    passed, failed, error or skipped
 * @param duration  seconds, 0 when not reported
 * @param message   failure or skip message, at most {@value #MAX_MESSAGE} characters, or null
 * @param line      line of the result in the file
 */
public record TestResultRecord(String id, String name, String classname, String status, double duration,
        String message, int line) {
    public static final int MAX_MESSAGE = 200;

    public static String truncate(String message) {
        if (message == null)
            return null;
        String m = message.strip();
        return m.length() <= MAX_MESSAGE ? m : m.substring(0, MAX_MESSAGE);
    }

    public boolean isFailure() {
        return "failed".equals(status) || "error".equals(status);
    }
}
