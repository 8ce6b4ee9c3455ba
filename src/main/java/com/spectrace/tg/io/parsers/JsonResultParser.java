package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;
import com.spectrace.tg.io.TestResultRecord;

/**
 * Reads pytest-json style result files:
 *
 * <pre>{@code
 * {"tests": [{"nodeid": "tests/test_auth.py::test_login", "outcome": "passed", "duration": 0.01}]}
 * }</pre>
 *
 * The whole document is claimed as one fragment carrying every result.
 */
public final class JsonResultParser implements LineClaimingParser {
    public static final int ORDER = 55;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "json-results";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        if (unclaimed.isEmpty() || !looksLikeJson(context, unclaimed))
            return List.of();
        String json = String.join("\n", unclaimed.stream().map(NumberedLine::text).toList());
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            context.warn(name(), unclaimed.get(0).number(), "Unparseable JSON results: " + e.getOriginalMessage());
            return List.of();
        }
        JsonNode tests = root.path("tests");
        if (!tests.isArray()) {
            context.warn(name(), unclaimed.get(0).number(), "JSON results have no \"tests\" array");
            return List.of();
        }

        List<TestResultRecord> results = new ArrayList<>();
        Map<Integer, Integer> perLine = new HashMap<>();
        for (JsonNode test : tests) {
            String nodeId = test.path("nodeid").asText(test.path("name").asText(""));
            int sep = nodeId.lastIndexOf("::");
            String name = sep >= 0 ? nodeId.substring(sep + 2) : nodeId;
            String classname = sep >= 0 ? nodeId.substring(0, sep) : "";
            int line = lineOf(unclaimed, nodeId);
            int ordinal = perLine.merge(line, 1, Integer::sum) - 1;
            String id = "result:" + context.path() + ":" + line + (ordinal > 0 ? "." + ordinal : "");
            double duration = test.has("duration") ? test.path("duration").asDouble()
                    : test.path("call").path("duration").asDouble(0);
            String message = test.path("call").path("longrepr").asText(null);
            results.add(new TestResultRecord(id, name, classname, outcome(test.path("outcome").asText("")),
                    duration, TestResultRecord.truncate(message), line));
        }
        return List.of(ContentFragment.builder(FragmentType.TEST_RESULT).lines(unclaimed)
                .field(ContentFragment.RESULTS, List.copyOf(results)).build());
    }

    private static String outcome(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "passed", "xpassed" -> "passed";
            case "failed" -> "failed";
            case "error" -> "error";
            default -> "skipped";
        };
    }

    private static int lineOf(List<NumberedLine> lines, String nodeId) {
        String quoted = "\"" + nodeId + "\"";
        for (NumberedLine l : lines)
            if (!nodeId.isEmpty() && l.text().contains(quoted))
                return l.number();
        return lines.get(0).number();
    }

    private static boolean looksLikeJson(ParseContext context, List<NumberedLine> lines) {
        if (context.unit().extension().equals("json"))
            return true;
        for (NumberedLine l : lines)
            if (!l.text().isBlank())
                return l.text().strip().startsWith("{");
        return false;
    }
}
