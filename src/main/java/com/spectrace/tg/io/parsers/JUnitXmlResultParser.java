package com.spectrace.tg.io.parsers;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import com.ctc.wstx.stax.WstxInputFactory;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;
import com.spectrace.tg.io.TestResultRecord;

import lombok.extern.log4j.Log4j2;

/**
 * Streams JUnit XML result files with Woodstox.
 *
 * Each {@code <testcase>} becomes a {@link TestResultRecord} claimed at the
 * element's lines. Test cases written on shared lines are grouped into one
 * fragment. Malformed XML yields a parse warning and no results.
 *
 * Thread-safe, using one {@link XMLInputFactory2} per thread.
 */
@Log4j2
public final class JUnitXmlResultParser implements LineClaimingParser {
    public static final int ORDER = 50;

    private static final ThreadLocal<XMLInputFactory2> FACTORY = ThreadLocal.withInitial(() -> {
        XMLInputFactory2 f = new WstxInputFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        f.setXMLResolver((publicId, systemId, baseURI, ns) -> null);
        return f;
    });

    private record Span(TestResultRecord result, int start, int end) {
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "junit-xml";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        if (unclaimed.isEmpty() || !looksLikeXml(context, unclaimed))
            return List.of();
        List<Span> spans;
        try {
            spans = read(text(unclaimed), context.path());
        } catch (XMLStreamException e) {
            context.warn(name(), e.getLocation() != null ? Math.max(1, e.getLocation().getLineNumber()) : 1,
                    "Unparseable JUnit XML: " + e.getMessage());
            return List.of();
        }
        log.debug("Read {} test cases from {}", spans.size(), context.path());

        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < spans.size()) {
            int start = spans.get(i).start();
            int end = spans.get(i).end();
            List<TestResultRecord> group = new ArrayList<>();
            group.add(spans.get(i).result());
            int j = i + 1;
            while (j < spans.size() && spans.get(j).start() <= end) {
                end = Math.max(end, spans.get(j).end());
                group.add(spans.get(j).result());
                j++;
            }
            final int from = start;
            final int to = end;
            List<NumberedLine> lines = unclaimed.stream().filter(l -> l.number() >= from && l.number() <= to).toList();
            if (!lines.isEmpty())
                out.add(ContentFragment.builder(FragmentType.TEST_RESULT).lines(lines)
                        .field(ContentFragment.RESULTS, List.copyOf(group)).build());
            i = j;
        }
        return out;
    }

    private static boolean looksLikeXml(ParseContext context, List<NumberedLine> lines) {
        if (context.unit().extension().equals("xml"))
            return true;
        for (NumberedLine l : lines)
            if (!l.text().isBlank())
                return l.text().strip().startsWith("<");
        return false;
    }

    /** Rebuilds the text with blank lines in any gaps so parser line numbers match the file. */
    private static String text(List<NumberedLine> lines) {
        StringBuilder sb = new StringBuilder();
        int expected = 1;
        for (NumberedLine l : lines) {
            for (; expected < l.number(); expected++)
                sb.append('\n');
            sb.append(l.text()).append('\n');
            expected = l.number() + 1;
        }
        return sb.toString();
    }

    private static List<Span> read(String xml, String path) throws XMLStreamException {
        List<Span> spans = new ArrayList<>();
        Map<Integer, Integer> perLine = new HashMap<>();
        XMLStreamReader2 r = (XMLStreamReader2) FACTORY.get().createXMLStreamReader(new StringReader(xml));
        try {
            boolean inCase = false;
            String name = null;
            String classname = null;
            double duration = 0;
            String status = null;
            String message = null;
            int start = 0;
            while (r.hasNext()) {
                int event = r.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    String local = r.getLocalName();
                    if (local.equals("testcase")) {
                        start = r.getLocation().getLineNumber();
                        inCase = true;
                        name = attr(r, "name");
                        classname = attr(r, "classname");
                        duration = parseDuration(attr(r, "time"));
                        status = "passed";
                        message = null;
                    } else if (inCase && (local.equals("failure") || local.equals("error")
                            || local.equals("skipped"))) {
                        status = switch (local) {
                            case "failure" -> "failed";
                            case "error" -> "error";
                            default -> "skipped";
                        };
                        message = attr(r, "message");
                        if (message == null || message.isEmpty())
                            message = r.getElementText();
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && r.getLocalName().equals("testcase")) {
                    int end = r.getLocation().getLineNumber();
                    int ordinal = perLine.merge(start, 1, Integer::sum) - 1;
                    String id = "result:" + path + ":" + start + (ordinal > 0 ? "." + ordinal : "");
                    spans.add(new Span(new TestResultRecord(id, name == null ? "" : name,
                            classname == null ? "" : classname, status, duration, TestResultRecord.truncate(message),
                            start), start, Math.max(start, end)));
                    inCase = false;
                }
            }
        } finally {
            r.close();
        }
        return spans;
    }

    private static String attr(XMLStreamReader2 r, String name) {
        return r.getAttributeValue(null, name);
    }

    private static double parseDuration(String raw) {
        if (raw == null || raw.isBlank())
            return 0;
        try {
            return Double.parseDouble(raw.strip().replace(",", ""));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
