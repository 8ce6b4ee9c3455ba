package com.spectrace.tg.io.parsers;

import java.util.List;

import com.spectrace.tg.TraceFixtures;
import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.ParsedUnit;
import com.spectrace.tg.io.TestResultRecord;

import org.junit.Test;

import static org.junit.Assert.*;

public class JUnitXmlResultParserTest {

    @Test
    public void testResultFile() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.resource("results/junit.xml", SourceDomain.RESULT));

        List<ContentFragment> fragments = parsed.fragmentsOfType(FragmentType.TEST_RESULT);
        assertEquals(3, fragments.size());
        assertTrue(parsed.warnings().isEmpty());

        TestResultRecord passed = fragments.get(0).results().get(0);
        assertEquals("test_password_check", passed.name());
        assertEquals("tests.test_auth", passed.classname());
        assertEquals("passed", passed.status());
        assertEquals(0.012, passed.duration(), 1e-9);
        assertEquals("result:results/junit.xml:3", passed.id());
        assertNull(passed.message());

        TestResultRecord failed = fragments.get(1).results().get(0);
        assertEquals("failed", failed.status());
        assertEquals("account not locked", failed.message());
        assertTrue(failed.isFailure());
        assertEquals(List.of(4, 5, 6), fragments.get(1).lines());

        TestResultRecord skipped = fragments.get(2).results().get(0);
        assertEquals("skipped", skipped.status());
        assertEquals("audit store not ready", skipped.message());

        // Declaration, suite tags and closing tag are left over
        assertEquals(2, parsed.fragmentsOfType(FragmentType.REMAINDER).size());
    }

    @Test
    public void testCompactFileGroupsSharedLines() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.results("out/report.xml",
                "<testsuite><testcase classname=\"a.B\" name=\"t1\"/>"
                        + "<testcase classname=\"a.B\" name=\"t2\"><error>Boom</error></testcase></testsuite>"));

        List<ContentFragment> fragments = parsed.fragmentsOfType(FragmentType.TEST_RESULT);
        assertEquals(1, fragments.size());
        List<TestResultRecord> results = fragments.get(0).results();
        assertEquals(2, results.size());
        assertEquals("result:out/report.xml:1", results.get(0).id());
        assertEquals("result:out/report.xml:1.1", results.get(1).id());
        assertEquals("error", results.get(1).status());
        assertEquals("Boom", results.get(1).message());
    }

    @Test
    public void testMalformedXmlWarns() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.results("out/broken.xml",
                "<testsuite>",
                "<testcase name=\"t1\">"));
        assertFalse(parsed.isFailed());
        assertTrue(parsed.fragmentsOfType(FragmentType.TEST_RESULT).isEmpty());
        assertEquals(1, parsed.warnings().size());
        assertTrue(parsed.warnings().get(0).message().startsWith("Unparseable JUnit XML"));
    }

    @Test
    public void testLongMessageTruncated() {
        String longMessage = "x".repeat(500);
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.results("r.xml",
                "<testsuite>",
                "<testcase name=\"t\"><failure message=\"" + longMessage + "\"/></testcase>",
                "</testsuite>"));
        TestResultRecord r = parsed.fragmentsOfType(FragmentType.TEST_RESULT).get(0).results().get(0);
        assertEquals(TestResultRecord.MAX_MESSAGE, r.message().length());
        assertEquals("", r.classname());
    }

    @Test
    public void testUnnamedCaseKeepsOutcome() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.results("out/anon.xml",
                "<testsuite>",
                "<testcase classname=\"tests.test_x\"><failure message=\"bad\"/></testcase>",
                "<testcase classname=\"tests.test_x\"><skipped/></testcase>",
                "</testsuite>"));

        List<ContentFragment> fragments = parsed.fragmentsOfType(FragmentType.TEST_RESULT);
        assertEquals(2, fragments.size());
        TestResultRecord failed = fragments.get(0).results().get(0);
        assertEquals("", failed.name());
        assertEquals("failed", failed.status());
        assertEquals("bad", failed.message());
        assertEquals("skipped", fragments.get(1).results().get(0).status());
    }
}
