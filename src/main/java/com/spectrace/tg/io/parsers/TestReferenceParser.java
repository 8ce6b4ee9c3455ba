package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;
import com.spectrace.tg.io.PendingLink;

/**
 * Finds tests that reference requirements.
 *
 * A test is recognised from reference comments ({@code # Validates: REQ-d00001},
 * {@code // Tests REQ-p00001}) optionally followed within three lines by the
 * test declaration, or from a declaration whose name embeds requirement ids
 * ({@code def test_login_REQ_p00001_A}). The comment and the declaration are
 * claimed together even when lines in between (annotations, decorators) are
 * not.
 */
public final class TestReferenceParser implements LineClaimingParser {
    public static final int ORDER = 80;
    static final int DECLARATION_WINDOW = 3;

    private static final Pattern KEYWORD = Pattern.compile(
            "^\\s*(?:#+|//+|--|/\\*+|\\*)\\s*(?<kw>Validates|Verifies|Implements|Refines|Addresses)\\s*:\\s*(?<refs>.+?)\\s*(?:\\*/)?\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TESTS = Pattern.compile(
            "^\\s*(?:#+|//+|/\\*+|\\*)\\s*Tests?\\s*:?\\s+(?<refs>.+?)\\s*(?:\\*/)?\\s*$");
    private static final List<Pattern> DECLARATIONS = List.of(
            Pattern.compile("^\\s*(?:(?:public|private|protected|internal|static|final|async|suspend|override)\\s+)*"
                    + "(?:def|fun|func|function)\\s+(?<fn>\\w+)"),
            Pattern.compile("^\\s*(?:(?:public|private|protected|static|final)\\s+)*void\\s+(?<fn>\\w+)\\s*\\("),
            Pattern.compile("^\\s*(?:it|test)\\s*\\(\\s*['\"`](?<fn>[^'\"`]+)['\"`]"));

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "test-references";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        IdPatterns ids = context.ids();
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            NumberedLine line = unclaimed.get(i);
            if (isReference(line.text(), ids)) {
                int j = i + 1;
                while (j < unclaimed.size() && unclaimed.get(j).number() == unclaimed.get(j - 1).number() + 1
                        && isReference(unclaimed.get(j).text(), ids))
                    j++;
                List<NumberedLine> run = unclaimed.subList(i, j);
                int lastRef = run.get(run.size() - 1).number();

                int decl = -1;
                String function = null;
                for (int k = j; k < unclaimed.size() && unclaimed.get(k).number() - lastRef <= DECLARATION_WINDOW; k++) {
                    if (isReference(unclaimed.get(k).text(), ids))
                        break;
                    function = declaredFunction(unclaimed.get(k).text());
                    if (function != null) {
                        decl = k;
                        break;
                    }
                }
                List<NumberedLine> claimed = new ArrayList<>(run);
                if (decl >= 0)
                    claimed.add(unclaimed.get(decl));
                out.add(fragment(claimed, function, run, context));
                i = decl >= 0 ? decl + 1 : j;
                continue;
            }
            String function = declaredFunction(line.text());
            if (function != null && !ids.referencesInName(function).isEmpty())
                out.add(fragment(List.of(line), function, List.of(), context));
            i++;
        }
        return out;
    }

    private ContentFragment fragment(List<NumberedLine> claimed, String function, List<NumberedLine> references,
            ParseContext context) {
        IdPatterns ids = context.ids();
        String id = function != null ? "test:" + context.path() + "::" + function
                : "test:" + context.path() + ":" + claimed.get(0).number();
        ContentFragment.Builder fragment = ContentFragment.builder(FragmentType.TEST_REF).lines(claimed)
                .field("id", id).field("function", function);

        for (NumberedLine ref : references) {
            Matcher k = KEYWORD.matcher(ref.text());
            if (k.matches()) {
                String kw = k.group("kw");
                EdgeKind kind = kw.equalsIgnoreCase("Verifies") ? EdgeKind.VALIDATES : EdgeKind.fromKeyword(kw);
                ReferenceLists.addLinks(fragment, id, k.group("refs"), kind, ids, context.location(ref.number()));
                continue;
            }
            Matcher t = TESTS.matcher(ref.text());
            if (t.matches())
                for (String token : t.group("refs").split("[,\\s]+"))
                    if (ids.mentionsRequirement(token))
                        fragment.link(PendingLink.parse(id, token, EdgeKind.VALIDATES, ids,
                                context.location(ref.number())));
        }
        if (function != null) {
            int declLine = claimed.get(claimed.size() - 1).number();
            for (String ref : ids.referencesInName(function))
                fragment.link(PendingLink.parse(id, ref, EdgeKind.VALIDATES, ids, context.location(declLine)));
        }
        return fragment.field("text", String.join("\n", claimed.stream().map(NumberedLine::text).toList())).build();
    }

    private static boolean isReference(String text, IdPatterns ids) {
        if (KEYWORD.matcher(text).matches())
            return true;
        Matcher t = TESTS.matcher(text);
        return t.matches() && ids.mentionsRequirement(t.group("refs"));
    }

    /** Name of the test declared on this line, or null. */
    static String declaredFunction(String text) {
        for (Pattern p : DECLARATIONS) {
            Matcher m = p.matcher(text);
            if (m.find())
                return m.group("fn");
        }
        return null;
    }
}
