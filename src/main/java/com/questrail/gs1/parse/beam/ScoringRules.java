package com.questrail.gs1.parse.beam;

import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.config.ScoringWeights;
import com.questrail.gs1.parse.Candidate;
import com.questrail.gs1.validate.DateDecoder;
import com.questrail.gs1.validate.MetaKeys;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ScoringRules
 * -----------------------------------------------------------------------------
 * The ordered scoring table of the no-separator beam parser.
 *
 * <p>Rules run in table order after every extension. Each fires at most once
 * and contributes one reasoning line. A rule yielding negative infinity
 * eliminates the candidate and stops evaluation.</p>
 *
 * <table>
 *   <caption>Default table</caption>
 *   <tr><th>Tag</th><th>Fires when</th><th>Delta</th></tr>
 *   <tr><td>gtin-check-digit</td><td>(01) added</td><td>+1000, or -inf if invalid</td></tr>
 *   <tr><td>expiry-date</td><td>valid (17) added</td><td>+250, +190 for day 00</td></tr>
 *   <tr><td>tail-order</td><td>last three are (17)(10)(21) or (21)(17)(10)</td><td>+120</td></tr>
 *   <tr><td>embedded-expiry</td><td>(21) holds 17 + YYMMDD + 10</td><td>+90</td></tr>
 *   <tr><td>standard-start</td><td>sequence is exactly (01)(17)</td><td>+15</td></tr>
 *   <tr><td>full-order</td><td>last four are (01)(17)(10)(21) or (01)(21)(17)(10)</td><td>+30</td></tr>
 *   <tr><td>batch-length</td><td>(10) length 2..10</td><td>+20</td></tr>
 *   <tr><td>serial-length</td><td>(21) length 6..20</td><td>+15</td></tr>
 *   <tr><td>internal-absorbable</td><td>internal AI the preceding (10)/(21) could absorb</td><td>-200</td></tr>
 *   <tr><td>repeated-batch</td><td>second (10)</td><td>-150</td></tr>
 *   <tr><td>repeated-serial</td><td>second (21)</td><td>-120</td></tr>
 *   <tr><td>internal-with-batch-and-serial</td><td>internal AI while (10) and (21) present</td><td>-80</td></tr>
 *   <tr><td>long-batch</td><td>(10) longer than 12</td><td>-50</td></tr>
 *   <tr><td>short-serial</td><td>(21) shorter than 4</td><td>-50</td></tr>
 *   <tr><td>compact-completion</td><td>input consumed with at most 4 elements</td><td>+10</td></tr>
 * </table>
 */
public final class ScoringRules
{
    public static final String GTIN = "01";
    public static final String EXPIRY = "17";
    public static final String BATCH = "10";
    public static final String SERIAL = "21";

    private static final Pattern EMBEDDED_EXPIRY = Pattern.compile("17(\\d{6})10");

    private final List<ScoringRule> rules;

    private ScoringRules(List<ScoringRule> rules)
    {
        this.rules = List.copyOf(rules);
    }

    public static ScoringRules of(List<ScoringRule> rules)
    {
        return new ScoringRules(rules);
    }

    /**
     * Builds the default table with {@code w} as its deltas.
     */
    public static ScoringRules standard(ScoringWeights w)
    {
        Objects.requireNonNull(w, "weights");
        List<ScoringRule> table = new ArrayList<>();

        table.add(rule("gtin-check-digit", ctx -> {
            ParsedElement e = ctx.added();
            if (!e.ai().equals(GTIN)) {
                return Optional.empty();
            }
            if (e.valid() && Boolean.TRUE.equals(e.metadata().get(MetaKeys.CHECK_DIGIT_VALID))) {
                return adjust("gtin-check-digit", w.validGtin(), "Valid GTIN with correct check digit");
            }
            return adjust("gtin-check-digit", Double.NEGATIVE_INFINITY, "Invalid GTIN check digit");
        }));

        table.add(rule("expiry-date", ctx -> {
            ParsedElement e = ctx.added();
            if (!e.ai().equals(EXPIRY) || !e.valid()) {
                return Optional.empty();
            }
            if (e.isDayUnspecified()) {
                return adjust("expiry-date", w.expiryDayUnspecified(), "Valid expiry date but day 00 (unknown day)");
            }
            return adjust("expiry-date", w.validExpiry(), "Valid expiry date");
        }));

        table.add(rule("tail-order", ctx -> {
            List<String> last = ctx.lastCodes(3);
            if (last.equals(List.of(EXPIRY, BATCH, SERIAL))) {
                return adjust("tail-order", w.tailOrder(), "Pattern (17)->(10)->(21) detected");
            }
            if (last.equals(List.of(SERIAL, EXPIRY, BATCH))) {
                return adjust("tail-order", w.tailOrder(), "Pattern (21)->(17)->(10) detected");
            }
            return Optional.empty();
        }));

        table.add(rule("embedded-expiry", ctx -> {
            ParsedElement e = ctx.added();
            if (!e.ai().equals(SERIAL)) {
                return Optional.empty();
            }
            Matcher m = EMBEDDED_EXPIRY.matcher(e.raw());
            if (m.find() && DateDecoder.isStrictDate(m.group(1), ctx.centuryPivot())) {
                return adjust("embedded-expiry", w.serialEmbeddedDate(),
                        "Embedded (17) detected inside (21); splitting should be considered");
            }
            return Optional.empty();
        }));

        table.add(rule("standard-start", ctx -> {
            if (ctx.candidate().aiOrder().equals(List.of(GTIN, EXPIRY))) {
                return adjust("standard-start", w.standardStart(), "Standard start (01)->(17)");
            }
            return Optional.empty();
        }));

        table.add(rule("full-order", ctx -> {
            List<String> last = ctx.lastCodes(4);
            if (last.equals(List.of(GTIN, EXPIRY, BATCH, SERIAL))) {
                return adjust("full-order", w.fullOrder(), "Standard order (01)(17)(10)(21)");
            }
            if (last.equals(List.of(GTIN, SERIAL, EXPIRY, BATCH))) {
                return adjust("full-order", w.fullOrder(), "Alternative order (01)(21)(17)(10)");
            }
            return Optional.empty();
        }));

        table.add(rule("batch-length", ctx -> {
            ParsedElement e = ctx.added();
            int len = e.raw().length();
            if (e.ai().equals(BATCH) && len >= 2 && len <= 10) {
                return adjust("batch-length", w.batchLength(), "Lot length " + len + " in common range [2-10]");
            }
            return Optional.empty();
        }));

        table.add(rule("serial-length", ctx -> {
            ParsedElement e = ctx.added();
            int len = e.raw().length();
            if (e.ai().equals(SERIAL) && len >= 6 && len <= 20) {
                return adjust("serial-length", w.serialLength(), "Serial length " + len + " in common range [6-20]");
            }
            return Optional.empty();
        }));

        table.add(rule("internal-absorbable", ctx -> {
            ParsedElement e = ctx.added();
            List<ParsedElement> elements = ctx.elements();
            if (!isPenalizedInternal(e.ai(), ctx) || elements.size() < 2) {
                return Optional.empty();
            }
            ParsedElement prev = elements.get(elements.size() - 2);
            if (!prev.ai().equals(BATCH) && !prev.ai().equals(SERIAL)) {
                return Optional.empty();
            }
            int combined = prev.raw().length() + e.ai().length() + e.raw().length();
            if (combined <= ctx.maxLengthOf().applyAsInt(prev.ai())) {
                return adjust("internal-absorbable", w.internalAbsorbable(),
                        "Using internal AI(" + e.ai() + ") when AI(" + prev.ai() + ") could absorb it");
            }
            return Optional.empty();
        }));

        table.add(rule("repeated-batch", ctx -> {
            if (ctx.added().ai().equals(BATCH) && ctx.candidate().count(BATCH) > 1) {
                return adjust("repeated-batch", w.repeatedBatch(), "Repeated AI(10)");
            }
            return Optional.empty();
        }));

        table.add(rule("repeated-serial", ctx -> {
            if (ctx.added().ai().equals(SERIAL) && ctx.candidate().count(SERIAL) > 1) {
                return adjust("repeated-serial", w.repeatedSerial(), "Repeated AI(21)");
            }
            return Optional.empty();
        }));

        table.add(rule("internal-with-batch-and-serial", ctx -> {
            Candidate c = ctx.candidate();
            String ai = ctx.added().ai();
            if (isPenalizedInternal(ai, ctx) && c.contains(BATCH) && c.contains(SERIAL)) {
                return adjust("internal-with-batch-and-serial", w.internalWithBatchAndSerial(),
                        "Using internal AI(" + ai + ") when both (10) and (21) are present");
            }
            return Optional.empty();
        }));

        table.add(rule("long-batch", ctx -> {
            ParsedElement e = ctx.added();
            if (e.ai().equals(BATCH) && e.raw().length() > 12) {
                return adjust("long-batch", w.longBatch(), "Long lot length " + e.raw().length() + " > 12");
            }
            return Optional.empty();
        }));

        table.add(rule("short-serial", ctx -> {
            ParsedElement e = ctx.added();
            if (e.ai().equals(SERIAL) && e.raw().length() < 4) {
                return adjust("short-serial", w.shortSerial(), "Short serial length " + e.raw().length() + " < 4");
            }
            return Optional.empty();
        }));

        table.add(rule("compact-completion", ctx -> {
            int count = ctx.elements().size();
            if (ctx.complete() && count <= 4) {
                return adjust("compact-completion", w.compactCompletion(), "Concise parse with " + count + " elements");
            }
            return Optional.empty();
        }));

        return new ScoringRules(table);
    }

    public List<ScoringRule> rules()
    {
        return rules;
    }

    /**
     * Applies every rule to {@code context.candidate()} in table order and
     * returns the re-scored candidate.
     */
    public Candidate score(ScoringContext context)
    {
        Candidate scored = context.candidate();
        for (ScoringRule rule : rules) {
            Optional<ScoreAdjustment> adjustment = rule.evaluate(context);
            if (adjustment.isEmpty()) {
                continue;
            }
            ScoreAdjustment a = adjustment.get();
            scored = scored.adjust(a.delta(), signed(a.delta()) + ": " + a.reason());
            if (a.eliminates()) {
                break;
            }
        }
        return scored;
    }

    /**
     * Returns true for AIs 90-99 that are not whitelisted.
     */
    static boolean isPenalizedInternal(String ai, ScoringContext ctx)
    {
        return ai.length() == 2 && ai.charAt(0) == '9' && !ctx.internalWhitelist().contains(ai);
    }

    static String signed(double delta)
    {
        if (Double.isInfinite(delta)) {
            return delta > 0 ? "+inf" : "-inf";
        }
        if (delta == Math.rint(delta)) {
            return String.format("%+d", (long) delta);
        }
        return String.format("%+.2f", delta);
    }

    private static Optional<ScoreAdjustment> adjust(String tag, double delta, String reason)
    {
        return Optional.of(new ScoreAdjustment(tag, delta, reason));
    }

    private static ScoringRule rule(String tag, Function<ScoringContext, Optional<ScoreAdjustment>> body)
    {
        return new ScoringRule()
        {
            @Override
            public String tag()
            {
                return tag;
            }

            @Override
            public Optional<ScoreAdjustment> evaluate(ScoringContext context)
            {
                return body.apply(context);
            }

            @Override
            public String toString()
            {
                return "ScoringRule[" + tag + "]";
            }
        };
    }
}
