package com.questrail.gs1.catalog;

import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.DateFormat;
import com.questrail.gs1.api.LengthPolicy;
import com.questrail.gs1.api.SyntaxComponent;
import com.questrail.gs1.observability.CatalogLoadedEvent;
import com.questrail.gs1.observability.CatalogRowRejectedEvent;
import com.questrail.gs1.observability.DecodeObservabilitySink;
import com.questrail.gs1.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AiCatalogLoader
 * -----------------------------------------------------------------------------
 * Builds an {@link AiCatalog} from GS1 syntax-table text.
 *
 * <p>Row format (see {@code gs1/ai-catalog.txt}):</p>
 * <pre>
 *   01     *   N14,csum,gcppos2     ex=255,37 dlpkey    # GTIN
 *   310n   *   N6                   req=01,02           # NET WEIGHT (kg)
 *   91-99      X..90                                    # INTERNAL
 * </pre>
 *
 * <p>Family rows are expanded eagerly: {@code 310n} becomes 3100..3109 with
 * 0..9 implied decimal places, and a range row becomes one definition per
 * code (four-digit codes in a range take their last digit as decimal
 * places).</p>
 *
 * <p>A malformed row never fails the load. It is logged at WARN, reported to
 * the observability sink and skipped.</p>
 */
public final class AiCatalogLoader
{
    public static final String STANDARD_RESOURCE = "gs1/ai-catalog.txt";

    private static final Logger log = LoggerFactory.getLogger(AiCatalogLoader.class);

    private static final Pattern CODE = Pattern.compile("\\d{2,4}");
    private static final Pattern FAMILY = Pattern.compile("(\\d{2,3})n");
    private static final Pattern RANGE = Pattern.compile("(\\d{2,4})-(\\d{2,4})");
    private static final Pattern FLAGS = Pattern.compile("[*?]+");
    private static final Pattern COMPONENT = Pattern.compile("([NXY])(\\.\\.)?(\\d+)((?:,[A-Za-z0-9]+)*)");

    private final DecodeObservabilitySink sink;

    public AiCatalogLoader()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public AiCatalogLoader(DecodeObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Loads the bundled syntax table.
     *
     * @throws IllegalStateException if the resource is missing from the classpath
     * @throws UncheckedIOException  if the resource cannot be read
     */
    public AiCatalog loadStandard()
    {
        InputStream in = AiCatalogLoader.class.getClassLoader().getResourceAsStream(STANDARD_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing classpath resource " + STANDARD_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, STANDARD_RESOURCE);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + STANDARD_RESOURCE, e);
        }
    }

    /**
     * Builds a catalog from syntax-table text.
     */
    public AiCatalog parse(String text, String source)
    {
        try {
            return load(new StringReader(text), source);
        }
        catch (IOException e) {
            // StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    public AiCatalog load(Reader reader, String source) throws IOException
    {
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(source, "source");

        List<ApplicationIdentifier> definitions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int rejected = 0;
        int lineNumber = 0;

        BufferedReader in = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                List<ApplicationIdentifier> row = parseRow(trimmed);
                for (ApplicationIdentifier d : row) {
                    if (!seen.add(d.code())) {
                        throw new CatalogFormatException("Duplicate AI " + d.code());
                    }
                }
                definitions.addAll(row);
            }
            catch (CatalogFormatException e) {
                rejected++;
                log.warn("Skipping catalog row {}:{}: {}", source, lineNumber, e.getMessage());
                sink.onCatalogRowRejected(new CatalogRowRejectedEvent(
                        Instant.now(), source, lineNumber, trimmed, e.getMessage()));
            }
        }

        AiCatalog catalog = AiCatalog.of(source, definitions);
        log.info("Loaded GS1 catalog {} ({} definitions, {} rows skipped)", source, catalog.size(), rejected);
        sink.onCatalogLoaded(new CatalogLoadedEvent(Instant.now(), source, catalog.size(), rejected));
        return catalog;
    }

    /**
     * Parses one non-comment row into the definitions it expands to.
     */
    static List<ApplicationIdentifier> parseRow(String line) throws CatalogFormatException
    {
        int hash = line.indexOf('#');
        if (hash < 0) {
            throw new CatalogFormatException("Missing '# title'");
        }
        String title = line.substring(hash + 1).strip();
        if (title.isEmpty()) {
            throw new CatalogFormatException("Empty title");
        }
        String[] tokens = line.substring(0, hash).strip().split("\\s+");
        if (tokens.length < 2) {
            throw new CatalogFormatException("Missing syntax specification");
        }

        int idx = 1;
        boolean fixed = false;
        if (FLAGS.matcher(tokens[idx]).matches()) {
            fixed = tokens[idx].indexOf('*') >= 0;
            idx++;
        }

        List<SyntaxComponent> components = new ArrayList<>();
        while (idx < tokens.length) {
            Matcher m = COMPONENT.matcher(tokens[idx]);
            if (!m.matches()) {
                break;
            }
            components.add(toComponent(m));
            idx++;
        }
        if (components.isEmpty()) {
            throw new CatalogFormatException("Missing syntax specification");
        }

        List<String> requiredWith = List.of();
        List<String> exclusiveWith = List.of();
        boolean digitalLinkKey = false;
        for (; idx < tokens.length; idx++) {
            String attr = tokens[idx];
            if (attr.startsWith("req=")) {
                requiredWith = splitList(attr.substring(4));
            }
            else if (attr.startsWith("ex=")) {
                exclusiveWith = splitList(attr.substring(3));
            }
            else if (attr.equals("dlpkey") || attr.startsWith("dlpkey=")) {
                digitalLinkKey = true;
            }
            else {
                throw new CatalogFormatException("Unknown attribute '" + attr + "'");
            }
        }

        int min = 0;
        int max = 0;
        boolean anyX = false;
        boolean anyY = false;
        boolean checkDigit = false;
        DateFormat dateFormat = null;
        for (SyntaxComponent c : components) {
            min += c.min();
            max += c.max();
            anyX |= c.type() == DataType.ALPHANUMERIC;
            anyY |= c.type() == DataType.RESTRICTED_ALPHANUMERIC;
            checkDigit |= c.hasLinter("csum");
            if (dateFormat == null) {
                for (String linter : c.linters()) {
                    Optional<DateFormat> df = DateFormat.fromLinter(linter);
                    if (df.isPresent()) {
                        if (c.min() < df.get().digits()) {
                            throw new CatalogFormatException("Date component shorter than " + df.get());
                        }
                        dateFormat = df.get();
                        break;
                    }
                }
            }
        }
        if (fixed && min != max) {
            throw new CatalogFormatException("Fixed-length flag on a variable specification");
        }
        DataType dataType = anyX ? DataType.ALPHANUMERIC
                : anyY ? DataType.RESTRICTED_ALPHANUMERIC
                : DataType.NUMERIC;
        LengthPolicy policy = fixed ? LengthPolicy.fixed(max) : LengthPolicy.variable(min, max);

        List<ApplicationIdentifier> out = new ArrayList<>();
        for (CodeAndDecimals code : expandCodes(tokens[0])) {
            out.add(ApplicationIdentifier.builder(code.code)
                    .title(title)
                    .dataType(dataType)
                    .lengthPolicy(policy)
                    .checkDigit(checkDigit)
                    .dateFormat(dateFormat)
                    .decimalPositions(code.decimals)
                    .requiredWith(requiredWith)
                    .exclusiveWith(exclusiveWith)
                    .components(components)
                    .digitalLinkKey(digitalLinkKey)
                    .build());
        }
        return out;
    }

    private record CodeAndDecimals(String code, Integer decimals) {}

    private static List<CodeAndDecimals> expandCodes(String spec) throws CatalogFormatException
    {
        List<CodeAndDecimals> codes = new ArrayList<>();
        Matcher family = FAMILY.matcher(spec);
        Matcher range = RANGE.matcher(spec);
        if (CODE.matcher(spec).matches()) {
            codes.add(new CodeAndDecimals(spec, null));
        }
        else if (family.matches()) {
            for (int n = 0; n < 10; n++) {
                codes.add(new CodeAndDecimals(family.group(1) + n, n));
            }
        }
        else if (range.matches()) {
            String first = range.group(1);
            String last = range.group(2);
            if (first.length() != last.length() || first.compareTo(last) > 0) {
                throw new CatalogFormatException("Bad AI range " + spec);
            }
            int width = first.length();
            for (int i = Integer.parseInt(first); i <= Integer.parseInt(last); i++) {
                String code = String.format("%0" + width + "d", i);
                codes.add(new CodeAndDecimals(code, width == 4 ? i % 10 : null));
            }
        }
        else {
            throw new CatalogFormatException("Bad AI code '" + spec + "'");
        }
        return codes;
    }

    private static SyntaxComponent toComponent(Matcher m) throws CatalogFormatException
    {
        DataType type = DataType.fromTag(m.group(1).charAt(0));
        boolean variable = m.group(2) != null;
        int length;
        try {
            length = Integer.parseInt(m.group(3));
        }
        catch (NumberFormatException e) {
            throw new CatalogFormatException("Bad component length " + m.group(), e);
        }
        if (length == 0) {
            throw new CatalogFormatException("Zero-length component " + m.group());
        }
        String linterText = m.group(4);
        List<String> linters = linterText.isEmpty()
                ? List.of()
                : Arrays.asList(linterText.substring(1).split(","));
        return new SyntaxComponent(type, variable ? 1 : length, length, linters);
    }

    private static List<String> splitList(String value)
    {
        List<String> out = new ArrayList<>();
        for (String s : value.split(",")) {
            if (!s.isBlank()) {
                out.add(s.strip());
            }
        }
        return out;
    }
}
