package com.questrail.gs1.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.gs1.api.Alternative;
import com.questrail.gs1.api.Diagnostic;
import com.questrail.gs1.api.ParseResult;
import com.questrail.gs1.api.ParsedElement;
import com.questrail.gs1.validate.MetaKeys;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of {@link ParseResult}s.
 *
 * <p>Two shapes are produced:</p>
 * <ul>
 *   <li>{@link #toTree(ParseResult)}: the full result, elements with
 *       metadata, diagnostics and alternatives</li>
 *   <li>{@link #compact(ParseResult, boolean, boolean)}: one property per
 *       element keyed by a human field name ("GTIN Code", "Expiry Date", ...),
 *       dates as dd/mm/yyyy</li>
 * </ul>
 */
public final class ParseResultJson
{
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final Map<String, String> FIELD_NAMES = Map.ofEntries(
            Map.entry("00", "SSCC"),
            Map.entry("01", "GTIN Code"),
            Map.entry("10", "Batch/Lot Number"),
            Map.entry("11", "Production Date"),
            Map.entry("13", "Packaging Date"),
            Map.entry("15", "Best Before Date"),
            Map.entry("16", "Sell By Date"),
            Map.entry("17", "Expiry Date"),
            Map.entry("20", "Variant"),
            Map.entry("21", "Serial Number"),
            Map.entry("22", "Consumer Product Variant"),
            Map.entry("235", "Third Party Controlled"),
            Map.entry("240", "Additional Product Identification"),
            Map.entry("241", "Customer Part Number"),
            Map.entry("242", "Made-to-Order Variation Number"),
            Map.entry("243", "Packaging Component Number"),
            Map.entry("250", "Secondary Serial Number"),
            Map.entry("251", "Reference to Source Entity"),
            Map.entry("253", "Global Document Type Identifier"),
            Map.entry("254", "GLN Extension Component"),
            Map.entry("255", "Global Coupon Number"),
            Map.entry("30", "Variable Count"),
            Map.entry("37", "Count of Trade Items"),
            Map.entry("90", "Internal Company Code 1"),
            Map.entry("91", "Internal Company Code 2"),
            Map.entry("92", "Internal Company Code 3"),
            Map.entry("93", "Internal Company Code 4"),
            Map.entry("94", "Internal Company Code 5"),
            Map.entry("95", "Internal Company Code 6"),
            Map.entry("96", "Internal Company Code 7"),
            Map.entry("97", "Internal Company Code 8"),
            Map.entry("98", "Internal Company Code 9"),
            Map.entry("99", "Internal Company Code 10"));

    private ParseResultJson() {
    }

    public static String toJson(ParseResult result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toTree(result));
    }

    public static String toPrettyJson(ParseResult result) throws JsonProcessingException {
        return PRETTY.writeValueAsString(toTree(result));
    }

    public static String toCompactJson(ParseResult result, boolean includeConfidence, boolean includeRaw)
            throws JsonProcessingException {
        return PRETTY.writeValueAsString(compact(result, includeConfidence, includeRaw));
    }

    public static ObjectNode toTree(ParseResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("input", result.input());
        root.put("normalized", result.normalizedInput());
        root.put("symbology", result.symbology().name());
        root.put("separatorsPresent", result.separatorsPresent());
        root.put("strategy", result.strategy().name());
        root.put("confidence", result.confidence());
        root.set("elements", elements(result.elements(), true));

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic d : result.diagnostics()) {
            ObjectNode node = diagnostics.addObject();
            node.put("code", d.code().name());
            node.put("severity", d.severity().name());
            node.put("message", d.message());
            node.put("position", d.position());
            if (d.aiCode() != null) {
                node.put("ai", d.aiCode());
            }
        }

        ArrayNode alternatives = root.putArray("alternatives");
        for (Alternative alt : result.alternatives()) {
            ObjectNode node = alternatives.addObject();
            node.put("score", alt.score());
            node.put("confidence", alt.confidence());
            node.set("elements", elements(alt.elements(), false));
            ArrayNode reasoning = node.putArray("reasoning");
            alt.reasoning().forEach(reasoning::add);
        }
        return root;
    }

    /**
     * Human-field-name view of the chosen elements.
     *
     * @param includeConfidence add {@code _confidence} as a percentage
     * @param includeRaw        render dates as {@code {formatted, raw}} objects
     */
    public static ObjectNode compact(ParseResult result, boolean includeConfidence, boolean includeRaw) {
        ObjectNode root = MAPPER.createObjectNode();
        for (ParsedElement e : result.elements()) {
            String name = fieldName(e.ai());
            String display = displayValue(e);
            if (includeRaw && isDate(e)) {
                ObjectNode both = root.putObject(name);
                both.put("formatted", display);
                both.put("raw", e.raw());
            }
            else {
                root.put(name, display);
            }
        }
        if (includeConfidence) {
            root.put("_confidence", BigDecimal.valueOf(result.confidence() * 100).setScale(2, RoundingMode.HALF_UP));
        }
        return root;
    }

    public static String fieldName(String ai) {
        return FIELD_NAMES.getOrDefault(ai, "AI(" + ai + ")");
    }

    /**
     * dd/mm/yyyy for dates ({@code XX/mm/yyyy} when the day is unspecified),
     * the normalized value otherwise.
     */
    static String displayValue(ParsedElement e) {
        Map<String, Object> meta = e.metadata();
        if (e.isDayUnspecified()) {
            return String.format("XX/%02d/%04d", meta.get(MetaKeys.MONTH), meta.get(MetaKeys.YEAR));
        }
        Object ddmmyyyy = meta.get(MetaKeys.DATE_DD_MM_YYYY);
        if (ddmmyyyy != null) {
            return ddmmyyyy.toString();
        }
        return e.value();
    }

    private static boolean isDate(ParsedElement e) {
        return e.metadata().containsKey(MetaKeys.DATE_DD_MM_YYYY);
    }

    private static ArrayNode elements(List<ParsedElement> elements, boolean withMetadata) {
        ArrayNode array = MAPPER.createArrayNode();
        for (ParsedElement e : elements) {
            ObjectNode node = array.addObject();
            node.put("ai", e.ai());
            node.put("title", e.title());
            node.put("raw", e.raw());
            node.put("value", e.value());
            node.put("valid", e.valid());
            if (withMetadata) {
                node.put("start", e.start());
                node.put("end", e.end());
                ArrayNode errors = node.putArray("errors");
                e.errors().forEach(errors::add);
                ObjectNode meta = node.putObject("metadata");
                e.metadata().forEach((k, v) -> meta.set(k, MAPPER.valueToTree(v)));
            }
        }
        return array;
    }
}
