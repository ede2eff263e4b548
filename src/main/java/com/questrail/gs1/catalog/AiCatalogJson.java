package com.questrail.gs1.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.gs1.api.ApplicationIdentifier;
import com.questrail.gs1.api.DataType;
import com.questrail.gs1.api.DateFormat;
import com.questrail.gs1.api.LengthPolicy;
import com.questrail.gs1.api.SyntaxComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AiCatalogJson
 * -----------------------------------------------------------------------------
 * JSON export and import of an expanded {@link AiCatalog}.
 *
 * <p>The document is a single object keyed by AI code, in catalog order.
 * Family and range rows of the syntax table appear already expanded, one
 * entry per concrete code:</p>
 * <pre>
 *   {
 *     "01" : {
 *       "ai" : "01", "title" : "GTIN", "dataType" : "N",
 *       "fixedLength" : true, "minLength" : 14, "maxLength" : 14,
 *       "separatorRequired" : false, "checkDigit" : true,
 *       "decimalPositions" : null, "dateFormat" : null,
 *       "requiredWith" : [ ], "exclusiveWith" : [ "255", "37" ],
 *       "digitalLinkKey" : true,
 *       "components" : [ { "type" : "N", "min" : 14, "max" : 14, "linters" : [ "csum", "gcppos2" ] } ]
 *     }
 *   }
 * </pre>
 *
 * <p>A saved export loads without re-parsing the syntax table. A hand-written
 * document supplies a custom catalog; keys left out take their defaults
 * (alphanumeric, variable length 0..0, no check digit, no date, separator
 * required unless fixed).</p>
 */
public final class AiCatalogJson
{
    private static final Logger log = LoggerFactory.getLogger(AiCatalogJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private AiCatalogJson() {
    }

    public static String toJson(AiCatalog catalog) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toTree(catalog));
    }

    public static ObjectNode toTree(AiCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        ObjectNode root = MAPPER.createObjectNode();
        for (ApplicationIdentifier ai : catalog.definitions()) {
            root.set(ai.code(), entry(ai));
        }
        return root;
    }

    /**
     * Parses a catalog document.
     *
     * @param source name reported by {@link AiCatalog#source()}
     * @throws JsonProcessingException  if the text is not well-formed JSON
     * @throws IllegalArgumentException if the document is not an object of
     *                                  valid definitions
     */
    public static AiCatalog fromJson(String json, String source) throws JsonProcessingException {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(source, "source");
        return fromTree(MAPPER.readTree(json), source);
    }

    public static void write(AiCatalog catalog, Path path) throws IOException {
        Files.writeString(path, toJson(catalog), StandardCharsets.UTF_8);
        log.info("Saved GS1 catalog {} to {} ({} definitions)", catalog.source(), path, catalog.size());
    }

    public static AiCatalog read(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    static AiCatalog fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Catalog JSON must be an object keyed by AI code");
        }

        List<ApplicationIdentifier> definitions = new ArrayList<>(root.size());
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> e = entries.next();
            definitions.add(definition(e.getKey(), e.getValue()));
        }

        AiCatalog catalog = AiCatalog.of(source, definitions);
        log.info("Loaded GS1 catalog {} from JSON ({} definitions)", source, catalog.size());
        return catalog;
    }

    private static ObjectNode entry(ApplicationIdentifier ai) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("ai", ai.code());
        node.put("title", ai.title());
        node.put("dataType", String.valueOf(ai.dataType().tag()));
        node.put("fixedLength", ai.fixedLength());
        node.put("minLength", ai.minLength());
        node.put("maxLength", ai.maxLength());
        node.put("separatorRequired", ai.separatorRequired());
        node.put("checkDigit", ai.checkDigit());
        if (ai.decimalPositions().isPresent()) {
            node.put("decimalPositions", ai.decimalPositions().getAsInt());
        }
        else {
            node.putNull("decimalPositions");
        }
        node.put("dateFormat", ai.dateFormat().map(DateFormat::linter).orElse(null));
        strings(node.putArray("requiredWith"), ai.requiredWith());
        strings(node.putArray("exclusiveWith"), ai.exclusiveWith());
        node.put("digitalLinkKey", ai.digitalLinkKey());

        ArrayNode components = node.putArray("components");
        for (SyntaxComponent c : ai.components()) {
            ObjectNode cn = components.addObject();
            cn.put("type", String.valueOf(c.type().tag()));
            cn.put("min", c.min());
            cn.put("max", c.max());
            strings(cn.putArray("linters"), c.linters());
        }
        return node;
    }

    private static ApplicationIdentifier definition(String code, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("AI " + code + ": entry must be an object");
        }
        String labelled = node.path("ai").asText(code);
        if (!labelled.equals(code)) {
            throw new IllegalArgumentException("Entry " + code + " is labelled AI " + labelled);
        }

        boolean fixed = node.path("fixedLength").asBoolean(false);
        ApplicationIdentifier.Builder b = ApplicationIdentifier.builder(code)
                .title(node.path("title").asText(""))
                .dataType(dataType(code, node.path("dataType"), DataType.ALPHANUMERIC))
                .lengthPolicy(new LengthPolicy(fixed,
                        node.path("minLength").asInt(0),
                        node.path("maxLength").asInt(0)))
                .separatorRequired(node.path("separatorRequired").asBoolean(!fixed))
                .checkDigit(node.path("checkDigit").asBoolean(false))
                .decimalPositions(node.hasNonNull("decimalPositions") ? node.get("decimalPositions").asInt() : null)
                .requiredWith(strings(node.path("requiredWith")))
                .exclusiveWith(strings(node.path("exclusiveWith")))
                .digitalLinkKey(node.path("digitalLinkKey").asBoolean(false));

        if (node.hasNonNull("dateFormat")) {
            String linter = node.get("dateFormat").asText();
            b.dateFormat(DateFormat.fromLinter(linter).orElseThrow(() ->
                    new IllegalArgumentException("AI " + code + ": unknown date format " + linter)));
        }

        List<SyntaxComponent> components = new ArrayList<>();
        for (JsonNode cn : node.path("components")) {
            components.add(new SyntaxComponent(
                    dataType(code, cn.path("type"), DataType.ALPHANUMERIC),
                    cn.path("min").asInt(0),
                    cn.path("max").asInt(0),
                    strings(cn.path("linters"))));
        }
        b.components(components);

        return b.build();
    }

    private static DataType dataType(String code, JsonNode node, DataType fallback) {
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        String tag = node.asText();
        if (tag.length() != 1) {
            throw new IllegalArgumentException("AI " + code + ": bad data type '" + tag + "'");
        }
        return DataType.fromTag(tag.charAt(0));
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : array) {
            out.add(item.asText());
        }
        return out;
    }

    private static void strings(ArrayNode target, List<String> values) {
        for (String value : values) {
            target.add(value);
        }
    }
}
