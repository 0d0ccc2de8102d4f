package com.shinmonzen.backend.services.invoices.vision;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns a raw model response into a {@link VisionDocument}. Responses are frequently cut off at the
 * token ceiling, so parsing walks a ladder and stops at the first stage that produces something:
 * <ol>
 * <li>direct parse,</li>
 * <li>field-level scan for vendor/date plus every complete item object,</li>
 * <li>truncate after the last "}," and close the structure with "]}".</li>
 * </ol>
 * Each stage is a pure function of the raw text.
 */
public final class VisionResponseRepair {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final Pattern VENDOR_FIELD = Pattern.compile("\"vendor_name\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern DATE_FIELD = Pattern.compile("\"invoice_date\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");

    // flat object containing "item_name"; an object cut off mid-stream has no closing brace and never matches
    private static final Pattern ITEM_OBJECT = Pattern.compile("\\{[^{}]*\"item_name\"[^{}]*\\}");

    private static final Pattern LAST_ITEM_BOUNDARY = Pattern.compile("\\}\\s*,");

    private VisionResponseRepair() {
    }

    public static Optional<RepairedResponse> repair(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();

        Optional<VisionDocument> direct = parseDirect(raw);
        if (direct.isPresent()) return Optional.of(new RepairedResponse(RepairStage.DIRECT, direct.get()));

        Optional<VisionDocument> scanned = scanObjects(raw);
        if (scanned.isPresent()) return Optional.of(new RepairedResponse(RepairStage.OBJECT_SCAN, scanned.get()));

        return closeBrackets(raw).map(doc -> new RepairedResponse(RepairStage.BRACKET_CLOSURE, doc));
    }

    static Optional<VisionDocument> parseDirect(String raw) {
        String json = stripCodeFences(raw);
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || !root.isObject()) return Optional.empty();
            return Optional.of(toDocument(root));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static Optional<VisionDocument> scanObjects(String raw) {
        String text = stripCodeFences(raw);

        List<VisionItem> items = new ArrayList<>();
        Matcher m = ITEM_OBJECT.matcher(text);
        while (m.find()) {
            try {
                JsonNode node = MAPPER.readTree(m.group());
                VisionItem item = toItem(node);
                if (item != null) items.add(item);
            } catch (JsonProcessingException e) {
                // a single malformed object does not invalidate its neighbours
                continue;
            }
        }
        if (items.isEmpty()) return Optional.empty();

        return Optional.of(new VisionDocument(firstGroup(VENDOR_FIELD, text), firstGroup(DATE_FIELD, text), items));
    }

    static Optional<VisionDocument> closeBrackets(String raw) {
        String text = stripCodeFences(raw);
        Matcher m = LAST_ITEM_BOUNDARY.matcher(text);
        int cut = -1;
        while (m.find()) {
            cut = m.start() + 1;
        }
        if (cut < 0) return Optional.empty();
        return parseDirect(text.substring(0, cut) + "]}");
    }

    static String stripCodeFences(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            s = firstNewline >= 0 ? s.substring(firstNewline + 1) : s.substring(3);
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    private static VisionDocument toDocument(JsonNode root) {
        List<VisionItem> items = new ArrayList<>();
        JsonNode array = root.path("items");
        if (array.isArray()) {
            for (JsonNode node : array) {
                VisionItem item = toItem(node);
                if (item != null) items.add(item);
            }
        }
        return new VisionDocument(text(root, "vendor_name"), text(root, "invoice_date"), items);
    }

    private static VisionItem toItem(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        return new VisionItem(
                text(node, "date"),
                text(node, "item_name"),
                text(node, "quantity"),
                text(node, "unit"),
                text(node, "unit_price"),
                text(node, "amount"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String s = value.asText();
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        String value = m.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
