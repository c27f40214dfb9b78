package com.onalog.discovery.lead.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads schema.org JSON-LD blocks from a page and flattens {@code @graph} containers and arrays into a list of
 * typed nodes.
 */
@Component
public class JsonLdReader {
    private final ObjectMapper objectMapper;

    public JsonLdReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> read(Document document) {
        List<JsonNode> nodes = new ArrayList<>();
        if (document == null) {
            return nodes;
        }
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectTypedNodes(objectMapper.readTree(payload), nodes);
            } catch (JsonProcessingException ignored) {
                // Ignore malformed JSON-LD blobs and continue with the others.
            }
        }
        return nodes;
    }

    public static Set<String> typesOf(JsonNode node) {
        Set<String> types = new LinkedHashSet<>();
        JsonNode typeNode = node == null ? null : node.get("@type");
        if (typeNode == null || typeNode.isNull()) {
            return types;
        }
        if (typeNode.isTextual()) {
            types.add(typeNode.asText().toLowerCase(Locale.ROOT));
        } else if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual()) {
                    types.add(child.asText().toLowerCase(Locale.ROOT));
                }
            }
        }
        return types;
    }

    public static boolean hasType(JsonNode node, String type) {
        return typesOf(node).contains(type.toLowerCase(Locale.ROOT));
    }

    /**
     * schema.org business subtypes ({@code Restaurant}, {@code Dentist}, {@code RealEstateAgent}) are not
     * enumerated; any type ending in "business" or "organization" counts, plus the common direct subtypes.
     */
    public static boolean isBusinessEntity(JsonNode node) {
        for (String type : typesOf(node)) {
            if (type.endsWith("business")
                || type.endsWith("organization")
                || type.equals("corporation")
                || type.equals("restaurant")
                || type.equals("store")
                || type.equals("hospital")
                || type.equals("realestateagent")
                || type.equals("cafeorcoffeeshop")) {
                return true;
            }
        }
        return false;
    }

    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private void collectTypedNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectTypedNodes(child, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (node.has("@type")) {
            out.add(node);
        }
        JsonNode graph = node.get("@graph");
        if (graph != null) {
            collectTypedNodes(graph, out);
        }
    }
}
