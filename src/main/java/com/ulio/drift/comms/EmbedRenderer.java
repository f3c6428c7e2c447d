package com.ulio.drift.comms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * Renders a payload as a chat webhook message with a single embed.
 */
public class EmbedRenderer {
    private final ObjectMapper objectMapper;

    public EmbedRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String render(NotificationPayload payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMessage(payload));
    }

    public ObjectNode toMessage(NotificationPayload payload) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode embeds = root.putArray("embeds");

        ObjectNode embed = embeds.addObject();
        embed.put("title", payload.getTitle());
        embed.put("color", payload.getColor());

        ArrayNode fields = embed.putArray("fields");
        addField(fields, "Metric", payload.getMetric());
        if (payload.getKind() == NotificationKind.ALERT) {
            addField(fields, "Value", format(payload.getValue()));
            addField(fields, "Severity", capitalize(payload.getSeverity().getLabel()));
            addField(fields, "Duration", payload.getDuration() + " checks");
            addField(fields, "Algorithm", payload.getAlgorithm());
            addField(fields, "Score", format(payload.getScore() == null ? 0.0 : payload.getScore()));
        } else {
            addField(fields, "Previous Value", format(payload.getValue()));
            addField(fields, "Status", "Normal");
            addField(fields, "Duration", payload.getDuration() + " checks");
        }

        embed.put("timestamp", payload.getTimestamp().toString());
        return root;
    }

    private static void addField(ArrayNode fields, String name, String value) {
        ObjectNode field = fields.addObject();
        field.put("name", name);
        field.put("value", value == null ? "" : value);
        field.put("inline", true);
    }

    private static String format(double value) {
        if (!Double.isFinite(value)) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
