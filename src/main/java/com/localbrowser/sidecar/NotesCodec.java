package com.localbrowser.sidecar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;

/**
 * 备注字段的编解码：Base64 包裹的 JSON 对象 {@code {id: {"text": ..., "checked": bool}}}。
 */
public final class NotesCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private NotesCodec() {
    }

    /**
     * 统计有文字且未勾选的备注数量。
     *
     * @throws SidecarReadException 内容无法解码时抛出
     */
    public static int countOpenNotes(String encodedNotes) {
        JsonNode root = decode(encodedNotes);
        int count = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            JsonNode note = fields.next().getValue();
            String text = note.path("text").asText("");
            boolean checked = note.path("checked").asBoolean(false);
            if (!text.isBlank() && !checked) {
                count++;
            }
        }
        return count;
    }

    /**
     * 追加一条备注并返回新的编码内容。
     */
    public static String appendNote(String encodedNotes, String text) {
        ObjectNode root = encodedNotes == null || encodedNotes.isBlank()
            ? MAPPER.createObjectNode()
            : (ObjectNode) decode(encodedNotes);
        ObjectNode note = root.putObject(Integer.toString(root.size()));
        note.put("text", text);
        note.put("checked", false);
        try {
            byte[] json = MAPPER.writeValueAsBytes(root);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException jsonProcessingException) {
            throw new IllegalStateException("编码备注失败", jsonProcessingException);
        }
    }

    private static JsonNode decode(String encodedNotes) {
        try {
            byte[] json = Base64.getDecoder().decode(encodedNotes.trim());
            JsonNode root = MAPPER.readTree(new String(json, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                throw new SidecarReadException("备注内容不是 JSON 对象");
            }
            return root;
        } catch (IllegalArgumentException | JsonProcessingException exception) {
            throw new SidecarReadException("无法解码备注内容", exception);
        }
    }
}
