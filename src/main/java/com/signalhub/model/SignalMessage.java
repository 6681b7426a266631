package com.signalhub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The signaling envelope: {@code {"type": ..., "room_id": ..., "content": ...}}.
 * Content is kept as an opaque JSON tree; its shape depends on the type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalMessage {

    private String type;

    @JsonProperty("room_id")
    private String roomId;

    private JsonNode content;

    public SignalMessage() {
    }

    public SignalMessage(String type, String roomId, JsonNode content) {
        this.type = type;
        this.roomId = roomId;
        this.content = content;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public JsonNode getContent() {
        return content;
    }

    public void setContent(JsonNode content) {
        this.content = content;
    }

    /**
     * Text value of a top-level content field, or null when content is not an
     * object or the field is missing, null or blank.
     */
    public String contentText(String field) {
        if (content == null || !content.isObject()) {
            return null;
        }
        JsonNode node = content.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Whether content carries a non-null value (object, string, anything) under the field.
     */
    public boolean hasContentField(String field) {
        return content != null && content.isObject()
                && content.hasNonNull(field);
    }

    @Override
    public String toString() {
        return "SignalMessage{type='" + type + "', roomId='" + roomId + "'}";
    }
}
