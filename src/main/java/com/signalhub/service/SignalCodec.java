package com.signalhub.service;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalhub.dto.ErrorResponse;
import com.signalhub.dto.ErrorResponse.ErrorCode;
import com.signalhub.exception.ProtocolException;
import com.signalhub.model.MessageType;
import com.signalhub.model.SignalMessage;

/**
 * JSON encoding of the signaling envelope.
 */
@Component
public class SignalCodec {

    private final ObjectMapper objectMapper;

    public SignalCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse one inbound text frame.
     *
     * @throws ProtocolException if the frame is not a JSON object or has no type
     */
    public SignalMessage decode(String payload) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ErrorCode.VAL_001, e.getOriginalMessage(), e);
        }

        if (tree == null || !tree.isObject()) {
            throw new ProtocolException(ErrorCode.VAL_001, "envelope is not a JSON object");
        }

        SignalMessage message;
        try {
            message = objectMapper.treeToValue(tree, SignalMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ErrorCode.VAL_001, e.getOriginalMessage(), e);
        }

        if (message.getType() == null || message.getType().isBlank()) {
            throw new ProtocolException(ErrorCode.VAL_002, "type");
        }
        return message;
    }

    public String encode(MessageType type, String roomId, Object content) {
        SignalMessage message = new SignalMessage(type.wireName(), roomId, objectMapper.valueToTree(content));
        return write(message);
    }

    /**
     * An {@code error} envelope carrying the standard error payload.
     */
    public String encodeError(String roomId, ErrorResponse error) {
        return encode(MessageType.ERROR, roomId, error);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value, e);
        }
    }
}
