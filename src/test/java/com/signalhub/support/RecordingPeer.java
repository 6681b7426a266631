package com.signalhub.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalhub.model.Connection;

/**
 * A connection whose outbound queue is drained into a list, as the socket
 * writer would.
 */
public class RecordingPeer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Connection connection;
    private final List<String> frames = new CopyOnWriteArrayList<>();

    public RecordingPeer(String peerId, String roomId) {
        this(peerId, roomId, 256);
    }

    public RecordingPeer(String peerId, String roomId, int queueCapacity) {
        this.connection = new Connection(peerId, roomId, queueCapacity);
        this.connection.outbound().subscribe(frames::add);
    }

    public Connection connection() {
        return connection;
    }

    public String peerId() {
        return connection.getPeerId();
    }

    public List<String> frames() {
        return frames;
    }

    public List<JsonNode> messages() {
        return frames.stream().map(RecordingPeer::parse).collect(Collectors.toList());
    }

    public List<String> types() {
        return messages().stream().map(node -> node.path("type").asText()).collect(Collectors.toList());
    }

    public List<JsonNode> messagesOfType(String type) {
        return messages().stream()
                .filter(node -> type.equals(node.path("type").asText()))
                .collect(Collectors.toList());
    }

    public void clear() {
        frames.clear();
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Not JSON: " + frame, e);
        }
    }
}
