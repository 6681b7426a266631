package com.signalhub.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire names of every envelope {@code type} the hub understands.
 * Client-to-server types are routed; server-to-client types are only emitted.
 */
public enum MessageType {

    // client -> server
    READY("ready"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("iceCandidate"),
    CHAT_MESSAGE("chatMessage"),
    START_MEETING("startMeeting"), // echoed to every member as the meeting notice
    TYPING("typing"),

    // server -> client (userList is also accepted as a query)
    USER_LIST("userList"),
    CREATE_OFFER("createOffer"),
    USER_COUNT("userCount"),
    USER_JOINED("userJoined"),
    USER_LEFT("userLeft"),
    INITIATOR_STATUS("initiatorStatus"),
    USER_ID("userID"),
    ALL_READY("allReady"),
    ERROR("error");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(MessageType::wireName, Function.identity()));

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }
}
