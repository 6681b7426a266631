package com.signalhub.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.signalhub.support.RecordingPeer;
import com.signalhub.support.TestHub;

class JanitorSweepTest {

    private TestHub hub;
    private JanitorSweep janitor;

    @BeforeEach
    void setUp() {
        hub = new TestHub();
        janitor = new JanitorSweep(hub.directory, hub.clock, hub.properties);
    }

    @Test
    void evictsEmptyRooms() {
        hub.directory.getOrCreateRoom("empty");
        RecordingPeer a = hub.join("busy", "a");

        assertThat(janitor.sweep()).isEqualTo(1);

        assertThat(hub.directory.findRoom("empty")).isEmpty();
        assertThat(hub.directory.findRoom("busy")).isPresent();
        assertThat(a.connection().isClosed()).isFalse();
    }

    @Test
    void evictsRoomsInactiveLongerThanThresholdAndClosesTheirPeers() {
        RecordingPeer a = hub.join("stale", "a");
        hub.clock.advance(Duration.ofMinutes(31));

        assertThat(janitor.sweep()).isEqualTo(1);

        assertThat(hub.directory.findRoom("stale")).isEmpty();
        assertThat(a.connection().isClosed()).isTrue();
        assertThat(janitor.getRoomsEvicted()).isEqualTo(1);
    }

    @Test
    void routedMessagesKeepRoomAlive() {
        RecordingPeer a = hub.join("chatty", "a");
        hub.join("chatty", "b");

        hub.clock.advance(Duration.ofMinutes(20));
        hub.router.route(a.connection(), "{\"type\":\"chatMessage\",\"content\":\"still here\"}");
        hub.clock.advance(Duration.ofMinutes(20));

        assertThat(janitor.sweep()).isZero();
        assertThat(hub.directory.findRoom("chatty")).isPresent();
    }

    @Test
    void peerOfEvictedRoomCanRejoinUnderSameId() {
        hub.join("r1", "a");
        hub.clock.advance(Duration.ofHours(1));
        janitor.sweep();

        RecordingPeer again = hub.join("r1", "a");

        assertThat(hub.directory.getRoom("r1").hasPeer("a")).isTrue();
        assertThat(again.types()).startsWith("userID", "initiatorStatus");
    }
}
