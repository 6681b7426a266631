package com.signalhub.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalhub.model.Connection;
import com.signalhub.model.Room;
import com.signalhub.support.RecordingPeer;
import com.signalhub.support.TestHub;

class MessageRouterTest {

    private TestHub hub;
    private RecordingPeer a;
    private RecordingPeer b;
    private RecordingPeer c;

    @BeforeEach
    void setUp() {
        hub = new TestHub();
        a = hub.join("r1", "a");
        b = hub.join("r1", "b");
        c = hub.join("r1", "c");
        a.clear();
        b.clear();
        c.clear();
    }

    @Test
    void offerIsRelayedVerbatimToTargetOnly() {
        String offer = "{\"type\":\"offer\",\"room_id\":\"r1\","
                + "\"content\":{\"fromPeerID\":\"a\",\"targetPeerID\":\"b\",\"sdp\":{\"type\":\"offer\",\"sdp\":\"v=0\"}}}";

        hub.router.route(a.connection(), offer);

        assertThat(b.frames()).containsExactly(offer);
        assertThat(a.frames()).isEmpty();
        assertThat(c.frames()).isEmpty();
        assertThat(hub.router.getRelayedMessages()).isEqualTo(1);
    }

    @Test
    void answerAndIceCandidateAreRelayedToTarget() {
        String answer = "{\"type\":\"answer\",\"content\":{\"fromPeerID\":\"b\",\"targetPeerID\":\"a\",\"sdp\":\"v=0\"}}";
        String candidate = "{\"type\":\"iceCandidate\","
                + "\"content\":{\"fromPeerID\":\"b\",\"targetPeerID\":\"a\",\"candidate\":{\"candidate\":\"udp 1\"}}}";

        hub.router.route(b.connection(), answer);
        hub.router.route(b.connection(), candidate);

        assertThat(a.frames()).containsExactly(answer, candidate);
        assertThat(c.frames()).isEmpty();
    }

    @Test
    void offerToAbsentPeerIsDroppedWithoutClosingAnyone() {
        hub.router.route(a.connection(),
                "{\"type\":\"offer\",\"content\":{\"fromPeerID\":\"a\",\"targetPeerID\":\"z\",\"sdp\":\"v=0\"}}");

        assertThat(a.frames()).isEmpty();
        assertThat(b.frames()).isEmpty();
        assertThat(c.frames()).isEmpty();
        assertThat(a.connection().isClosed()).isFalse();
        assertThat(hub.router.getDroppedMessages()).isEqualTo(1);
    }

    @Test
    void relayWithMissingFieldsIsDropped() {
        hub.router.route(a.connection(), "{\"type\":\"offer\",\"content\":{\"fromPeerID\":\"a\",\"targetPeerID\":\"b\"}}");
        hub.router.route(a.connection(), "{\"type\":\"iceCandidate\",\"content\":{\"fromPeerID\":\"a\",\"sdp\":\"x\"}}");
        hub.router.route(a.connection(), "{\"type\":\"answer\"}");

        assertThat(b.frames()).isEmpty();
        assertThat(hub.router.getDroppedMessages()).isEqualTo(3);
    }

    @Test
    void relayClaimingAnotherSenderIsDropped() {
        hub.router.route(a.connection(),
                "{\"type\":\"offer\",\"content\":{\"fromPeerID\":\"c\",\"targetPeerID\":\"b\",\"sdp\":\"v=0\"}}");

        assertThat(b.frames()).isEmpty();
    }

    @Test
    void relayToSelfIsDropped() {
        hub.router.route(a.connection(),
                "{\"type\":\"offer\",\"content\":{\"fromPeerID\":\"a\",\"targetPeerID\":\"a\",\"sdp\":\"v=0\"}}");

        assertThat(a.frames()).isEmpty();
        assertThat(hub.router.getDroppedMessages()).isEqualTo(1);
    }

    @Test
    void chatGoesToEveryoneButSender() {
        String chat = "{\"type\":\"chatMessage\",\"content\":{\"text\":\"hi\"}}";

        hub.router.route(a.connection(), chat);

        assertThat(a.frames()).isEmpty();
        assertThat(b.frames()).containsExactly(chat);
        assertThat(c.frames()).containsExactly(chat);
    }

    @Test
    void startMeetingAssignsEachPairExactlyOnce() {
        RecordingPeer d = hub.join("r1", "d");
        a.clear();
        b.clear();
        c.clear();
        d.clear();

        hub.router.route(c.connection(), "{\"type\":\"startMeeting\"}");

        List<String[]> pairs = new ArrayList<>();
        for (RecordingPeer peer : List.of(a, b, c, d)) {
            List<JsonNode> createOffers = peer.messagesOfType("createOffer");
            assertThat(createOffers).hasSize(1);
            for (JsonNode target : createOffers.get(0).path("content").path("peers")) {
                pairs.add(new String[] {peer.peerId(), target.asText()});
            }
        }

        assertThat(pairs).hasSize(4 * 3 / 2);
        Set<String> unordered = new HashSet<>();
        for (String[] pair : pairs) {
            assertThat(pair[0]).isNotEqualTo(pair[1]);
            String key = pair[0].compareTo(pair[1]) < 0 ? pair[0] + "|" + pair[1] : pair[1] + "|" + pair[0];
            assertThat(unordered.add(key)).as("pair %s assigned twice", key).isTrue();
        }
        assertThat(hub.directory.getRoom("r1").isMeetingStarted()).isTrue();
    }

    @Test
    void lastPeerInOrderGetsEmptyCreateOffer() {
        hub.router.route(a.connection(), "{\"type\":\"startMeeting\"}");

        JsonNode peers = c.messagesOfType("createOffer").get(0).path("content").path("peers");
        assertThat(peers.isArray()).isTrue();
        assertThat(peers.size()).isZero();
    }

    @Test
    void startMeetingNoticeReachesEveryMemberBeforeCreateOffer() {
        hub.router.route(b.connection(), "{\"type\":\"startMeeting\"}");

        for (RecordingPeer peer : List.of(a, b, c)) {
            assertThat(peer.types()).containsExactly("startMeeting", "createOffer");
            assertThat(peer.messagesOfType("startMeeting").get(0).path("content").asBoolean()).isTrue();
        }
    }

    @Test
    void allReadyIsSentOnceWhenEveryoneIsReadyAfterStart() {
        hub.router.route(a.connection(), "{\"type\":\"ready\"}");
        hub.router.route(b.connection(), "{\"type\":\"ready\"}");
        hub.router.route(c.connection(), "{\"type\":\"ready\"}");
        assertThat(a.messagesOfType("allReady")).isEmpty();

        hub.router.route(a.connection(), "{\"type\":\"startMeeting\"}");
        assertThat(c.types()).containsExactly("startMeeting", "createOffer", "allReady");

        hub.router.route(c.connection(), "{\"type\":\"ready\"}");
        hub.router.route(a.connection(), "{\"type\":\"startMeeting\"}");

        for (RecordingPeer peer : List.of(a, b, c)) {
            assertThat(peer.messagesOfType("allReady")).hasSize(1);
        }
    }

    @Test
    void allReadyWaitsForLastPeerAfterStart() {
        hub.router.route(a.connection(), "{\"type\":\"ready\"}");
        hub.router.route(b.connection(), "{\"type\":\"ready\"}");
        hub.router.route(a.connection(), "{\"type\":\"startMeeting\"}");
        assertThat(b.messagesOfType("allReady")).isEmpty();

        hub.router.route(c.connection(), "{\"type\":\"ready\"}");

        assertThat(b.messagesOfType("allReady")).hasSize(1);
        assertThat(hub.directory.getRoom("r1").isAllReadySent()).isTrue();
    }

    @Test
    void offerTargetsFollowLexicographicOrder() {
        Map<String, List<String>> targets = MessageRouter.assignOfferTargets(List.of("carol", "alice", "bob"));

        assertThat(targets).containsExactly(
                Map.entry("alice", List.of("bob", "carol")),
                Map.entry("bob", List.of("carol")),
                Map.entry("carol", List.of()));
    }

    @Test
    void readyMarksSenderAndClearsOnOtherStatus() {
        Room room = hub.directory.getRoom("r1");

        hub.router.route(a.connection(), "{\"type\":\"ready\"}");
        hub.router.route(b.connection(), "{\"type\":\"ready\",\"content\":{\"status\":\"ready\"}}");
        assertThat(room.getReadyPeers()).containsExactly("a", "b");

        hub.router.route(b.connection(), "{\"type\":\"ready\",\"content\":{\"status\":\"busy\"}}");
        assertThat(room.getReadyPeers()).containsExactly("a");

        // Readiness does not change the member count
        assertThat(a.messagesOfType("userCount")).isEmpty();
    }

    @Test
    void userListQueryIsAnsweredToSender() {
        hub.router.route(b.connection(), "{\"type\":\"userList\"}");

        assertThat(b.types()).containsExactly("userList");
        assertThat(a.frames()).isEmpty();
    }

    @Test
    void typingIsRelayedToOthers() {
        hub.router.route(a.connection(), "{\"type\":\"typing\",\"content\":{\"typing\":false}}");

        JsonNode typing = b.messagesOfType("typing").get(0).path("content");
        assertThat(typing.path("peerID").asText()).isEqualTo("a");
        assertThat(typing.path("typing").asBoolean()).isFalse();
        assertThat(a.frames()).isEmpty();
    }

    @Test
    void malformedAndUnknownMessagesAreDroppedAndConnectionStaysOpen() {
        hub.router.route(a.connection(), "not json");
        hub.router.route(a.connection(), "[1,2,3]");
        hub.router.route(a.connection(), "{\"content\":{}}");
        hub.router.route(a.connection(), "{\"type\":\"teleport\"}");
        hub.router.route(a.connection(), "{\"type\":\"userCount\",\"content\":99}");

        assertThat(hub.router.getDroppedMessages()).isEqualTo(5);
        assertThat(a.connection().isClosed()).isFalse();
        assertThat(b.frames()).isEmpty();

        hub.router.route(a.connection(), "{\"type\":\"chatMessage\",\"content\":\"after\"}");
        assertThat(b.frames()).hasSize(1);
    }

    @Test
    void messageForAnotherRoomIsDropped() {
        hub.router.route(a.connection(), "{\"type\":\"chatMessage\",\"room_id\":\"r2\",\"content\":\"hi\"}");

        assertThat(b.frames()).isEmpty();
        assertThat(hub.router.getDroppedMessages()).isEqualTo(1);
    }

    @Test
    void messageFromDepartedPeerIsDropped() {
        hub.leave(a);
        b.clear();

        hub.router.route(a.connection(), "{\"type\":\"chatMessage\",\"content\":\"ghost\"}");

        assertThat(b.frames()).isEmpty();
    }

    @Test
    void slowTargetIsDroppedWithoutStallingOthers() {
        RecordingPeer fast = hub.join("r2", "fast");
        Connection slow = new Connection("slow", "r2", 1);
        hub.directory.join("r2", "slow", slow);
        fast.clear();

        String chat = "{\"type\":\"chatMessage\",\"content\":\"x\"}";
        hub.router.route(fast.connection(), chat);
        hub.router.route(fast.connection(), chat);

        assertThat(slow.isClosed()).isTrue();
        assertThat(fast.connection().isClosed()).isFalse();
    }
}
