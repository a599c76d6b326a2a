package com.whothub.gameservice.games.whot.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.common.ErrorKind;
import com.whothub.gameservice.games.whot.domain.deck.WhotInitialStateFactory;
import com.whothub.gameservice.games.whot.domain.dto.ReadReceipt;
import com.whothub.gameservice.games.whot.domain.dto.StateDispatch;
import com.whothub.gameservice.games.whot.domain.dto.StateUpdate;
import com.whothub.gameservice.games.whot.domain.enums.ChatStatus;
import com.whothub.gameservice.games.whot.domain.enums.Seat;
import com.whothub.gameservice.games.whot.domain.model.ChatMessage;
import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;
import com.whothub.gameservice.games.whot.domain.state.StateOrientation;
import com.whothub.gameservice.games.whot.infrastructure.memory.InMemorySessionRepository;
import com.whothub.gameservice.games.whot.service.TournamentEngine;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import com.whothub.gameservice.support.ManualGameLoop;
import com.whothub.gameservice.support.MutableClock;
import com.whothub.gameservice.support.RecordingNotifier;
import com.whothub.gameservice.support.RecordingNotifier.Sent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRegistryImplTest {

    private static final String CODE = "AB12";

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemorySessionRepository repo;
    private TournamentEngine engine;
    private RecordingNotifier notifier;
    private ManualGameLoop loop;
    private WhotProperties properties;
    private MutableClock clock;
    private SessionRegistryImpl registry;

    @BeforeEach
    void setUp() {
        repo = new InMemorySessionRepository();
        engine = mock(TournamentEngine.class);
        notifier = new RecordingNotifier();
        loop = new ManualGameLoop();
        properties = new WhotProperties();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new SessionRegistryImpl(repo, engine, new WhotInitialStateFactory(mapper),
                notifier, loop, properties, clock);
    }

    private static JsonNode dispatchedState(Sent sent) {
        StateDispatch d = (StateDispatch) sent.payload();
        assertEquals(StateDispatch.INITIALIZE_DECK, d.type());
        return (JsonNode) d.payload();
    }

    @Test
    void rejectsCodeThatIsNotFourCharacters() {
        CoordinationException e = assertThrows(CoordinationException.class,
                () -> registry.joinSession("ABC", "alice", "c1", null));

        assertEquals(ErrorKind.INVALID_INPUT, e.getKind());
        assertTrue(repo.findAll().isEmpty());
    }

    @Test
    void firstJoinCreatesSessionInSeatOne() {
        Seat seat = registry.joinSession(CODE, "alice", "c1", null);

        assertEquals(Seat.ONE, seat);
        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(1, s.getParticipants().size());
        List<Sent> init = notifier.toConnection("c1", OutboundEvent.STATE_DISPATCH);
        assertEquals(1, init.size());
        assertEquals(s.getCanonicalState(), dispatchedState(init.get(0)));
        assertEquals("one", dispatchedState(init.get(0)).get("player").asText());
    }

    @Test
    void secondJoinerReceivesMirroredStateAndHostIsToldOpponentOnline() {
        registry.joinSession(CODE, "alice", "c1", null);
        ObjectNode canonical = repo.find(CODE).orElseThrow().getCanonicalState();

        Seat seat = registry.joinSession(CODE, "bob", "c2", null);

        assertEquals(Seat.TWO, seat);
        JsonNode bobView = dispatchedState(notifier.toConnection("c2", OutboundEvent.STATE_DISPATCH).get(0));
        assertEquals(StateOrientation.reverse(canonical), bobView);
        assertEquals(canonical.get("userCards"), bobView.get("opponentCards"));
        assertEquals(List.of(true), notifier.toConnection("c1", OutboundEvent.OPPONENT_PRESENCE_CHANGED)
                .stream().map(Sent::payload).toList());
        assertEquals(1, notifier.toConnection("c2", OutboundEvent.CHAT_HISTORY).size());
    }

    @Test
    void thirdDistinctPlayerIsRejectedAndSessionUnchanged() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);

        CoordinationException e = assertThrows(CoordinationException.class,
                () -> registry.joinSession(CODE, "carol", "c3", null));

        assertEquals(ErrorKind.CONFLICT, e.getKind());
        assertEquals(2, repo.find(CODE).orElseThrow().getParticipants().size());
        assertTrue(notifier.toConnection("c3").isEmpty());
    }

    @Test
    void reconnectRebindsSeatWithoutDuplicating() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        registry.recordChatMessage(CODE, "c1", "hello");
        notifier.clear();

        Seat seat = registry.joinSession(CODE, "bob", "c3", null);

        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(Seat.TWO, seat);
        assertEquals(2, s.getParticipants().size());
        assertEquals("c3", s.findByStoredId("bob").orElseThrow().getConnectionId());
        assertEquals(StateOrientation.reverse(s.getCanonicalState()),
                dispatchedState(notifier.toConnection("c3", OutboundEvent.STATE_DISPATCH).get(0)));
        assertEquals(1, ((List<?>) notifier.toConnection("c3", OutboundEvent.CHAT_HISTORY).get(0).payload()).size());
        assertEquals(true, notifier.toConnection("c1", OutboundEvent.OPPONENT_PRESENCE_CHANGED).get(0).payload());
    }

    @Test
    void soloOccupantRejoiningOnlyRebinds() {
        registry.joinSession(CODE, "alice", "c1", null);
        notifier.clear();

        registry.joinSession(CODE, "alice", "c9", null);

        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(1, s.getParticipants().size());
        assertEquals("c9", s.getParticipants().get(0).getConnectionId());
        assertEquals(1, notifier.all().size());
        assertEquals(OutboundEvent.STATE_DISPATCH, notifier.all().get(0).event());
    }

    @Test
    void stateFromSeatTwoIsStoredCanonicalAndNotEchoed() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        ObjectNode bobView = StateOrientation.reverse(repo.find(CODE).orElseThrow().getCanonicalState());
        bobView.put("whoIsToPlay", "opponent");
        bobView.put("infoText", "played");
        notifier.clear();

        registry.applyStateUpdate(CODE, "c2", bobView);

        ObjectNode canonical = repo.find(CODE).orElseThrow().getCanonicalState();
        assertEquals("one", canonical.get("player").asText());
        assertEquals("user", canonical.get("whoIsToPlay").asText());
        assertEquals(bobView.get("userCards"), canonical.get("opponentCards"));
        assertTrue(notifier.toConnection("c2").isEmpty());
        List<Sent> toAlice = notifier.toConnection("c1", OutboundEvent.STATE_DISPATCH);
        assertEquals(1, toAlice.size());
        StateDispatch d = (StateDispatch) toAlice.get(0).payload();
        assertEquals(StateDispatch.UPDATE_STATE, d.type());
        StateUpdate u = (StateUpdate) d.payload();
        assertEquals(canonical, u.playerOneState());
        assertEquals(bobView, u.playerTwoState());
    }

    @Test
    void stateFromUnboundConnectionIsDiscarded() {
        registry.joinSession(CODE, "alice", "c1", null);
        ObjectNode before = repo.find(CODE).orElseThrow().getCanonicalState();
        notifier.clear();

        registry.applyStateUpdate(CODE, "intruder", mapper.createObjectNode().put("player", "one"));

        assertSame(before, repo.find(CODE).orElseThrow().getCanonicalState());
        assertTrue(notifier.all().isEmpty());
    }

    @Test
    void stateForUnknownSessionIsNotFound() {
        CoordinationException e = assertThrows(CoordinationException.class,
                () -> registry.applyStateUpdate("ZZZZ", "c1", mapper.createObjectNode()));
        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }

    @Test
    void chatKeepsOnlyMostRecentFifty() {
        registry.joinSession(CODE, "alice", "c1", null);

        for (int i = 0; i < 51; i++) {
            registry.recordChatMessage(CODE, "c1", "m" + i);
        }

        List<ChatMessage> history = repo.find(CODE).orElseThrow().chatHistory();
        assertEquals(50, history.size());
        assertEquals("m1", history.get(0).getText());
        assertEquals("m50", history.get(49).getText());
        assertEquals(51, notifier.toSession(CODE, OutboundEvent.RECEIVE_MESSAGE).size());
    }

    @Test
    void markReadBroadcastsOnlyWhenSomethingChanged() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        registry.recordChatMessage(CODE, "c1", "hi");
        registry.recordChatMessage(CODE, "c2", "hey");

        assertTrue(registry.markRead(CODE, "c1"));
        List<Sent> receipts = notifier.toSession(CODE, OutboundEvent.MESSAGES_READ);
        assertEquals(1, receipts.size());
        assertEquals(new ReadReceipt("alice"), receipts.get(0).payload());

        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(ChatStatus.SENT, s.chatHistory().get(0).getStatus());
        assertEquals(ChatStatus.READ, s.chatHistory().get(1).getStatus());

        assertFalse(registry.markRead(CODE, "c1"));
        assertEquals(1, notifier.toSession(CODE, OutboundEvent.MESSAGES_READ).size());
    }

    @Test
    void chatSenderComesFromConnectionBinding() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);

        ChatMessage msg = registry.recordChatMessage(CODE, "c2", "hi").orElseThrow();

        assertEquals("bob", msg.getSenderId());
        assertEquals("bob", ((ChatMessage) notifier.toSession(CODE, OutboundEvent.RECEIVE_MESSAGE).get(0).payload())
                .getSenderId());
    }

    @Test
    void chatAndReadReceiptsFromUnboundConnectionAreDropped() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        registry.recordChatMessage(CODE, "c1", "hi");
        notifier.clear();

        assertTrue(registry.recordChatMessage(CODE, "stranger", "spam").isEmpty());
        assertFalse(registry.markRead(CODE, "stranger"));

        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(1, s.chatHistory().size());
        assertEquals(ChatStatus.SENT, s.chatHistory().get(0).getStatus());
        assertTrue(notifier.all().isEmpty());
    }

    @Test
    void disconnectNotifiesOpponentButKeepsParticipant() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        notifier.clear();

        registry.notifyDisconnect("c2");

        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(2, s.getParticipants().size());
        assertFalse(s.findByStoredId("bob").orElseThrow().isOnline());
        assertEquals(List.of(false), notifier.toConnection("c1", OutboundEvent.OPPONENT_PRESENCE_CHANGED)
                .stream().map(Sent::payload).toList());
    }

    @Test
    void confirmOnlineTellsOpponent() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession(CODE, "bob", "c2", null);
        notifier.clear();

        registry.confirmOnline(CODE, "alice");

        assertEquals(1, notifier.toConnection("c2", OutboundEvent.OPPONENT_PRESENCE_CHANGED).size());
        assertTrue(notifier.toConnection("c1").isEmpty());
    }

    @Test
    void terminateRemovesAfterGraceDelay() {
        registry.joinSession(CODE, "alice", "c1", null);

        registry.terminateSession(CODE);

        assertTrue(repo.exists(CODE));
        assertEquals(Duration.ofSeconds(1), loop.scheduled().get(0).delay());
        loop.runScheduled();
        assertFalse(repo.exists(CODE));
    }

    @Test
    void teardownDoesNotRemoveReplacementSession() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.terminateSession(CODE);
        repo.removeIfSame(repo.find(CODE).orElseThrow());
        registry.joinSession(CODE, "carol", "c5", null);

        loop.runScheduled();

        assertTrue(repo.exists(CODE));
        assertEquals("carol", repo.find(CODE).orElseThrow().getParticipants().get(0).getStoredId());
    }

    @Test
    void tournamentLinkAttachedOnlyWhenVerified() {
        TournamentLink link = new TournamentLink("T1", "T1_r1_m0");
        when(engine.verifyLink(any(), anyString())).thenAnswer(inv ->
                CODE.equals(inv.getArgument(1)) && link.equals(inv.getArgument(0)));
        when(engine.isMatchPlayer(link, "alice")).thenReturn(true);

        registry.joinSession(CODE, "alice", "c1", link);
        registry.joinSession("XY99", "carol", "c3", link);

        assertEquals(link, repo.find(CODE).orElseThrow().tournamentLink().orElseThrow());
        assertTrue(repo.find("XY99").orElseThrow().tournamentLink().isEmpty());
    }

    @Test
    void outsiderCannotTakeSeatInTournamentSession() {
        TournamentLink link = new TournamentLink("T1", "T1_r1_m0");
        when(engine.verifyLink(link, CODE)).thenReturn(true);
        when(engine.isMatchPlayer(any(), anyString())).thenAnswer(inv ->
                link.equals(inv.getArgument(0)) && List.of("alice", "bob").contains(inv.getArgument(1)));

        CoordinationException creator = assertThrows(CoordinationException.class,
                () -> registry.joinSession(CODE, "mallory", "cm", link));
        assertEquals(ErrorKind.CONFLICT, creator.getKind());
        assertFalse(repo.exists(CODE));

        registry.joinSession(CODE, "alice", "c1", link);
        CoordinationException joiner = assertThrows(CoordinationException.class,
                () -> registry.joinSession(CODE, "mallory", "cm", null));
        assertEquals(ErrorKind.CONFLICT, joiner.getKind());

        assertEquals(Seat.TWO, registry.joinSession(CODE, "bob", "c2", null));
        GameSession s = repo.find(CODE).orElseThrow();
        assertEquals(List.of("alice", "bob"), s.getParticipants().stream().map(p -> p.getStoredId()).toList());
        assertTrue(s.findByConnection("cm").isEmpty());
    }

    @Test
    void randomJoinSequencesNeverSeatMoreThanTwo() {
        Random random = new Random(20260101L);
        List<String> ids = List.of("p0", "p1", "p2", "p3", "p4");
        for (int round = 0; round < 200; round++) {
            String code = String.format("R%03d", round);
            for (int step = 0; step < 12; step++) {
                String storedId = ids.get(random.nextInt(ids.size()));
                String connectionId = "c" + random.nextInt(1000);
                try {
                    registry.joinSession(code, storedId, connectionId, null);
                } catch (CoordinationException e) {
                    assertEquals(ErrorKind.CONFLICT, e.getKind());
                }
                List<String> seated = repo.find(code).orElseThrow().getParticipants().stream()
                        .map(p -> p.getStoredId()).toList();
                assertTrue(seated.size() <= 2);
                assertEquals(seated.size(), new HashSet<>(seated).size());
            }
        }
    }

    @Test
    void plainSessionNeverConsultsTournaments() {
        registry.joinSession(CODE, "alice", "c1", null);

        verify(engine, never()).verifyLink(any(), anyString());
    }

    @Test
    void sweepRemovesIdleSessionsUnlessRetained() {
        registry.joinSession(CODE, "alice", "c1", null);
        registry.joinSession("KEEP", "bob", "c2", null);
        clock.advance(Duration.ofHours(3));
        registry.joinSession("NEW1", "dan", "c4", null);

        int removed = registry.sweepIdleSessions(clock.instant().minus(Duration.ofHours(2)),
                s -> s.getCode().equals("KEEP"));

        assertEquals(1, removed);
        assertFalse(repo.exists(CODE));
        assertTrue(repo.exists("KEEP"));
        assertTrue(repo.exists("NEW1"));
    }
}
