package com.whothub.gameservice.games.whot.interfaces.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.whothub.gameservice.games.whot.domain.enums.WinnerClaim;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands;
import com.whothub.gameservice.games.whot.service.ResultArbiter;
import com.whothub.gameservice.games.whot.service.SessionRegistry;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import com.whothub.gameservice.platform.ws.CommandDispatcher;
import com.whothub.gameservice.support.ManualGameLoop;
import com.whothub.gameservice.support.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class WhotSessionWsControllerTest {

    private SessionRegistry registry;
    private ResultArbiter arbiter;
    private RecordingNotifier notifier;
    private WhotSessionWsController controller;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        arbiter = mock(ResultArbiter.class);
        notifier = new RecordingNotifier();
        controller = new WhotSessionWsController(registry, arbiter,
                new CommandDispatcher(new ManualGameLoop(), notifier), new WhotProperties());
    }

    private static SimpMessageHeaderAccessor from(String connectionId) {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId(connectionId);
        return sha;
    }

    @Test
    void joinUsesStompSessionAsConnectionId() {
        controller.join(new SessionCommands.JoinSession("AB12", "alice", null), from("conn-7"));

        verify(registry).joinSession("AB12", "alice", "conn-7", null);
    }

    @Test
    void invalidCodeNeverReachesRegistry() {
        controller.join(new SessionCommands.JoinSession("TOOLONG", "alice", null), from("c1"));

        verifyNoInteractions(registry);
        assertEquals(1, notifier.toConnection("c1", OutboundEvent.SESSION_ERROR).size());
    }

    @Test
    void nonObjectStateIsRejected() {
        controller.applyStateUpdate(new SessionCommands.ApplyStateUpdate("AB12", TextNode.valueOf("x")), from("c1"));

        verifyNoInteractions(registry);
        assertEquals(1, notifier.toConnection("c1", OutboundEvent.SESSION_ERROR).size());
    }

    @Test
    void stateUpdateIsForwardedWithConnection() {
        var state = new ObjectMapper().createObjectNode().put("player", "one");

        controller.applyStateUpdate(new SessionCommands.ApplyStateUpdate("AB12", state), from("c1"));

        verify(registry).applyStateUpdate("AB12", "c1", state);
    }

    @Test
    void overlongChatIsRejected() {
        controller.sendMessage(new SessionCommands.SendMessage("AB12", "x".repeat(501), "alice"), from("c1"));

        verifyNoInteractions(registry);
        assertEquals(1, notifier.toConnection("c1", OutboundEvent.SESSION_ERROR).size());
    }

    @Test
    void blankChatIsRejected() {
        controller.sendMessage(new SessionCommands.SendMessage("AB12", "   ", "alice"), from("c1"));

        verify(registry, never()).recordChatMessage(anyString(), anyString(), anyString());
    }

    @Test
    void sessionOverPassesParsedClaim() {
        controller.sessionOver(new SessionCommands.SessionOver("AB12", "opponent"), from("c1"));

        verify(arbiter).handleSessionOver("AB12", "c1", WinnerClaim.OPPONENT);
    }

    @Test
    void sessionOverWithoutClaimStillReachesArbiter() {
        controller.sessionOver(new SessionCommands.SessionOver("AB12", null), from("c1"));

        verify(arbiter).handleSessionOver("AB12", "c1", null);
    }

    @Test
    void unknownClaimIsRejected() {
        controller.sessionOver(new SessionCommands.SessionOver("AB12", "me!"), from("c1"));

        verifyNoInteractions(arbiter);
        assertEquals(1, notifier.toConnection("c1", OutboundEvent.SESSION_ERROR).size());
    }

    @Test
    void nullPayloadIsIgnored() {
        controller.markRead(null, from("c1"));

        verifyNoInteractions(registry);
        verify(registry, never()).markRead(any(), any());
    }
}
