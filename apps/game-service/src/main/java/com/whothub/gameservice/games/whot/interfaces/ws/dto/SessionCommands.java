package com.whothub.gameservice.games.whot.interfaces.ws.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.domain.constants.GameMessages;
import com.whothub.gameservice.games.whot.domain.enums.WinnerClaim;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;

/**
 * 对局相关入站命令（/app/...）。每条命令在进入主循环前先 validate()。
 */
public final class SessionCommands {

    private SessionCommands() {
    }

    public sealed interface SessionCommand
            permits JoinSession, ApplyStateUpdate, SendMessage, MarkRead, ConfirmOnline, SessionOver {

        String sessionCode();

        /** 校验失败抛 INVALID_INPUT */
        void validate();
    }

    /** join_session */
    public record JoinSession(String sessionCode, String storedId, TournamentLink tournamentLink)
            implements SessionCommand {
        @Override
        public void validate() {
            if (sessionCode == null || sessionCode.length() != 4) {
                throw CoordinationException.invalidInput(GameMessages.INVALID_SESSION_CODE);
            }
            requireText(storedId, "storedId");
        }
    }

    /** apply_state_update：state 必须是 JSON 对象 */
    public record ApplyStateUpdate(String sessionCode, JsonNode state) implements SessionCommand {
        @Override
        public void validate() {
            requireText(sessionCode, "sessionCode");
            if (state == null || !state.isObject()) {
                throw CoordinationException.invalidInput(GameMessages.formatMissingField("state"));
            }
        }

        public ObjectNode stateObject() {
            return (ObjectNode) state;
        }
    }

    /** send_message */
    public record SendMessage(String sessionCode, String text, String senderId) implements SessionCommand {
        @Override
        public void validate() {
            requireText(sessionCode, "sessionCode");
            requireText(senderId, "senderId");
            if (text == null || text.isBlank()) {
                throw CoordinationException.invalidInput(GameMessages.EMPTY_MESSAGE);
            }
        }

        public void requireWithin(int maxLength) {
            if (text.length() > maxLength) {
                throw CoordinationException.invalidInput(GameMessages.formatMessageTooLong(maxLength));
            }
        }
    }

    /** mark_read */
    public record MarkRead(String sessionCode, String readerId) implements SessionCommand {
        @Override
        public void validate() {
            requireText(sessionCode, "sessionCode");
            requireText(readerId, "readerId");
        }
    }

    /** confirm_online_state */
    public record ConfirmOnline(String sessionCode, String storedId) implements SessionCommand {
        @Override
        public void validate() {
            requireText(sessionCode, "sessionCode");
            requireText(storedId, "storedId");
        }
    }

    /**
     * session_over：winnerClaim 可缺省（只结束不判胜负），给了就必须是 user / opponent。
     */
    public record SessionOver(String sessionCode, String winnerClaim) implements SessionCommand {
        @Override
        public void validate() {
            requireText(sessionCode, "sessionCode");
            if (winnerClaim != null && WinnerClaim.fromWire(winnerClaim) == null) {
                throw CoordinationException.invalidInput("winnerClaim must be 'user' or 'opponent'");
            }
        }

        public WinnerClaim claim() {
            return WinnerClaim.fromWire(winnerClaim);
        }
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw CoordinationException.invalidInput(GameMessages.formatMissingField(field));
        }
    }
}
