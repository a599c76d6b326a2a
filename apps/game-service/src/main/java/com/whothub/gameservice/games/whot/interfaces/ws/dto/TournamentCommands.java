package com.whothub.gameservice.games.whot.interfaces.ws.dto;

import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.domain.constants.GameMessages;

/**
 * 赛事相关入站命令（/app/...）。
 */
public final class TournamentCommands {

    private TournamentCommands() {
    }

    public sealed interface TournamentCommand
            permits CreateTournament, JoinTournament, ReconnectTournament, RequestMatchInfo {

        void validate();
    }

    /** create_tournament；size 的取值范围由引擎校验 */
    public record CreateTournament(Integer size, String name) implements TournamentCommand {
        @Override
        public void validate() {
            if (size == null) {
                throw CoordinationException.invalidInput(GameMessages.formatMissingField("size"));
            }
        }
    }

    /** join_tournament */
    public record JoinTournament(String tournamentId, String storedId, String name) implements TournamentCommand {
        @Override
        public void validate() {
            SessionCommands.requireText(tournamentId, "tournamentId");
            SessionCommands.requireText(storedId, "storedId");
        }
    }

    /** reconnect_tournament */
    public record ReconnectTournament(String tournamentId, String storedId) implements TournamentCommand {
        @Override
        public void validate() {
            SessionCommands.requireText(tournamentId, "tournamentId");
            SessionCommands.requireText(storedId, "storedId");
        }
    }

    /** request_match_info */
    public record RequestMatchInfo(String tournamentId, String matchId) implements TournamentCommand {
        @Override
        public void validate() {
            SessionCommands.requireText(tournamentId, "tournamentId");
            SessionCommands.requireText(matchId, "matchId");
        }
    }
}
