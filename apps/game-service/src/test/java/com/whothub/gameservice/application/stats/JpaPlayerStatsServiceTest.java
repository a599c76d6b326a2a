package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.infrastructure.persistence.entity.MatchStatus;
import com.whothub.gameservice.infrastructure.persistence.repository.PaymentRecordRepository;
import com.whothub.gameservice.infrastructure.persistence.repository.PlayerAccountRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(JpaPlayerStatsService.class)
class JpaPlayerStatsServiceTest {

    @Autowired
    private JpaPlayerStatsService service;

    @Autowired
    private PlayerAccountRepository playerRepo;

    @Autowired
    private PaymentRecordRepository paymentRepo;

    @Test
    void createUserIfNotExistsIsIdempotent() {
        PlayerStatsView first = service.createUserIfNotExists("0xabc");
        PlayerStatsView second = service.createUserIfNotExists("0xabc");

        assertEquals(0, first.xp());
        assertEquals(first.address(), second.address());
        assertEquals(1, playerRepo.count());
    }

    @Test
    void updateXpCreatesMissingPlayerAndAccumulates() {
        service.updateUserXP("0xwin", 10, true);
        service.updateUserXP("0xwin", 10, true);
        service.updateUserXP("0xwin", 0, false);

        PlayerStatsView v = service.getUser("0xwin").orElseThrow();
        assertEquals(20, v.xp());
        assertEquals(2, v.wins());
        assertEquals(3, v.gamesPlayed());
        assertEquals(MatchStatus.LOST, v.lastMatchStatus());
    }

    @Test
    void leaderboardIsOrderedByXpAndLimited() {
        service.updateUserXP("0x1", 10, true);
        service.updateUserXP("0x2", 30, true);
        service.updateUserXP("0x3", 20, true);

        List<PlayerStatsView> board = service.getLeaderboard(2);

        assertEquals(List.of("0x2", "0x3"), board.stream().map(PlayerStatsView::address).toList());
    }

    @Test
    void paymentIsRecordedOncePerTransaction() {
        assertTrue(service.recordPayment("0xtx", "0xabc", "0.5", "computer_retry"));
        assertFalse(service.recordPayment("0xtx", "0xabc", "0.5", "computer_retry"));

        assertEquals(1, paymentRepo.findByUserAddress("0xabc").size());
    }

    @Test
    void matchStatusCanBeSetToPaidRetry() {
        service.updateUserXP("0xabc", 0, false);
        service.updateUserMatchStatus("0xabc", MatchStatus.PAID_RETRY);

        assertEquals(MatchStatus.PAID_RETRY, service.getUser("0xabc").orElseThrow().lastMatchStatus());
    }
}
