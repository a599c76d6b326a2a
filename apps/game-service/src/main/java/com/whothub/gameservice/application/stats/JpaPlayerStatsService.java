package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.infrastructure.persistence.entity.MatchStatus;
import com.whothub.gameservice.infrastructure.persistence.entity.PaymentRecord;
import com.whothub.gameservice.infrastructure.persistence.entity.PlayerAccount;
import com.whothub.gameservice.infrastructure.persistence.repository.PaymentRecordRepository;
import com.whothub.gameservice.infrastructure.persistence.repository.PlayerAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPlayerStatsService implements PlayerStatsService {

    private final PlayerAccountRepository playerRepo;
    private final PaymentRecordRepository paymentRepo;

    @Override
    @Transactional(readOnly = true)
    public Optional<PlayerStatsView> getUser(String address) {
        return playerRepo.findById(address).map(PlayerStatsView::of);
    }

    @Override
    @Transactional
    public PlayerStatsView createUserIfNotExists(String address) {
        return PlayerStatsView.of(loadOrCreate(address));
    }

    /**
     * 玩家首次对局时可能还没有记录，这里先建档再累加。
     */
    @Override
    @Transactional
    public void updateUserXP(String address, int xpDelta, boolean isWin) {
        PlayerAccount account = loadOrCreate(address);
        account.applyResult(xpDelta, isWin);
        playerRepo.save(account);
        log.info("战绩更新: address={}, xpDelta={}, win={}, xp={}", address, xpDelta, isWin, account.getXp());
    }

    @Override
    @Transactional
    public void updateUserMatchStatus(String address, MatchStatus status) {
        PlayerAccount account = loadOrCreate(address);
        account.setLastMatchStatus(status);
        playerRepo.save(account);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlayerStatsView> getLeaderboard(int limit) {
        return playerRepo.findAllByOrderByXpDesc(PageRequest.of(0, Math.max(1, limit)))
                .stream().map(PlayerStatsView::of).toList();
    }

    @Override
    @Transactional
    public boolean recordPayment(String txHash, String userAddress, String amount, String type) {
        if (paymentRepo.existsById(txHash)) {
            log.info("重复的付费记录，忽略: txHash={}", txHash);
            return false;
        }
        paymentRepo.save(PaymentRecord.builder()
                .txHash(txHash)
                .userAddress(userAddress)
                .amount(amount)
                .type(type)
                .build());
        log.info("付费已记录: txHash={}, user={}, type={}", txHash, userAddress, type);
        return true;
    }

    private PlayerAccount loadOrCreate(String address) {
        return playerRepo.findById(address)
                .orElseGet(() -> playerRepo.save(PlayerAccount.builder().address(address).build()));
    }
}
