package com.whothub.gameservice.infrastructure.persistence.repository;

import com.whothub.gameservice.infrastructure.persistence.entity.PlayerAccount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 玩家战绩 Repository
 */
@Repository
public interface PlayerAccountRepository extends JpaRepository<PlayerAccount, String> {

    /** 按经验值倒序（排行榜） */
    List<PlayerAccount> findAllByOrderByXpDesc(Pageable pageable);
}
