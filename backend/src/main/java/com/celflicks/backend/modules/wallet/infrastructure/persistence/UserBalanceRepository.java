package com.celflicks.backend.modules.wallet.infrastructure.persistence;

import java.util.UUID;

import com.celflicks.backend.modules.wallet.domain.UserBalance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserBalanceRepository extends JpaRepository<UserBalance, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserBalance b where b.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
