package com.celflicks.backend.modules.wallet.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.celflicks.backend.modules.wallet.domain.WalletTransaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    @Query("""
            select t
              from WalletTransaction t
             where t.user.id = :userId
             order by t.createdAt desc, t.id
            """)
    List<WalletTransaction> findByUserIdNewestFirst(@Param("userId") UUID userId);

    long countByUserId(UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from WalletTransaction t where t.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
