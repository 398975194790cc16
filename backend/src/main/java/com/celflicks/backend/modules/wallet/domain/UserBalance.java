package com.celflicks.backend.modules.wallet.domain;

import java.math.BigDecimal;
import java.util.UUID;

import com.celflicks.backend.global.jpa.AbstractTimestampedEntity;
import com.celflicks.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapsId;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "user_balance")
public class UserBalance extends AbstractTimestampedEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private AppUser user;

    @Column(name = "balance", nullable = false, precision = 18, scale = 2)
    private BigDecimal balance;

    protected UserBalance() {
    }

    public UserBalance(AppUser user, BigDecimal openingBalance) {
        this.user = user;
        this.balance = openingBalance;
    }

    public UUID getUserId() {
        return userId;
    }

    public AppUser getUser() {
        return user;
    }

    public BigDecimal getBalance() {
        return balance;
    }
}
