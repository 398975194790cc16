package com.celflicks.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * created_at / updated_at 공통 컬럼. 두 값 모두 JPA 감사 리스너가 채운다.
 *
 * <p>id를 미리 발급하는 엔터티는 {@link #isNew()}로 {@code Persistable}을 구현해 save가 merge 대신 persist를 타게 한다.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AbstractTimestampedEntity {

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 아직 INSERT되지 않았으면 true. 감사 리스너가 persist 직전에 created_at을 채운다.
     */
    public boolean isNew() {
        return createdAt == null;
    }
}
