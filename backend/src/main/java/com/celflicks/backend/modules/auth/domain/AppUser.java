package com.celflicks.backend.modules.auth.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.celflicks.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

/**
 * 계정 식별 레코드. id는 가입 시점에 미리 발급되어 프로비저닝 재시도 사이에서 동일하게 유지된다.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity implements Persistable<UUID> {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_user_meta_data", columnDefinition = "jsonb")
    private Map<String, Object> rawUserMetaData = new HashMap<>();

    protected AppUser() {
    }

    public AppUser(UUID id) {
        this.id = id;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public Map<String, Object> getRawUserMetaData() {
        return rawUserMetaData;
    }

    public void setRawUserMetaData(Map<String, Object> rawUserMetaData) {
        this.rawUserMetaData = rawUserMetaData;
    }
}
