package com.celflicks.backend.modules.profile.domain;

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

/**
 * 사용자 공개 프로필. 계정과 1:1이며 id는 계정 id를 그대로 사용한다.
 * username은 대소문자를 보존하지만 유일성은 대소문자 구분 없이 판단한다(uq_profile_username_lower).
 */
@Entity
@Table(name = "profile")
public class Profile extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "id")
    private AppUser user;

    @Column(name = "username", nullable = false, length = 20)
    private String username;

    @Column(name = "avatar_url", nullable = false)
    private String avatarUrl;

    protected Profile() {
    }

    public Profile(AppUser user, String username, String avatarUrl) {
        this.user = user;
        this.username = username;
        this.avatarUrl = avatarUrl;
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }
}
