package com.celflicks.backend.modules.audioroom.domain;

import java.util.UUID;

import com.celflicks.backend.global.jpa.AbstractTimestampedEntity;
import com.celflicks.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "audio_room")
public class AudioRoom extends AbstractTimestampedEntity {

    public static final int TITLE_MAX_LENGTH = 200;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "host_id", nullable = false, updatable = false)
    private AppUser host;

    protected AudioRoom() {
    }

    public AudioRoom(AppUser host, String title) {
        this.host = host;
        this.title = title;
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void rename(String title) {
        this.title = title;
    }

    public AppUser getHost() {
        return host;
    }

    public boolean isHostedBy(UUID userId) {
        return host != null && host.getId().equals(userId);
    }
}
