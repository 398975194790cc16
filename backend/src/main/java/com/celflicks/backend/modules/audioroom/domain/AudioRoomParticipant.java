package com.celflicks.backend.modules.audioroom.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.celflicks.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * 방 참여 기록. (room_id, user_id)는 유일하다.
 */
@Entity
@Table(name = "audio_room_participant")
@EntityListeners(AuditingEntityListener.class)
public class AudioRoomParticipant {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false, updatable = false)
    private AudioRoom room;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @CreatedDate
    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    protected AudioRoomParticipant() {
    }

    public AudioRoomParticipant(AudioRoom room, AppUser user) {
        this.room = room;
        this.user = user;
    }

    public UUID getId() {
        return id;
    }

    public AudioRoom getRoom() {
        return room;
    }

    public AppUser getUser() {
        return user;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }
}
