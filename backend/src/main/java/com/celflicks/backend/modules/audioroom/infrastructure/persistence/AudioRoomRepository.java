package com.celflicks.backend.modules.audioroom.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.celflicks.backend.modules.audioroom.domain.AudioRoom;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface AudioRoomRepository extends JpaRepository<AudioRoom, UUID> {

    @Query("select r from AudioRoom r order by r.createdAt desc, r.id")
    List<AudioRoom> findAllNewestFirst();
}
