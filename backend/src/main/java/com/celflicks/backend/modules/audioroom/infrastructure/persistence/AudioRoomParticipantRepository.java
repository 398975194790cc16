package com.celflicks.backend.modules.audioroom.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.celflicks.backend.modules.audioroom.domain.AudioRoomParticipant;
import com.celflicks.backend.modules.audioroom.domain.RoomParticipantView;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AudioRoomParticipantRepository extends JpaRepository<AudioRoomParticipant, UUID> {

    @Query("""
            select new com.celflicks.backend.modules.audioroom.domain.RoomParticipantView(
                       p.user.id, profile.username, profile.avatarUrl, p.joinedAt)
              from AudioRoomParticipant p, Profile profile
             where profile.id = p.user.id
               and p.room.id = :roomId
             order by p.joinedAt asc, p.id asc
            """)
    List<RoomParticipantView> findViewsByRoomId(@Param("roomId") UUID roomId);

    @Query("select p from AudioRoomParticipant p where p.room.id = :roomId and p.user.id = :userId")
    Optional<AudioRoomParticipant> findByRoomIdAndUserId(@Param("roomId") UUID roomId, @Param("userId") UUID userId);
}
