package com.celflicks.backend.modules.audioroom.application;

import java.util.List;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.global.persistence.UniqueViolations;
import com.celflicks.backend.modules.audioroom.domain.AudioRoom;
import com.celflicks.backend.modules.audioroom.domain.AudioRoomParticipant;
import com.celflicks.backend.modules.audioroom.domain.RoomParticipantView;
import com.celflicks.backend.modules.audioroom.infrastructure.persistence.AudioRoomParticipantRepository;
import com.celflicks.backend.modules.audioroom.infrastructure.persistence.AudioRoomRepository;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 오디오 룸 CRUD와 참여/이탈. 조회는 누구나 가능하고, 수정/삭제는 호스트만,
 * 참여/이탈은 호출한 사용자 자신의 참여 행에만 적용된다.
 */
@Service
@Transactional
public class AudioRoomService {

    static final String PARTICIPANT_CONSTRAINT = "uq_audio_room_participant_room_user";

    private static final Logger log = LoggerFactory.getLogger(AudioRoomService.class);

    private final AudioRoomRepository roomRepository;
    private final AudioRoomParticipantRepository participantRepository;
    private final AppUserRepository appUserRepository;

    public AudioRoomService(
            AudioRoomRepository roomRepository,
            AudioRoomParticipantRepository participantRepository,
            AppUserRepository appUserRepository
    ) {
        this.roomRepository = roomRepository;
        this.participantRepository = participantRepository;
        this.appUserRepository = appUserRepository;
    }

    public AudioRoom createRoom(UUID hostId, String title) {
        AppUser host = appUserRepository.findById(hostId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        AudioRoom room = roomRepository.save(new AudioRoom(host, normalizeTitle(title)));
        log.info("User {} opened audio room {}", hostId, room.getId());
        return room;
    }

    @Transactional(readOnly = true)
    public List<AudioRoom> listRooms() {
        return roomRepository.findAllNewestFirst();
    }

    @Transactional(readOnly = true)
    public AudioRoom getRoom(UUID roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROOM_NOT_FOUND"));
    }

    public AudioRoom renameRoom(UUID actorId, UUID roomId, String title) {
        AudioRoom room = requireHostedRoom(actorId, roomId);
        room.rename(normalizeTitle(title));
        return roomRepository.saveAndFlush(room);
    }

    public void deleteRoom(UUID actorId, UUID roomId) {
        AudioRoom room = requireHostedRoom(actorId, roomId);
        roomRepository.delete(room);
        log.info("User {} closed audio room {}", actorId, roomId);
    }

    public AudioRoomParticipant joinRoom(UUID userId, UUID roomId) {
        AudioRoom room = getRoom(roomId);
        if (participantRepository.findByRoomIdAndUserId(roomId, userId).isPresent()) {
            throw alreadyJoined();
        }
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        try {
            return participantRepository.saveAndFlush(new AudioRoomParticipant(room, user));
        } catch (DataIntegrityViolationException ex) {
            if (UniqueViolations.isConstraintViolation(ex, PARTICIPANT_CONSTRAINT)) {
                throw alreadyJoined();
            }
            throw ex;
        }
    }

    public void leaveRoom(UUID userId, UUID roomId) {
        getRoom(roomId);
        AudioRoomParticipant participant = participantRepository.findByRoomIdAndUserId(roomId, userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "NOT_JOINED", "not a participant of this room"));
        participantRepository.delete(participant);
    }

    /**
     * Participants with their profile, in join order. Unknown rooms are reported as 404.
     */
    @Transactional(readOnly = true)
    public List<RoomParticipantView> getRoomParticipants(UUID roomId) {
        if (!roomRepository.existsById(roomId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "ROOM_NOT_FOUND");
        }
        return participantRepository.findViewsByRoomId(roomId);
    }

    private AudioRoom requireHostedRoom(UUID actorId, UUID roomId) {
        AudioRoom room = getRoom(roomId);
        if (!room.isHostedBy(actorId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROOM_HOST_REQUIRED", "only the host can change this room");
        }
        return room;
    }

    private static String normalizeTitle(String title) {
        String trimmed = title == null ? "" : title.trim();
        if (trimmed.isEmpty() || trimmed.length() > AudioRoom.TITLE_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROOM_TITLE",
                    "title must be 1-" + AudioRoom.TITLE_MAX_LENGTH + " characters");
        }
        return trimmed;
    }

    private static ProblemException alreadyJoined() {
        return new ProblemException(HttpStatus.CONFLICT, "ALREADY_JOINED", "already joined this room");
    }
}
