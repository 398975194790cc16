package com.celflicks.backend.modules.audioroom.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.celflicks.backend.global.security.SecurityUtils;
import com.celflicks.backend.modules.audioroom.application.AudioRoomService;
import com.celflicks.backend.modules.audioroom.domain.AudioRoom;
import com.celflicks.backend.modules.audioroom.domain.AudioRoomParticipant;
import com.celflicks.backend.modules.audioroom.presentation.dto.AudioRoomRequest;
import com.celflicks.backend.modules.audioroom.presentation.dto.AudioRoomResponse;
import com.celflicks.backend.modules.audioroom.presentation.dto.JoinRoomResponse;
import com.celflicks.backend.modules.audioroom.presentation.dto.RoomParticipantResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/audio-rooms")
public class AudioRoomController {

    private final AudioRoomService audioRoomService;

    public AudioRoomController(AudioRoomService audioRoomService) {
        this.audioRoomService = audioRoomService;
    }

    @Operation(summary = "오디오 룸 생성", description = "호출한 사용자가 호스트가 됩니다.")
    @PostMapping
    public ResponseEntity<AudioRoomResponse> createRoom(@Valid @RequestBody AudioRoomRequest request) {
        AudioRoom room = audioRoomService.createRoom(SecurityUtils.getCurrentUserId(), request.title());
        return ResponseEntity.created(URI.create("/audio-rooms/" + room.getId()))
                .body(AudioRoomResponse.from(room));
    }

    @GetMapping
    public ResponseEntity<List<AudioRoomResponse>> listRooms() {
        List<AudioRoomResponse> rooms = audioRoomService.listRooms().stream()
                .map(AudioRoomResponse::from)
                .toList();
        return ResponseEntity.ok(rooms);
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<AudioRoomResponse> getRoom(@PathVariable("roomId") UUID roomId) {
        return ResponseEntity.ok(AudioRoomResponse.from(audioRoomService.getRoom(roomId)));
    }

    @Operation(summary = "오디오 룸 수정", description = "호스트만 수정할 수 있습니다.")
    @PatchMapping("/{roomId}")
    public ResponseEntity<AudioRoomResponse> updateRoom(
            @PathVariable("roomId") UUID roomId,
            @Valid @RequestBody AudioRoomRequest request
    ) {
        AudioRoom room = audioRoomService.renameRoom(SecurityUtils.getCurrentUserId(), roomId, request.title());
        return ResponseEntity.ok(AudioRoomResponse.from(room));
    }

    @Operation(summary = "오디오 룸 삭제", description = "호스트만 삭제할 수 있습니다.")
    @DeleteMapping("/{roomId}")
    public ResponseEntity<Void> deleteRoom(@PathVariable("roomId") UUID roomId) {
        audioRoomService.deleteRoom(SecurityUtils.getCurrentUserId(), roomId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "참여자 목록", description = "참여 순서대로 프로필 정보와 함께 반환합니다.")
    @GetMapping("/{roomId}/participants")
    public ResponseEntity<List<RoomParticipantResponse>> participants(@PathVariable("roomId") UUID roomId) {
        List<RoomParticipantResponse> participants = audioRoomService.getRoomParticipants(roomId).stream()
                .map(RoomParticipantResponse::from)
                .toList();
        return ResponseEntity.ok(participants);
    }

    @PostMapping("/{roomId}/participants")
    public ResponseEntity<JoinRoomResponse> join(@PathVariable("roomId") UUID roomId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        AudioRoomParticipant participant = audioRoomService.joinRoom(userId, roomId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new JoinRoomResponse(roomId, userId, participant.getJoinedAt()));
    }

    @DeleteMapping("/{roomId}/participants/me")
    public ResponseEntity<Void> leave(@PathVariable("roomId") UUID roomId) {
        audioRoomService.leaveRoom(SecurityUtils.getCurrentUserId(), roomId);
        return ResponseEntity.noContent().build();
    }
}
