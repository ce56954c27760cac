package github.sarthakdev143.beat_cutter.controller;

import github.sarthakdev143.beat_cutter.dto.ProcessSessionRequest;
import github.sarthakdev143.beat_cutter.dto.SessionSubmissionResponse;
import github.sarthakdev143.beat_cutter.dto.UploadedFileResponse;
import github.sarthakdev143.beat_cutter.dto.UploadedFilesResponse;
import github.sarthakdev143.beat_cutter.model.SessionState;
import github.sarthakdev143.beat_cutter.model.SessionStatus;
import github.sarthakdev143.beat_cutter.service.BeatSyncService;
import github.sarthakdev143.beat_cutter.service.impl.UploadStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/beat-sync")
public class BeatSyncController {

    private static final Logger logger = LoggerFactory.getLogger(BeatSyncController.class);
    private static final String CLIENT_ID_HEADER = "X-Client-Id";
    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final BeatSyncService beatSyncService;
    private final UploadStorageService uploadStorage;

    public BeatSyncController(BeatSyncService beatSyncService, UploadStorageService uploadStorage) {
        this.beatSyncService = beatSyncService;
        this.uploadStorage = uploadStorage;
    }

    @PostMapping(value = "/uploads/audio", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadAudio(@RequestParam("audio") MultipartFile audio) {
        try {
            validateMimeType("audio", audio, "audio/");
            return ResponseEntity.ok(uploadStorage.store("audio", audio));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Audio upload failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Failed to upload audio.");
        }
    }

    @PostMapping(value = "/uploads/videos", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadVideos(@RequestParam("videos") List<MultipartFile> videos) {
        try {
            if (videos == null || videos.isEmpty()) {
                throw new IllegalArgumentException("At least one video file is required.");
            }
            for (MultipartFile video : videos) {
                validateMimeType("videos", video, "video/");
            }

            List<UploadedFileResponse> stored = new ArrayList<>();
            for (MultipartFile video : videos) {
                stored.add(uploadStorage.store("videos", video));
            }
            return ResponseEntity.ok(UploadedFilesResponse.of(stored));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Video upload failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Failed to upload videos.");
        }
    }

    @PostMapping(value = "/sessions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submitSession(
            @RequestBody ProcessSessionRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId) {
        try {
            String sessionId = beatSyncService.submitSession(request, clientId);
            return ResponseEntity.accepted()
                    .body(new SessionSubmissionResponse(
                            sessionId,
                            SessionState.QUEUED,
                            "Session accepted. Poll /api/beat-sync/sessions/{sessionId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Session submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start video processing. Please try again.");
        }
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<?> getStatus(@PathVariable String sessionId) {
        return beatSyncService.getSessionStatus(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Session not found for id: " + sessionId));
    }

    @GetMapping("/sessions/{sessionId}/output")
    public ResponseEntity<?> downloadOutput(@PathVariable String sessionId) {
        Optional<SessionStatus> status = beatSyncService.getSessionStatus(sessionId);
        if (status.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Session not found for id: " + sessionId);
        }

        SessionStatus current = status.get();
        if (current.state() == SessionState.FAILED) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(current.message());
        }
        if (current.state() != SessionState.COMPLETED) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body("Session " + sessionId + " is still " + current.state().name().toLowerCase(Locale.ROOT) + ".");
        }

        Path outputPath = beatSyncService.outputPath(sessionId);
        if (!Files.isRegularFile(outputPath)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("File not found");
        }
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename("final-video-" + sessionId + ".mp4")
                        .build()
                        .toString())
                .body(new FileSystemResource(outputPath));
    }

    private void validateMimeType(String fieldName, MultipartFile file, String expectedPrefix) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " file must not be empty.");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(expectedPrefix)) {
            throw new IllegalArgumentException(fieldName + " must have a " + expectedPrefix + "* content type.");
        }
    }
}
