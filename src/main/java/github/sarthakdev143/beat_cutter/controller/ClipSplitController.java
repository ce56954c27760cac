package github.sarthakdev143.beat_cutter.controller;

import github.sarthakdev143.beat_cutter.dto.SplitClipsRequest;
import github.sarthakdev143.beat_cutter.dto.UploadedFileResponse;
import github.sarthakdev143.beat_cutter.dto.VideoFileReference;
import github.sarthakdev143.beat_cutter.service.ClipSplitService;
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
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-length clip splitting. Requests run synchronously and answer once every clip is written.
 */
@RestController
@RequestMapping("/api/clips")
public class ClipSplitController {

    private static final Logger logger = LoggerFactory.getLogger(ClipSplitController.class);
    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final ClipSplitService clipSplitService;
    private final UploadStorageService uploadStorage;

    public ClipSplitController(ClipSplitService clipSplitService, UploadStorageService uploadStorage) {
        this.clipSplitService = clipSplitService;
        this.uploadStorage = uploadStorage;
    }

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<?> split(
            @RequestParam(value = "videos", required = false) List<MultipartFile> videos,
            @RequestParam(value = "duration", required = false) Double duration,
            @RequestParam(value = "resolution", required = false) String resolution,
            @RequestHeader(value = "X-Client-Id", required = false) String clientId) {
        try {
            if (videos == null || videos.isEmpty()) {
                throw new IllegalArgumentException("No video files uploaded.");
            }
            double clipDuration = SplitClipsRequest.requireValidClipDuration(duration);
            for (MultipartFile video : videos) {
                String contentType = video.getContentType();
                if (video.isEmpty() || contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("video/")) {
                    throw new IllegalArgumentException("videos must have a video/* content type.");
                }
            }

            List<VideoFileReference> stored = new ArrayList<>();
            for (MultipartFile video : videos) {
                UploadedFileResponse upload = uploadStorage.store("videos", video);
                stored.add(new VideoFileReference(upload.filename(), upload.originalName()));
            }
            return ResponseEntity.ok(clipSplitService.split(new SplitClipsRequest(stored, clipDuration, resolution), clientId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Clip splitting was interrupted.");
        } catch (Exception e) {
            logger.error("Clip splitting failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to trim videos: " + e.getMessage());
        }
    }

    @GetMapping("/{splitId}/{filename}")
    public ResponseEntity<?> downloadClip(@PathVariable String splitId, @PathVariable String filename) {
        Optional<Path> clip = clipSplitService.clipPath(splitId, filename);
        if (clip.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Clip not found");
        }
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(filename)
                        .build()
                        .toString())
                .body(new FileSystemResource(clip.get()));
    }
}
