package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import github.sarthakdev143.beat_cutter.dto.UploadedFileResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Places uploaded files in the uploads directory under generated names and resolves those names
 * back to paths for processing requests.
 */
@Component
public class UploadStorageService {

    private static final Logger logger = LoggerFactory.getLogger(UploadStorageService.class);
    private static final Pattern STORED_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,200}$");
    private static final Pattern EXTENSION_PATTERN = Pattern.compile("^\\.[a-z0-9]{1,8}$");

    private final Path uploadsDir;

    @Autowired
    public UploadStorageService(BeatCutterProperties properties) {
        this(properties.uploadsDir());
    }

    public UploadStorageService(Path uploadsDir) {
        this.uploadsDir = uploadsDir.toAbsolutePath().normalize();
    }

    public UploadedFileResponse store(String fieldName, MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " file is required.");
        }

        Files.createDirectories(uploadsDir);
        String storedName = fieldName + "-" + UUID.randomUUID() + extensionOf(file.getOriginalFilename());
        Path target = uploadsDir.resolve(storedName);
        file.transferTo(target);
        logger.info("Stored upload {} as {} ({} bytes)", file.getOriginalFilename(), storedName, file.getSize());
        return new UploadedFileResponse(storedName, file.getOriginalFilename(), file.getSize());
    }

    public Path resolve(String storedName) {
        if (storedName == null || !STORED_NAME_PATTERN.matcher(storedName).matches() || storedName.contains("..")) {
            throw new IllegalArgumentException("Invalid stored file name: " + storedName);
        }
        return uploadsDir.resolve(storedName);
    }

    private String extensionOf(String originalName) {
        if (originalName == null) {
            return "";
        }
        int dot = originalName.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        String extension = originalName.substring(dot).toLowerCase(Locale.ROOT);
        return EXTENSION_PATTERN.matcher(extension).matches() ? extension : "";
    }
}
