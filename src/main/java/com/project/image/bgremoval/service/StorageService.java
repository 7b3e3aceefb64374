package com.project.image.bgremoval.service;

import com.project.image.bgremoval.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String RESULT_SUFFIX = "_nobg.png";
    private static final Pattern RESULT_NAME =
            Pattern.compile("\\d{8}_\\d{6}_\\d{3}_[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}_nobg\\.png");

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        String filename = uniquePrefix() + "_" + safeBase;
        Path target = rootDir.resolve(filename);
        try (var in = file.getInputStream()) {
            Files.copy(in, target);
            log.debug("Stored upload {} as {}", original, filename);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    public StoredFile storeResultImage(byte[] pngBytes) {
        String filename = uniquePrefix() + RESULT_SUFFIX;
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, pngBytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debug("Stored result image {} ({} bytes)", filename, pngBytes.length);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    // Timestamp for ordering, UUID so that files stored within the same millisecond never clash.
    private static String uniquePrefix() {
        return TIMESTAMP.format(LocalDateTime.now()) + "_" + UUID.randomUUID();
    }

    /**
     * Looks up a result image written by {@link #storeResultImage}. Names that were not produced by
     * this service, or that point outside the upload directory, are not resolved.
     */
    public Optional<Path> findResultImage(String filename) {
        if (filename == null || !RESULT_NAME.matcher(filename).matches()) {
            log.warn("Rejected result lookup for name: {}", filename);
            return Optional.empty();
        }
        Path candidate = rootDir.resolve(filename).normalize();
        if (!candidate.startsWith(rootDir) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
