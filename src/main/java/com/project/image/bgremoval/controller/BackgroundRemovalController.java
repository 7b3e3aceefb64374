package com.project.image.bgremoval.controller;

import com.project.image.bgremoval.DTOs.RemovalResult;
import com.project.image.bgremoval.core.PixelBuffer;
import com.project.image.bgremoval.exceptions.BackgroundRemovalException;
import com.project.image.bgremoval.service.BackgroundRemovalService;
import com.project.image.bgremoval.service.ImageCodec;
import com.project.image.bgremoval.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@Controller
@Validated
public class BackgroundRemovalController {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRemovalController.class);

    static final List<String> SUPPORTED_FORMATS = List.of("image/png", "image/jpeg", "image/webp");
    static final long MAX_UPLOAD_BYTES = 5L * 1024 * 1024;
    static final int MAX_DIMENSION = 4000;
    static final String DOWNLOAD_NAME = "removed-background.png";

    private final BackgroundRemovalService removalService;
    private final StorageService storageService;
    private final ImageCodec imageCodec;

    @Value("${app.removal.default-threshold:30}")
    private int defaultThreshold;

    @Value("${app.removal.default-blur-radius:3}")
    private int defaultBlurRadius;

    public BackgroundRemovalController(BackgroundRemovalService removalService, StorageService storageService,
                                       ImageCodec imageCodec) {
        this.removalService = removalService;
        this.storageService = storageService;
        this.imageCodec = imageCodec;
    }

    @GetMapping("/remove-background")
    public String showForm(Model model) {
        model.addAttribute("defaultThreshold", defaultThreshold);
        model.addAttribute("defaultBlurRadius", defaultBlurRadius);
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "remove";
    }

    @PostMapping(value = "/remove-background", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "threshold", defaultValue = "30")
            @Min(value = 1, message = "Sensitivity must be at least 1")
            @Max(value = 100, message = "Sensitivity cannot exceed 100")
            int threshold,
            @RequestParam(name = "blurRadius", defaultValue = "3")
            @Min(value = 0, message = "Edge smoothness cannot be negative")
            @Max(value = 10, message = "Edge smoothness cannot exceed 10")
            int blurRadius,
            Model model
    ) throws IOException {

        validateUploadedFile(file);

        log.info("Processing file: {} ({}KB), threshold: {}, blurRadius: {}",
                file.getOriginalFilename(), file.getSize() / 1024, threshold, blurRadius);

        try {
            // Only decodable images within the size limit are kept on disk
            PixelBuffer input = loadAndValidateImage(file);

            var storedOriginal = storageService.store(file);
            log.debug("File stored as: {}", storedOriginal.filename());

            RemovalResult result = removalService.removeBackground(input, threshold, blurRadius);
            var resultStored = storageService.storeResultImage(result.resultPng());

            populateResultModel(model, storedOriginal, resultStored, result);

            log.info("Background removed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (BackgroundRemovalException e) {
            log.warn("Background removal failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("defaultThreshold", threshold);
            model.addAttribute("defaultBlurRadius", blurRadius);
            model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
            return "remove";
        }
    }

    @GetMapping("/remove-background/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        return storageService.findResultImage(filename)
                .<ResponseEntity<Resource>>map(path -> {
                    log.debug("Serving download of {}", filename);
                    return ResponseEntity.ok()
                            .contentType(MediaType.IMAGE_PNG)
                            .header(HttpHeaders.CONTENT_DISPOSITION,
                                    ContentDisposition.attachment().filename(DOWNLOAD_NAME).build().toString())
                            .body(new FileSystemResource(path));
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType +
                            ". Supported types: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("The file is too large. Maximum size: 5MB");
        }
    }

    private PixelBuffer loadAndValidateImage(MultipartFile file) throws IOException {
        PixelBuffer input;
        try (var inputStream = file.getInputStream()) {
            input = imageCodec.decode(inputStream);
        }

        if (input.width() > MAX_DIMENSION || input.height() > MAX_DIMENSION) {
            throw new BackgroundRemovalException("The image is too large. Maximum size: "
                    + MAX_DIMENSION + "x" + MAX_DIMENSION + " pixels");
        }

        log.debug("Image loaded successfully: {}x{}", input.width(), input.height());
        return input;
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile result, RemovalResult removal) {
        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("resultPath", "/" + result.relativeWebPath());
        model.addAttribute("downloadPath", "/remove-background/download/" + result.filename());

        model.addAttribute("width", removal.width());
        model.addAttribute("height", removal.height());
        model.addAttribute("threshold", removal.threshold());
        model.addAttribute("blurRadius", removal.blurRadius());
        model.addAttribute("backgroundPx", removal.backgroundPixels());
        model.addAttribute("backgroundPercent", String.format("%.2f", removal.backgroundPercent()));
    }
}
