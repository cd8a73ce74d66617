package com.example.handwritingcomparator.controller;

import com.example.handwritingcomparator.exception.GeometryException;
import com.example.handwritingcomparator.model.CompositeResult;
import com.example.handwritingcomparator.model.CropRect;
import com.example.handwritingcomparator.model.CropResult;
import com.example.handwritingcomparator.model.ImageSize;
import com.example.handwritingcomparator.model.LocalComparisonResult;
import com.example.handwritingcomparator.model.api.ApiInfoResponse;
import com.example.handwritingcomparator.model.api.ComparisonRequest;
import com.example.handwritingcomparator.model.api.ComparisonResponse;
import com.example.handwritingcomparator.model.api.CropRegionRequest;
import com.example.handwritingcomparator.model.api.CropRegionResponse;
import com.example.handwritingcomparator.model.api.HealthResponse;
import com.example.handwritingcomparator.model.api.LocalComparisonRequest;
import com.example.handwritingcomparator.model.api.LocalComparisonResponse;
import com.example.handwritingcomparator.service.ComparisonService;
import com.example.handwritingcomparator.service.history.ComparisonHistoryStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Comparison", description = "Handwriting specimen comparison endpoints")
public class ComparisonController {

    private static final Logger log = LoggerFactory.getLogger(ComparisonController.class);

    static final String API_VERSION = "1.0.0";

    private final ComparisonService comparisonService;
    private final ComparisonHistoryStore historyStore;

    public ComparisonController(ComparisonService comparisonService, ComparisonHistoryStore historyStore) {
        this.comparisonService = comparisonService;
        this.historyStore = historyStore;
    }

    @GetMapping("/")
    @Operation(summary = "Describe the API")
    public ApiInfoResponse root() {
        return new ApiInfoResponse("Handwriting Comparator API", API_VERSION);
    }

    @GetMapping("/health")
    @Operation(summary = "Report service health and the configured AI analysis provider")
    public HealthResponse health() {
        return new HealthResponse("healthy", Instant.now(), comparisonService.analysisProviderName());
    }

    @PostMapping(value = "/compare", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Compare two Base64 encoded handwriting specimens",
            description = "Computes deterministic similarity metrics, an optional AI opinion and a verdict",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Comparison result",
                            content = @Content(schema = @Schema(implementation = ComparisonResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Missing or undecodable image")
            })
    public ResponseEntity<ComparisonResponse> compare(@Valid @RequestBody ComparisonRequest request) {
        byte[] questioned = decodeBase64(request.questionedImage(), "questioned_image");
        byte[] known = decodeBase64(request.knownImage(), "known_image");
        return ResponseEntity.ok(runComparison(questioned, known, request.aiRequested()));
    }

    @PostMapping(value = "/compare/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Compare two uploaded handwriting specimens",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Comparison result",
                            content = @Content(schema = @Schema(implementation = ComparisonResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Missing or undecodable image")
            })
    public ResponseEntity<ComparisonResponse> compareFiles(
            @RequestPart("questioned") MultipartFile questioned,
            @RequestPart("known") MultipartFile known,
            @RequestParam(name = "use_ai_analysis", defaultValue = "false") boolean useAiAnalysis) {
        return ResponseEntity.ok(runComparison(readUpload(questioned, "questioned"), readUpload(known, "known"), useAiAnalysis));
    }

    @PostMapping(value = "/crop-region", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Extract a region at native resolution",
            description = "Maps a rectangle picked on the displayed image to source pixels and returns transparent and solid PNG renderings")
    public ResponseEntity<CropRegionResponse> cropRegion(@Valid @RequestBody CropRegionRequest request) {
        byte[] image = decodeBase64(request.imageBase64(), "image_base64");
        CropRect rect = new CropRect(request.cropX(), request.cropY(), request.cropWidth(), request.cropHeight());
        CropResult result = comparisonService.cropRegion(image, rect, displaySize(request));
        return ResponseEntity.ok(CropRegionResponse.from(result));
    }

    @PostMapping(value = "/local-comparison", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Re-score an overlay fragment against the base image region beneath it")
    public ResponseEntity<LocalComparisonResponse> localComparison(@Valid @RequestBody LocalComparisonRequest request) {
        byte[] base = decodeBase64(request.baseImage(), "base_image");
        byte[] overlay = decodeBase64(request.overlayImage(), "overlay_image");
        LocalComparisonResult result = comparisonService.localComparison(base, overlay, request.toTransform());
        return ResponseEntity.ok(LocalComparisonResponse.from(result));
    }

    private ComparisonResponse runComparison(byte[] questioned, byte[] known, boolean useAiAnalysis) {
        CompositeResult result = comparisonService.compare(questioned, known, useAiAnalysis);
        ComparisonResponse response = ComparisonResponse.from(
                UUID.randomUUID().toString(),
                Instant.now(),
                result,
                comparisonService.thumbnail(questioned),
                comparisonService.thumbnail(known));
        historyStore.save(response);
        log.debug("Stored comparison {}", response.id());
        return response;
    }

    private static ImageSize displaySize(CropRegionRequest request) {
        if (request.displayWidth() == null && request.displayHeight() == null) {
            return null;
        }
        if (request.displayWidth() == null || request.displayHeight() == null) {
            throw new GeometryException("display_width and display_height must be supplied together");
        }
        return new ImageSize(request.displayWidth(), request.displayHeight());
    }

    private static byte[] readUpload(MultipartFile file, String part) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image part '" + part + "' is required");
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded image '" + part + "'", ex);
        }
    }

    /**
     * Accepts plain Base64 as well as {@code data:image/...;base64,} URLs.
     */
    static byte[] decodeBase64(String encoded, String field) {
        if (!StringUtils.hasText(encoded)) {
            throw new ResponseStatusException(BAD_REQUEST, field + " is required");
        }
        String payload = encoded.trim();
        if (payload.startsWith("data:")) {
            int comma = payload.indexOf(',');
            payload = comma >= 0 ? payload.substring(comma + 1) : "";
        }
        try {
            return Base64.getDecoder().decode(payload.replaceAll("\\s", ""));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid Base64 image data in " + field, ex);
        }
    }
}
