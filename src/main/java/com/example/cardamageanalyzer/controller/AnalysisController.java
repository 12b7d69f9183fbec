package com.example.cardamageanalyzer.controller;

import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.ErrorResponse;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.ScoreResult;
import com.example.cardamageanalyzer.service.scoring.ScoringClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Scores a single photo straight away, without normalization and without touching the current
 * batch.
 */
@RestController
@RequestMapping(path = "/api/v1/analyze", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Quick analysis", description = "Single image damage assessment")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final ScoringClient scoringClient;

    public AnalysisController(ScoringClient scoringClient) {
        this.scoringClient = scoringClient;
    }

    @Operation(summary = "Estimate damage for one uploaded photo")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Damage estimate",
                    content = @Content(schema = @Schema(implementation = ScoreResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing file or not an image",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "502", description = "Scoring service unreachable or answered garbage",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ScoreResult> analyze(
            @Parameter(description = "Photo of the damaged vehicle")
            @RequestPart(value = "file", required = false) MultipartFile file) throws ScoringException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "No file provided");
        }
        ImagePayload image = UploadedImages.toPayload(file);
        if (!image.isRaster()) {
            throw new ResponseStatusException(BAD_REQUEST,
                    "Invalid file type: " + image.mediaType() + ". Only images are supported.");
        }
        log.info("Forwarding {} ({} bytes) to the scoring service", image.fileName(), image.size());
        return ResponseEntity.ok(scoringClient.score(image));
    }
}
