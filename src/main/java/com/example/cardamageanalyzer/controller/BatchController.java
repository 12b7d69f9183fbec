package com.example.cardamageanalyzer.controller;

import com.example.cardamageanalyzer.model.BatchStatusResponse;
import com.example.cardamageanalyzer.model.ErrorResponse;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.PipelineSnapshot;
import com.example.cardamageanalyzer.service.pipeline.BatchPipeline;
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
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping(path = "/api/v1/batches", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Batches", description = "Multi-image damage assessment")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final BatchPipeline pipeline;

    public BatchController(BatchPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Operation(
            summary = "Submit a new batch of vehicle photos",
            description = "Replaces the current batch. Every file must be a raster image; otherwise the whole submission is rejected.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch accepted",
                    content = @Content(schema = @Schema(implementation = BatchStatusResponse.class))),
            @ApiResponse(responseCode = "400", description = "No images or a non-image file",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "An operation is in flight",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchStatusResponse> submit(
            @Parameter(description = "Photos of the damaged vehicle, ideally from several angles")
            @RequestPart(value = "images", required = false) List<MultipartFile> images) {
        List<ImagePayload> payloads = images == null
                ? List.of()
                : images.stream().map(UploadedImages::toPayload).collect(Collectors.toList());
        log.debug("Received {} file(s) for a new batch", payloads.size());
        return ResponseEntity.ok(BatchStatusResponse.from(pipeline.submitBatch(payloads)));
    }

    @Operation(summary = "Current pipeline state", description = "Safe to poll while an operation is running.")
    @GetMapping("/current")
    public ResponseEntity<BatchStatusResponse> current() {
        return ResponseEntity.ok(BatchStatusResponse.from(pipeline.snapshot()));
    }

    @Operation(
            summary = "Normalize every image of the current batch",
            description = "Resamples each image to 512x512 and applies the brightness/contrast correction. Images that fail keep their original for scoring.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Preprocessing finished",
                    content = @Content(schema = @Schema(implementation = BatchStatusResponse.class))),
            @ApiResponse(responseCode = "409", description = "Empty batch, busy pipeline or cancelled",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/current/preprocess")
    public ResponseEntity<BatchStatusResponse> preprocess() {
        return ResponseEntity.ok(BatchStatusResponse.from(pipeline.runPreprocessing()));
    }

    @Operation(
            summary = "Score every image of the current batch",
            description = "Sends each image to the damage scoring service one at a time and averages the successful results.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analysis finished with at least one scored image",
                    content = @Content(schema = @Schema(implementation = BatchStatusResponse.class))),
            @ApiResponse(responseCode = "409", description = "Empty batch, busy pipeline or cancelled",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "No image could be scored",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/current/analyze")
    public ResponseEntity<BatchStatusResponse> analyze() {
        return ResponseEntity.ok(BatchStatusResponse.from(pipeline.runAnalysis()));
    }

    @Operation(summary = "Cancel the running operation",
            description = "The operation stops before its next image; images already handled keep their state.")
    @PostMapping("/current/cancel")
    public ResponseEntity<BatchStatusResponse> cancel() {
        pipeline.requestCancellation();
        return ResponseEntity.accepted().body(BatchStatusResponse.from(pipeline.snapshot()));
    }

    @Operation(summary = "Discard the current batch")
    @DeleteMapping("/current")
    public ResponseEntity<BatchStatusResponse> clear() {
        PipelineSnapshot cleared = pipeline.clear();
        return ResponseEntity.ok(BatchStatusResponse.from(cleared));
    }
}
