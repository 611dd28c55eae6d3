package com.smartstream.transform.controller;

import com.smartstream.transform.dto.TransformStatus;
import com.smartstream.transform.model.LakeLayout;
import com.smartstream.transform.model.S3ObjectRef;
import com.smartstream.transform.service.RawToTrustedTransformService;
import com.smartstream.transform.service.S3EventNotificationParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/transform")
@Tag(name = "Raw to Trusted Transform", description = "Manual replay of the raw-to-trusted transform")
public class TransformController {

    private static final Logger logger = LoggerFactory.getLogger(TransformController.class);

    private final RawToTrustedTransformService transformService;
    private final S3EventNotificationParser notificationParser;
    private final LakeLayout lakeLayout;

    public TransformController(RawToTrustedTransformService transformService,
                               S3EventNotificationParser notificationParser,
                               LakeLayout lakeLayout) {
        this.transformService = transformService;
        this.notificationParser = notificationParser;
        this.lakeLayout = lakeLayout;
    }

    @Operation(
            summary = "Transform a single raw object",
            description = "Reads the raw object, routes and cleans its records and writes one NDJSON object "
                    + "per route to the trusted zone. Objects outside the raw prefix are skipped."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Object transformed, skipped or empty",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = TransformStatus.class))),
            @ApiResponse(responseCode = "502", description = "Reading, decoding or writing the object failed",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = TransformStatus.class)))
    })
    @PostMapping
    public ResponseEntity<TransformStatus> transformObject(
            @Parameter(description = "Object key under the raw prefix", required = true)
            @RequestParam("key") String key,
            @Parameter(description = "Bucket name; defaults to the data-lake bucket")
            @RequestParam(value = "bucket", required = false) String bucket) {
        String targetBucket = (bucket == null || bucket.isBlank()) ? lakeLayout.getBucket() : bucket;
        logger.info("Manual transform requested for s3://{}/{}", targetBucket, key);
        return toResponse(transformService.transformAll(List.of(new S3ObjectRef(targetBucket, key))));
    }

    @Operation(
            summary = "Replay an S3 event notification",
            description = "Accepts the same body the queue listener receives, plain or wrapped in an SNS "
                    + "notification, and transforms every created object it names."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "All named objects finished without failure"),
            @ApiResponse(responseCode = "400", description = "Body is not an S3 event notification"),
            @ApiResponse(responseCode = "502", description = "At least one object failed")
    })
    @PostMapping("/notifications")
    public ResponseEntity<?> replayNotification(@RequestBody String body) {
        List<S3ObjectRef> objects;
        try {
            objects = notificationParser.parse(body);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected notification replay: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return toResponse(transformService.transformAll(objects));
    }

    private ResponseEntity<TransformStatus> toResponse(TransformStatus status) {
        if (status.hasFailures()) {
            status.setStatusCode(HttpStatus.BAD_GATEWAY.value());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(status);
        }
        return ResponseEntity.ok(status);
    }
}
