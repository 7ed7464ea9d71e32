package tech.yump.amethyst.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.amethyst.bucket.CredentialCache;
import tech.yump.amethyst.sync.ReconciliationEngine;
import tech.yump.amethyst.sync.SyncReport;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "Service status endpoints")
public class RootController {

  private final CredentialCache credentialCache;
  private final ReconciliationEngine reconciliationEngine;

  @GetMapping("/")
  @Operation(summary = "Root Endpoint", description = "Liveness message. Does not require authentication.", security = {})
  @ApiResponse(responseCode = "200", description = "Service is up.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"service\": \"AmethystKey\", \"status\": \"healthy\"}")))
  public Map<String, String> getRoot() {
    return Map.of("service", "AmethystKey", "status", "healthy");
  }

  @GetMapping("/sys/status")
  @Operation(
          summary = "Reconciliation status",
          description = "Number of buckets in the credential cache and the outcome of the last reconciliation cycle. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Status retrieved.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"cachedBuckets\": 3, \"lastSync\": {\"startedAt\": \"2026-01-01T00:00:00Z\", \"secretsWritten\": 0}}")))
  public Map<String, Object> getStatus() {
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("cachedBuckets", credentialCache.size());
    status.put("lastSync", reconciliationEngine.lastReport().map(RootController::describe).orElse(null));
    return status;
  }

  private static Map<String, Object> describe(SyncReport report) {
    Map<String, Object> sync = new LinkedHashMap<>();
    sync.put("startedAt", report.startedAt().toString());
    sync.put("durationMillis", report.duration().toMillis());
    sync.put("bucketsSeen", report.bucketsSeen());
    sync.put("keysWritten", report.keysWritten());
    sync.put("secretsSeen", report.secretsSeen());
    sync.put("secretsWritten", report.secretsWritten());
    return sync;
  }
}
