package tech.yump.tenancy.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.tenancy.api.ApiError;
import tech.yump.tenancy.api.dto.RotateCredentialsRequest;
import tech.yump.tenancy.audit.AuditHelper;
import tech.yump.tenancy.core.ConnectionInfo;
import tech.yump.tenancy.core.ConnectionTestResult;
import tech.yump.tenancy.core.DataSourceManager;
import tech.yump.tenancy.metrics.DataSourceStats;

import java.util.Map;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Data Source Admin", description = "Diagnostics and administration of tenant data sources")
public class DataSourceAdminController {

    private final DataSourceManager dataSourceManager;
    private final AuditHelper auditHelper;

    @GetMapping("/datasources/stats")
    @Operation(summary = "Get pool and cache statistics")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Current counters, sizes and derived rates.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = DataSourceStats.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid admin token.")
    })
    public ResponseEntity<DataSourceStats> getStats() {
        return ResponseEntity.ok(dataSourceManager.getStats());
    }

    @PostMapping("/datasources/stats/reset")
    @Operation(summary = "Reset statistics counters", description = "Zeroes every counter. Cache sizes are unaffected.")
    @ApiResponse(responseCode = "204", description = "Counters reset.")
    public ResponseEntity<Void> resetStats() {
        log.info("Controller: Received request to reset data source stats");
        dataSourceManager.resetStats();
        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "reset_stats", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.NO_CONTENT.value(), null, null, null);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/datasources/cache")
    @Operation(summary = "Clear all caches", description = "Drops every cached tenant config and closes every pooled client.")
    @ApiResponse(responseCode = "204", description = "Caches cleared.")
    public ResponseEntity<Void> clearAllCaches() {
        log.info("Controller: Received request to clear all tenant caches");
        dataSourceManager.clearAllCaches();
        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "clear_caches", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.NO_CONTENT.value(), null, null, null);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tenants/{tenantId}/connection")
    @Operation(summary = "Get tenant connection info", description = "Connection URL, region and pool settings. Never includes secrets.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Connection info.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ConnectionInfo.class))),
            @ApiResponse(responseCode = "404", description = "Tenant not found.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "Tenant misconfigured or secret failed to decrypt.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<ConnectionInfo> getConnectionInfo(
            @Parameter(description = "Control-plane tenant id.", required = true, example = "acme")
            @PathVariable String tenantId) {
        return ResponseEntity.ok(dataSourceManager.getTenantConnectionInfo(tenantId));
    }

    @PostMapping("/tenants/{tenantId}/connection/test")
    @Operation(summary = "Test tenant connection",
            description = "Opens a throwaway connection and runs a trivial query. Failures are reported in the body, not as errors.")
    @ApiResponse(responseCode = "200", description = "Test result.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ConnectionTestResult.class)))
    public ResponseEntity<ConnectionTestResult> testConnection(
            @Parameter(description = "Control-plane tenant id.", required = true, example = "acme")
            @PathVariable String tenantId) {
        log.info("Controller: Received connection test request for tenant '{}'", tenantId);
        ConnectionTestResult result = dataSourceManager.testTenantConnection(tenantId);
        auditHelper.logHttpEvent(AuditHelper.TYPE_DATASOURCE, "test_connection",
                result.success() ? AuditHelper.OUTCOME_SUCCESS : AuditHelper.OUTCOME_FAILURE,
                HttpStatus.OK.value(), tenantId, result.error(),
                Map.of("response_time_ms", result.responseTimeMs()));
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/tenants/{tenantId}/cache")
    @Operation(summary = "Invalidate tenant", description = "Drops the tenant's cached config and closes its pooled clients.")
    @ApiResponse(responseCode = "204", description = "Tenant invalidated.")
    public ResponseEntity<Void> invalidateTenant(
            @Parameter(description = "Control-plane tenant id.", required = true, example = "acme")
            @PathVariable String tenantId) {
        log.info("Controller: Received request to invalidate tenant '{}'", tenantId);
        dataSourceManager.invalidate(tenantId);
        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "invalidate_tenant", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.NO_CONTENT.value(), tenantId, null, null);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/tenants/{tenantId}/credentials")
    @Operation(summary = "Rotate tenant credentials",
            description = "Encrypts and stores new anon and service secrets, then invalidates the tenant's cached config and clients.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Credentials rotated."),
            @ApiResponse(responseCode = "400", description = "Missing secret.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Tenant not found.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> rotateCredentials(
            @Parameter(description = "Control-plane tenant id.", required = true, example = "acme")
            @PathVariable String tenantId,
            @Valid @RequestBody RotateCredentialsRequest request) {
        log.info("Controller: Received credential rotation request for tenant '{}'", tenantId);
        dataSourceManager.rotateCredentials(tenantId, request.anonSecret(), request.serviceSecret());
        auditHelper.logHttpEvent(AuditHelper.TYPE_ADMIN, "rotate_credentials", AuditHelper.OUTCOME_SUCCESS,
                HttpStatus.NO_CONTENT.value(), tenantId, null, null);
        return ResponseEntity.noContent().build();
    }
}
