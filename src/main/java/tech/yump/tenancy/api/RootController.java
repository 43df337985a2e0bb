package tech.yump.tenancy.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.tenancy.core.DataSourceManager;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  private final DataSourceManager dataSourceManager;

  public RootController(DataSourceManager dataSourceManager) {
    this.dataSourceManager = dataSourceManager;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Service name and whether the data source manager is running. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Service information.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Tenant Data Source Manager\", \"status\": \"OK\"}")))
  public Map<String, String> getRoot() {
    String status = dataSourceManager.isRunning() ? "OK" : "STOPPED";
    return Map.of("message", "Tenant Data Source Manager", "status", status);
  }
}
