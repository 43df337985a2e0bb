package tech.yump.tenancy.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "New plaintext secrets for a tenant's data source. Stored encrypted; never returned.")
public record RotateCredentialsRequest(
        @Schema(description = "Secret for the restricted (anon) role.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "anonSecret must not be blank")
        String anonSecret,

        @Schema(description = "Secret for the privileged (service) role.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "serviceSecret must not be blank")
        String serviceSecret
) {
    @Override
    public String toString() {
        return "RotateCredentialsRequest[anonSecret=******, serviceSecret=******]";
    }
}
