package com.eduhub.learning_backend.modules.admin.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReconcileRevenueDto {

    @NotBlank
    @Schema(description = "账期 YYYY-MM", example = "2025-03")
    private String period;
}
