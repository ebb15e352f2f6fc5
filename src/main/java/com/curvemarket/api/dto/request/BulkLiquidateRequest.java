package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.OutcomeSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A batch of liquidation targets. {@code traders} and {@code sides} are parallel lists;
 * a length mismatch is rejected by the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkLiquidateRequest {

    @NotBlank
    private String keeper;

    @NotEmpty
    private List<String> traders;

    @NotEmpty
    private List<OutcomeSide> sides;

    @NotNull
    private Long deadline;

    @NotBlank
    private String authoritySignature;
}
