package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.OutcomeSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Permissionless liquidation; no signature required. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidateRequest {

    @NotBlank
    private String keeper;

    @NotBlank
    private String trader;

    @NotNull
    private OutcomeSide side;
}
