package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.OutcomeSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePositionRequest {

    @NotBlank
    private String trader;

    @NotNull
    private OutcomeSide side;

    @NotNull
    private Long deadline;

    @NotBlank
    private String traderSignature;

    @NotBlank
    private String authoritySignature;
}
