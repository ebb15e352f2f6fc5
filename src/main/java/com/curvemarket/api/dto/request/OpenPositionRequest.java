package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.OutcomeSide;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenPositionRequest {

    @NotBlank
    private String trader;

    @NotNull
    private OutcomeSide side;

    /** External units (6 decimals). */
    @NotNull
    @Positive
    private BigInteger collateral;

    @NotNull
    @Min(1)
    private Integer leverage;

    /** Slippage floor on shares received; zero disables it. */
    @NotNull
    @PositiveOrZero
    private BigInteger minShares;

    @NotNull
    private Long deadline;

    @NotBlank
    private String traderSignature;

    @NotBlank
    private String authoritySignature;
}
