package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.OutcomeSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A bonding-curve purchase countersigned by the buyer and the market authority. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuySharesRequest {

    @NotBlank
    private String buyer;

    @NotNull
    private OutcomeSide side;

    /** Shares in accounting units (18 decimals). */
    @NotNull
    @Positive
    private BigInteger shareAmount;

    /** Epoch seconds after which the signatures are void. */
    @NotNull
    private Long deadline;

    @NotBlank
    private String buyerSignature;

    @NotBlank
    private String authoritySignature;
}
