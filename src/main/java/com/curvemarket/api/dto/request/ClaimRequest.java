package com.curvemarket.api.dto.request;

import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.UserTier;
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
public class ClaimRequest {

    @NotBlank
    private String user;

    @NotNull
    private ClaimKind claimKind;

    /** Tier attested by the authority's signature; only affects leveraged-position bonuses. */
    @NotNull
    private UserTier tier;

    @NotNull
    private Long deadline;

    @NotBlank
    private String authoritySignature;
}
