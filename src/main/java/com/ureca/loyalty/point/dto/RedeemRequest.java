package com.ureca.loyalty.point.dto;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record RedeemRequest(
        @Schema(description = "회원 ID", example = "1")
        @NotNull @Positive
        Long memberId,

        @Schema(description = "사용 포인트", example = "50")
        @NotNull @Positive @Max(PointsTransaction.MAX_AMOUNT)
        Long amount,

        @Schema(description = "사용처", example = "coupon-redeem-77")
        @Size(max = 100)
        String sourceRef,

        @Schema(description = "멱등키", example = "7b7e3c1a-2f4d-4d8e-9c1b-0a1b2c3d4e5f")
        @NotBlank @Size(max = 100)
        String idempotencyKey
) {
}
