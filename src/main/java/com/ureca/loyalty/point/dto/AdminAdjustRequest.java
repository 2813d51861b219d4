package com.ureca.loyalty.point.dto;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

// 필드 규칙(0 금지, 사유 길이 등)은 AdminAdjustmentService 에서 InvalidAdjustmentException 으로 검증
public record AdminAdjustRequest(
        @Schema(description = "회원 ID", example = "1")
        @NotNull @Positive
        Long memberId,

        @Schema(description = "조정 포인트 (양수 지급, 음수 차감)", example = "-30")
        @NotNull
        @Min(-PointsTransaction.MAX_AMOUNT) @Max(PointsTransaction.MAX_AMOUNT)
        Long amount,

        @Schema(description = "처리 관리자 ID", example = "admin-kim")
        String actorId,

        @Schema(description = "조정 사유 (500자 이내)", example = "CS 보상")
        String reason,

        @Schema(description = "멱등키", example = "adj-20240601-0001")
        @NotBlank @Size(max = 100)
        String idempotencyKey
) {
}
