package com.ureca.loyalty.point.dto;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record EarnRequest(
        @Schema(description = "회원 ID (외부 인증 서버 식별자)", example = "1")
        @NotNull @Positive
        Long memberId,

        @Schema(description = "적립 포인트", example = "100")
        @NotNull @Positive @Max(PointsTransaction.MAX_AMOUNT)
        Long amount,

        @Schema(description = "적립 출처 (예약 번호 등)", example = "booking-2024-0001")
        @Size(max = 100)
        String sourceRef,

        @Schema(description = "멱등키 (호출자 생성, 같은 키 재요청 시 이전 결과 반환)",
                example = "550e8400-e29b-41d4-a716-446655440000")
        @NotBlank @Size(max = 100)
        String idempotencyKey,

        @Schema(description = "유효기간(일). 없으면 기본값 사용", example = "365")
        @Min(1)
        Integer ttlDays
) {
}
