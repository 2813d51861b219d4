package com.ureca.loyalty.point.controller;

import com.ureca.loyalty.common.ApiResponse;
import com.ureca.loyalty.common.PageResult;
import com.ureca.loyalty.ledger.dto.TransactionResponse;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.point.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "포인트 원장", description = "포인트 적립, 사용, 관리자 조정, 잔액 및 내역 조회 API")
@RequestMapping("/api/loyalty")
public interface PointSwagger {

    @Operation(summary = "포인트 적립",
            description = "포인트를 적립합니다. 같은 멱등키로 다시 요청하면 새로 적립하지 않고 이전 결과를 반환합니다.")
    @PostMapping("/earn")
    ResponseEntity<ApiResponse<MutationResult>> earn(@Valid @RequestBody EarnRequest request);

    @Operation(summary = "포인트 사용",
            description = "오래된 적립분부터 포인트를 차감합니다. 잔액이 부족하면 INSUFFICIENT_BALANCE 를 반환합니다.")
    @PostMapping("/redeem")
    ResponseEntity<ApiResponse<MutationResult>> redeem(@Valid @RequestBody RedeemRequest request);

    @Operation(summary = "관리자 포인트 조정",
            description = "양수는 지급, 음수는 차감입니다. X-Admin-Capability 헤더의 권한 토큰이 함께 기록됩니다.")
    @PostMapping("/admin-adjust")
    ResponseEntity<ApiResponse<MutationResult>> adminAdjust(
            @Parameter(description = "관리자 권한 토큰")
            @RequestHeader("X-Admin-Capability") String capabilityToken,
            @Valid @RequestBody AdminAdjustRequest request
    );

    @Operation(summary = "포인트 잔액 조회", description = "잔액, 현재 등급, 다음 등급까지 남은 포인트를 조회합니다.")
    @GetMapping("/balance/{memberId}")
    ResponseEntity<ApiResponse<BalanceResponse>> getBalance(@PathVariable Long memberId);

    @Operation(summary = "포인트 내역 조회", description = "최신순 페이지 조회. page 는 1부터, size 는 최대 100")
    @GetMapping("/history/{memberId}")
    ResponseEntity<ApiResponse<PageResult<TransactionResponse>>> getHistory(
            @PathVariable Long memberId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "종류 필터 (EARN, REDEEM, EXPIRE, ADMIN_AWARD, ADMIN_DEDUCT)")
            @RequestParam(required = false) TransactionKind kind
    );

    @Operation(summary = "포인트 요약 조회", description = "종류별 누적 합계와 거래 건수를 조회합니다.")
    @GetMapping("/summary/{memberId}")
    ResponseEntity<ApiResponse<SummaryResponse>> getSummary(@PathVariable Long memberId);

    @Operation(summary = "만료 포인트 소멸 실행", description = "정기 배치와 같은 소멸 처리를 즉시 실행합니다.")
    @PostMapping("/sweep-expired")
    ResponseEntity<ApiResponse<SweepResponse>> sweepExpired();
}
