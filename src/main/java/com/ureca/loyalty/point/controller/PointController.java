package com.ureca.loyalty.point.controller;

import com.ureca.loyalty.adjustment.service.AdminAdjustmentService;
import com.ureca.loyalty.common.ApiResponse;
import com.ureca.loyalty.common.BaseCode;
import com.ureca.loyalty.common.PageResult;
import com.ureca.loyalty.expiration.dto.SweepResult;
import com.ureca.loyalty.expiration.scheduler.ExpirationSweeper;
import com.ureca.loyalty.ledger.dto.TransactionResponse;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.point.dto.*;
import com.ureca.loyalty.point.service.PointLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static com.ureca.loyalty.common.BaseCode.*;

@Slf4j
@RestController
@RequiredArgsConstructor
public class PointController implements PointSwagger {

    private final PointLedgerService pointLedgerService;
    private final AdminAdjustmentService adminAdjustmentService;
    private final ExpirationSweeper expirationSweeper;

    @Override
    public ResponseEntity<ApiResponse<MutationResult>> earn(@Valid @RequestBody EarnRequest request) {
        log.info("[포인트 적립 요청] 시작. memberId : {}", request.memberId());

        MutationResult result = pointLedgerService.earn(
                request.memberId(),
                request.amount(),
                request.sourceRef(),
                request.idempotencyKey(),
                request.ttlDays()
        );

        return ResponseEntity.ok(ApiResponse.of(codeOf(result, POINT_EARN_SUCCESS), result));
    }

    @Override
    public ResponseEntity<ApiResponse<MutationResult>> redeem(@Valid @RequestBody RedeemRequest request) {
        log.info("[포인트 사용 요청] 시작. memberId : {}", request.memberId());

        MutationResult result = pointLedgerService.redeem(
                request.memberId(),
                request.amount(),
                request.sourceRef(),
                request.idempotencyKey()
        );

        return ResponseEntity.ok(ApiResponse.of(codeOf(result, POINT_REDEEM_SUCCESS), result));
    }

    @Override
    public ResponseEntity<ApiResponse<MutationResult>> adminAdjust(
            @RequestHeader("X-Admin-Capability") String capabilityToken,
            @Valid @RequestBody AdminAdjustRequest request) {

        log.info("[관리자 조정 요청] 시작. memberId : {}, actorId : {}", request.memberId(), request.actorId());

        MutationResult result = adminAdjustmentService.adminAdjust(
                request.memberId(),
                request.amount(),
                request.actorId(),
                request.reason(),
                request.idempotencyKey(),
                capabilityToken
        );

        return ResponseEntity.ok(ApiResponse.of(codeOf(result, ADMIN_ADJUST_SUCCESS), result));
    }

    @Override
    public ResponseEntity<ApiResponse<BalanceResponse>> getBalance(@PathVariable Long memberId) {
        return ResponseEntity.ok(ApiResponse.of(BALANCE_SUCCESS, pointLedgerService.getBalance(memberId)));
    }

    @Override
    public ResponseEntity<ApiResponse<PageResult<TransactionResponse>>> getHistory(
            @PathVariable Long memberId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) TransactionKind kind) {

        PageResult<TransactionResponse> history = pointLedgerService.getHistory(memberId, page, size, kind);
        return ResponseEntity.ok(ApiResponse.of(HISTORY_SUCCESS, history));
    }

    @Override
    public ResponseEntity<ApiResponse<SummaryResponse>> getSummary(@PathVariable Long memberId) {
        return ResponseEntity.ok(ApiResponse.of(SUMMARY_SUCCESS, pointLedgerService.getSummary(memberId)));
    }

    @Override
    public ResponseEntity<ApiResponse<SweepResponse>> sweepExpired() {
        log.info("[포인트 소멸 요청] 수동 실행 시작");

        SweepResult result = expirationSweeper.sweep();
        return ResponseEntity.ok(ApiResponse.of(SWEEP_SUCCESS, SweepResponse.from(result)));
    }

    // 중복 요청이면 이전 결과와 함께 DUPLICATE_SUBMISSION
    private BaseCode codeOf(MutationResult result, BaseCode successCode) {
        return result.duplicate() ? DUPLICATE_SUBMISSION : successCode;
    }
}
