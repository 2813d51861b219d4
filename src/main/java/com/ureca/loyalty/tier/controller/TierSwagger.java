package com.ureca.loyalty.tier.controller;

import com.ureca.loyalty.common.ApiResponse;
import com.ureca.loyalty.tier.dto.TierAssignmentResponse;
import com.ureca.loyalty.tier.dto.TierResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

@Tag(name = "회원 등급", description = "등급 기준 조회 및 등급 재계산 API")
@RequestMapping("/api/loyalty")
public interface TierSwagger {

    @Operation(summary = "등급 목록 조회", description = "설정된 등급과 최소 잔액을 낮은 등급부터 조회합니다.")
    @GetMapping("/tiers")
    ResponseEntity<ApiResponse<List<TierResponse>>> getTiers();

    @Operation(summary = "회원 등급 재계산", description = "현재 잔액으로 등급을 다시 계산하고, 바뀌었으면 등급 변경 이벤트를 발행합니다.")
    @PostMapping("/members/{memberId}/tier/recalculate")
    ResponseEntity<ApiResponse<TierAssignmentResponse>> recalculate(@PathVariable Long memberId);
}
