package com.ureca.loyalty.tier.controller;

import com.ureca.loyalty.common.ApiResponse;
import com.ureca.loyalty.tier.domain.TierAssignment;
import com.ureca.loyalty.tier.dto.TierAssignmentResponse;
import com.ureca.loyalty.tier.dto.TierResponse;
import com.ureca.loyalty.tier.service.TierService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.ureca.loyalty.common.BaseCode.TIER_LIST_SUCCESS;
import static com.ureca.loyalty.common.BaseCode.TIER_RECALCULATE_SUCCESS;

@Slf4j
@RestController
@RequiredArgsConstructor
public class TierController implements TierSwagger {

    private final TierService tierService;

    @Override
    public ResponseEntity<ApiResponse<List<TierResponse>>> getTiers() {
        return ResponseEntity.ok(ApiResponse.of(TIER_LIST_SUCCESS, tierService.getTiers()));
    }

    @Override
    public ResponseEntity<ApiResponse<TierAssignmentResponse>> recalculate(@PathVariable Long memberId) {
        log.info("[등급 재계산 요청] 시작. memberId : {}", memberId);

        TierAssignment assignment = tierService.recalculate(memberId);
        log.info("[등급 재계산 요청] 성공. memberId : {}, tier : {}", memberId, assignment.tierName());

        return ResponseEntity.ok(ApiResponse.of(TIER_RECALCULATE_SUCCESS, TierAssignmentResponse.from(assignment)));
    }
}
