package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointLot;

public record LotAllocation(
        PointLot lot,
        long amount
) {
}
