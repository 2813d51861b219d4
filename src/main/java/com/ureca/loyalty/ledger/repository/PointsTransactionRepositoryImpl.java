package com.ureca.loyalty.ledger.repository;

import com.querydsl.core.types.Projections;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import com.ureca.loyalty.ledger.dto.KindTotal;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ureca.loyalty.ledger.entity.QPointsTransaction.pointsTransaction;

@Repository
@RequiredArgsConstructor
public class PointsTransactionRepositoryImpl implements PointsTransactionRepositoryCustom {

    private final JPAQueryFactory queryFactory;

    @Override
    public Page<PointsTransaction> findHistory(Long memberId, TransactionKind kind, Pageable pageable) {
        List<PointsTransaction> content = queryFactory
                .selectFrom(pointsTransaction)
                .where(
                        memberIdEq(memberId),
                        kindEq(kind)
                )
                .orderBy(pointsTransaction.createdAt.desc(), pointsTransaction.id.desc())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        Long total = queryFactory
                .select(pointsTransaction.count())
                .from(pointsTransaction)
                .where(
                        memberIdEq(memberId),
                        kindEq(kind)
                )
                .fetchOne();

        return new PageImpl<>(content, pageable, total == null ? 0 : total);
    }

    @Override
    public List<KindTotal> sumAmountGroupByKind(Long memberId) {
        return queryFactory
                .select(Projections.constructor(KindTotal.class,
                        pointsTransaction.kind,
                        pointsTransaction.amount.sum(),
                        pointsTransaction.count()))
                .from(pointsTransaction)
                .where(memberIdEq(memberId))
                .groupBy(pointsTransaction.kind)
                .fetch();
    }

    private BooleanExpression memberIdEq(Long memberId) {
        return pointsTransaction.memberId.eq(memberId);
    }

    private BooleanExpression kindEq(TransactionKind kind) {
        return kind != null ? pointsTransaction.kind.eq(kind) : null;
    }
}
