package com.ureca.loyalty.support;

import com.ureca.loyalty.config.QueryDslConfig;
import jakarta.persistence.EntityManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.test.context.ActiveProfiles;

/**
 * Repository 슬라이스 테스트 추상 부모 클래스
 * JPA 관련 빈만 로드, application-test.yml 의 H2 사용
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(QueryDslConfig.class)
@EnableJpaAuditing
public abstract class RepositoryTestSupport {

    @Autowired
    protected EntityManager em;
}
