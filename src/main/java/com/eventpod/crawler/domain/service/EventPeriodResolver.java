package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.EventPeriod;
import com.eventpod.crawler.domain.repository.EventPeriodRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;

/**
 * Insert runs in its own transaction; on a unique-code conflict the concurrent winner's row is read back.
 */
@Slf4j
@Component
public class EventPeriodResolver {

    private final EventPeriodRepository repository;
    private final TransactionTemplate creationTx;

    public EventPeriodResolver(EventPeriodRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.creationTx = new TransactionTemplate(transactionManager);
        this.creationTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public String resolve(String code, String scheduled, String remark) {
        var existing = repository.findByCode(code);
        if (existing.isPresent()) {
            return existing.get().getGuid();
        }

        try {
            EventPeriod created = creationTx.execute(status -> repository.saveAndFlush(EventPeriod.builder()
                    .code(code)
                    .active(true)
                    .scheduled(scheduled)
                    .remark(remark)
                    .extra(new HashMap<>())
                    .build()));
            log.info("[Upsert] EventPeriod 생성: code={}, guid={}", code, created.getGuid());
            return created.getGuid();
        } catch (DataIntegrityViolationException e) {
            log.info("[Upsert] EventPeriod 동시 생성 감지, 재조회: code={}", code);
            return repository.findByCode(code)
                    .map(EventPeriod::getGuid)
                    .orElseThrow(() -> new EventUpsertException("event period vanished after duplicate insert: " + code, e));
        }
    }
}
