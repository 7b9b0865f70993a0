package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.TeamGroup;
import com.eventpod.crawler.domain.model.TeamGroupLanguage;
import com.eventpod.crawler.domain.model.TeamRef;
import com.eventpod.crawler.domain.repository.TeamGroupLanguageRepository;
import com.eventpod.crawler.domain.repository.TeamGroupRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
@Component
public class TeamGroupResolver {

    private final TeamGroupRepository teamGroupRepository;
    private final TeamGroupLanguageRepository teamGroupLanguageRepository;
    private final TransactionTemplate creationTx;

    public TeamGroupResolver(TeamGroupRepository teamGroupRepository,
                             TeamGroupLanguageRepository teamGroupLanguageRepository,
                             PlatformTransactionManager transactionManager) {
        this.teamGroupRepository = teamGroupRepository;
        this.teamGroupLanguageRepository = teamGroupLanguageRepository;
        this.creationTx = new TransactionTemplate(transactionManager);
        this.creationTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public String resolve(TeamRef team, String ecosystemGuid, String languageGuid) {
        var existing = teamGroupRepository.findByExternalIdAndEcosystemGuid(team.externalId(), ecosystemGuid);
        if (existing.isPresent()) {
            return existing.get().getGuid();
        }

        try {
            TeamGroup created = creationTx.execute(status -> {
                TeamGroup teamGroup = teamGroupRepository.saveAndFlush(TeamGroup.builder()
                        .ecosystemGuid(ecosystemGuid)
                        .externalId(team.externalId())
                        .build());
                teamGroupLanguageRepository.saveAndFlush(TeamGroupLanguage.builder()
                        .teamGroupGuid(teamGroup.getGuid())
                        .languageGuid(languageGuid)
                        .name(nullToEmpty(team.name()))
                        .alias(nullToEmpty(team.alias()))
                        .build());
                return teamGroup;
            });
            log.info("[Upsert] TeamGroup 생성: teamId={}, name={}, guid={}",
                    team.externalId(), team.name(), created.getGuid());
            return created.getGuid();
        } catch (DataIntegrityViolationException e) {
            log.info("[Upsert] TeamGroup 동시 생성 감지, 재조회: teamId={}", team.externalId());
            return teamGroupRepository.findByExternalIdAndEcosystemGuid(team.externalId(), ecosystemGuid)
                    .map(TeamGroup::getGuid)
                    .orElseThrow(() -> new EventUpsertException(
                            "team group vanished after duplicate insert: " + team.externalId(), e));
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
