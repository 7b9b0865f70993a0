package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.Event;
import com.eventpod.crawler.domain.model.EventLanguage;
import com.eventpod.crawler.domain.model.TeamRef;
import com.eventpod.crawler.domain.repository.EventLanguageRepository;
import com.eventpod.crawler.domain.repository.EventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;

@Slf4j
@Service
public class EventUpsertService {

    private final EventRepository eventRepository;
    private final EventLanguageRepository eventLanguageRepository;
    private final EventPeriodResolver periodResolver;
    private final TeamGroupResolver teamGroupResolver;
    private final TransactionTemplate transactionTemplate;

    public EventUpsertService(EventRepository eventRepository,
                              EventLanguageRepository eventLanguageRepository,
                              EventPeriodResolver periodResolver,
                              TeamGroupResolver teamGroupResolver,
                              PlatformTransactionManager transactionManager,
                              EventUpsertProperties properties) {
        this.eventRepository = eventRepository;
        this.eventLanguageRepository = eventLanguageRepository;
        this.periodResolver = periodResolver;
        this.teamGroupResolver = teamGroupResolver;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.getTimeoutSeconds());
    }

    public EventUpsertResult upsert(EventUpsertCommand command) {
        try {
            return transactionTemplate.execute(status -> doUpsert(command));
        } catch (EventUpsertException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventUpsertException("event upsert failed: externalId=" + command.getExternalId(), e);
        }
    }

    private EventUpsertResult doUpsert(EventUpsertCommand command) {
        String periodGuid = periodResolver.resolve(
                command.getPeriodCode(), command.getPeriodScheduled(), command.getPeriodRemark());
        String mainTeamGuid = resolveTeam(command.getHomeTeam(), command);
        String clusterTeamGuid = resolveTeam(command.getAwayTeam(), command);

        var existing = eventRepository.findByExternalId(command.getExternalId());
        if (existing.isPresent()) {
            Event event = existing.get();
            applyUpdate(event, command, periodGuid, mainTeamGuid, clusterTeamGuid);
            upsertLanguage(event.getGuid(), command);
            log.debug("[Upsert] Event 갱신: externalId={}, guid={}", command.getExternalId(), event.getGuid());
            return new EventUpsertResult(event.getGuid(), false);
        }

        Event created = eventRepository.saveAndFlush(Event.builder()
                .categoryGuid(command.getCategoryGuid())
                .ecosystemGuid(command.getEcosystemGuid())
                .eventPeriodGuid(periodGuid)
                .mainTeamGroupGuid(mainTeamGuid)
                .clusterTeamGroupGuid(clusterTeamGuid)
                .externalId(command.getExternalId())
                .mainScore(command.getMainScore())
                .clusterScore(command.getClusterScore())
                .price(command.getPrice() == null ? "0" : command.getPrice())
                .info(new HashMap<>(command.getInfo()))
                .online(command.isOnlineOnCreate())
                .isLive(command.getLiveStatus().code())
                .sports(command.isSports())
                .stage(command.getStage())
                .build());

        eventLanguageRepository.save(EventLanguage.builder()
                .eventGuid(created.getGuid())
                .languageGuid(command.getLanguageGuid())
                .title(command.getTitle())
                .rules(command.getRules() == null ? "" : command.getRules())
                .build());

        log.info("[Upsert] Event 생성: externalId={}, guid={}", command.getExternalId(), created.getGuid());
        return new EventUpsertResult(created.getGuid(), true);
    }

    private String resolveTeam(TeamRef team, EventUpsertCommand command) {
        if (team == null) {
            return Event.NO_TEAM;
        }
        return teamGroupResolver.resolve(team, command.getEcosystemGuid(), command.getLanguageGuid());
    }

    private void applyUpdate(Event event, EventUpsertCommand command,
                             String periodGuid, String mainTeamGuid, String clusterTeamGuid) {
        event.setMainScore(command.getMainScore());
        event.setClusterScore(command.getClusterScore());
        if (command.getPrice() != null) {
            event.setPrice(command.getPrice());
        }
        event.setLiveStatus(command.getLiveStatus());
        event.setStage(command.getStage());
        event.setInfo(new HashMap<>(command.getInfo()));
        event.setEventPeriodGuid(periodGuid);
        if (command.getHomeTeam() != null) {
            event.setMainTeamGroupGuid(mainTeamGuid);
        }
        if (command.getAwayTeam() != null) {
            event.setClusterTeamGroupGuid(clusterTeamGuid);
        }
        if (command.getOnlineOverride() != null) {
            event.setOnline(command.getOnlineOverride());
        }
    }

    private void upsertLanguage(String eventGuid, EventUpsertCommand command) {
        var language = eventLanguageRepository.findByEventGuidAndLanguageGuid(eventGuid, command.getLanguageGuid());
        if (language.isPresent()) {
            language.get().setTitle(command.getTitle());
            return;
        }
        eventLanguageRepository.save(EventLanguage.builder()
                .eventGuid(eventGuid)
                .languageGuid(command.getLanguageGuid())
                .title(command.getTitle())
                .rules(command.getRules() == null ? "" : command.getRules())
                .build());
    }
}
