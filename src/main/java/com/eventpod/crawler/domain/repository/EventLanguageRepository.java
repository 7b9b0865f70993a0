package com.eventpod.crawler.domain.repository;

import com.eventpod.crawler.domain.model.EventLanguage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface EventLanguageRepository extends JpaRepository<EventLanguage, String> {

    Optional<EventLanguage> findByEventGuidAndLanguageGuid(String eventGuid, String languageGuid);

    long countByEventGuid(String eventGuid);
}
