package com.eventpod.crawler.domain.repository;

import com.eventpod.crawler.domain.model.TeamGroupLanguage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamGroupLanguageRepository extends JpaRepository<TeamGroupLanguage, String> {

    Optional<TeamGroupLanguage> findByTeamGroupGuidAndLanguageGuid(String teamGroupGuid, String languageGuid);
}
