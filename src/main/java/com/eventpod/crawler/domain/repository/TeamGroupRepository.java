package com.eventpod.crawler.domain.repository;

import com.eventpod.crawler.domain.model.TeamGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamGroupRepository extends JpaRepository<TeamGroup, String> {

    Optional<TeamGroup> findByExternalIdAndEcosystemGuid(String externalId, String ecosystemGuid);
}
