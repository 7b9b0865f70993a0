package com.eventpod.crawler.domain.repository;

import com.eventpod.crawler.domain.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface EventRepository extends JpaRepository<Event, String> {

    Optional<Event> findByExternalId(String externalId);

    long countByExternalId(String externalId);
}
