package com.eventpod.crawler.domain.repository;

import com.eventpod.crawler.domain.model.EventPeriod;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface EventPeriodRepository extends JpaRepository<EventPeriod, String> {

    Optional<EventPeriod> findByCode(String code);

    long countByCode(String code);
}
