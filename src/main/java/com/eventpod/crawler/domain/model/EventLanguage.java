package com.eventpod.crawler.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "event_language", uniqueConstraints = {
        @UniqueConstraint(name = "uq_event_language_event_lang", columnNames = {"event_guid", "language_guid"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventLanguage {

    @Id
    @Column(length = 32)
    private String guid;

    @Column(name = "event_guid", nullable = false)
    private String eventGuid;

    @Column(name = "language_guid", nullable = false)
    private String languageGuid;

    @Column(nullable = false, length = 200)
    private String title;

    @Builder.Default
    @Column(nullable = false, columnDefinition = "text")
    private String rules = "";

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (guid == null) {
            guid = Guids.newGuid();
        }
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
