package com.eventpod.crawler.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "team_group_language", uniqueConstraints = {
        @UniqueConstraint(name = "uq_team_group_language", columnNames = {"team_group_guid", "language_guid"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamGroupLanguage {

    @Id
    @Column(length = 32)
    private String guid;

    @Column(name = "language_guid", nullable = false)
    private String languageGuid;

    @Column(name = "team_group_guid", nullable = false)
    private String teamGroupGuid;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String alias;

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
}
