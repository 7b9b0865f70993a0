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
@Table(name = "team_group", uniqueConstraints = {
        @UniqueConstraint(name = "uq_team_group_external_ecosystem", columnNames = {"external_id", "ecosystem_guid"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamGroup {

    @Id
    @Column(length = 32)
    private String guid;

    @Column(name = "ecosystem_guid", nullable = false)
    private String ecosystemGuid;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Builder.Default
    @Column(nullable = false)
    private String logo = "";

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
