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
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@DynamicUpdate
@Table(name = "event", uniqueConstraints = {
        @UniqueConstraint(name = "uq_event_external_id", columnNames = "external_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    public static final String NO_TEAM = "0";

    @Id
    @Column(length = 32)
    private String guid;

    @Column(nullable = false)
    private String categoryGuid;

    @Column(nullable = false)
    private String ecosystemGuid;

    @Column(nullable = false)
    private String eventPeriodGuid;

    @Builder.Default
    @Column(nullable = false)
    private String mainTeamGroupGuid = NO_TEAM;

    @Builder.Default
    @Column(nullable = false)
    private String clusterTeamGroupGuid = NO_TEAM;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Builder.Default
    @Column(nullable = false)
    private String mainScore = "0";

    @Builder.Default
    @Column(nullable = false)
    private String clusterScore = "0";

    @Builder.Default
    @Column(nullable = false)
    private String price = "0";

    @Builder.Default
    @Column(nullable = false, length = 500)
    private String logo = "";

    private short eventType;

    @Builder.Default
    @Column(nullable = false)
    private String experimentResult = "";

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> info = new HashMap<>();

    @Column(name = "is_online")
    private boolean online;

    @Column(name = "is_live")
    private short isLive;

    @Column(name = "is_sports")
    private boolean sports;

    @Column(nullable = false, length = 20)
    private String stage;

    private Instant createdAt;

    private Instant updatedAt;

    public LiveStatus getLiveStatus() {
        return LiveStatus.fromCode(isLive);
    }

    public void setLiveStatus(LiveStatus status) {
        this.isLive = status.code();
    }

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
