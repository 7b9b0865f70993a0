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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "event_period", uniqueConstraints = {
        @UniqueConstraint(name = "uq_event_period_code", columnNames = "code")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventPeriod {

    @Id
    @Column(length = 32)
    private String guid;

    @Column(nullable = false, length = 64)
    private String code;

    @Builder.Default
    @Column(name = "is_active")
    private boolean active = true;

    @Column(length = 64)
    private String scheduled;

    @Column(length = 200)
    private String remark;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> extra = new HashMap<>();

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
