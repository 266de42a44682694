package personal.clinic.booking.audit.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditStatus;

import java.time.Instant;

/**
 * Audit Log JPA Entity
 */
@Entity
@Table(name = "audit_logs",
        indexes = {
                @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
                @Index(name = "idx_audit_timestamp", columnList = "timestamp")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_email", length = 200)
    private String staffEmail;

    @Column(nullable = false, length = 50)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 20)
    private AuditEntityType entityType;

    @Column(name = "entity_id", length = 64)
    private String entityId;

    @Column(name = "entity_name", length = 500)
    private String entityName;

    @Column(name = "changes", columnDefinition = "TEXT")
    private String changesJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditStatus status;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    public static AuditLogEntity create(String staffEmail, String action, AuditEntityType entityType,
                                        String entityId, String entityName, String changesJson,
                                        AuditStatus status, String errorMessage, String ipAddress,
                                        String userAgent, Instant timestamp) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.staffEmail = staffEmail;
        entity.action = action;
        entity.entityType = entityType;
        entity.entityId = entityId;
        entity.entityName = entityName;
        entity.changesJson = changesJson;
        entity.status = status;
        entity.errorMessage = errorMessage;
        entity.ipAddress = ipAddress;
        entity.userAgent = userAgent;
        entity.timestamp = timestamp;
        return entity;
    }
}
