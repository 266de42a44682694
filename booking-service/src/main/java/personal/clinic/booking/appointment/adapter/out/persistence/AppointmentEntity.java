package personal.clinic.booking.appointment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Appointment JPA Entity
 * 예약 테이블 매핑
 *
 * active_slot은 활성 상태(pending, confirmed)일 때만 값을 가지므로
 * (provider_id, start_time, active_slot) Unique Index가 활성 예약의 같은 시작 시각 중복만 막는다.
 * (NULL은 Unique 비교 대상이 아님)
 */
@Entity
@Table(name = "appointments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_provider_start_active",
                columnNames = {"provider_id", "start_time", "active_slot"}
        ),
        indexes = {
                @Index(name = "idx_appointment_provider_time", columnList = "provider_id, start_time"),
                @Index(name = "idx_appointment_patient_email", columnList = "patient_email"),
                @Index(name = "idx_appointment_status_time", columnList = "status, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AppointmentEntity {

    static final String ACTIVE_MARKER = "ACTIVE";

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    @Column(name = "service_id", nullable = false, length = 64)
    private String serviceId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status;

    @Column(name = "active_slot", length = 10)
    private String activeSlot;

    @Column(name = "patient_name", nullable = false, length = 200)
    private String patientName;

    @Column(name = "patient_email", nullable = false, length = 200)
    private String patientEmail;

    @Column(name = "patient_phone", nullable = false, length = 50)
    private String patientPhone;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "custom_field_values", columnDefinition = "TEXT")
    private Map<String, String> customFieldValues;

    @Column(name = "reminder_sent", nullable = false)
    private boolean reminderSent;

    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @Column(name = "reschedule_reason", length = 1000)
    private String rescheduleReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static AppointmentEntity fromDomain(Appointment appointment) {
        AppointmentEntity entity = new AppointmentEntity();
        entity.id = appointment.id();
        entity.providerId = appointment.providerId();
        entity.serviceId = appointment.serviceId();
        entity.startTime = appointment.startTime();
        entity.endTime = appointment.endTime();
        entity.status = appointment.status();
        entity.activeSlot = appointment.isActive() ? ACTIVE_MARKER : null;
        entity.patientName = appointment.patientName();
        entity.patientEmail = appointment.patientEmail();
        entity.patientPhone = appointment.patientPhone();
        entity.customFieldValues = appointment.customFieldValues();
        entity.reminderSent = appointment.reminderSent();
        entity.reminderSentAt = appointment.reminderSentAt();
        entity.rescheduleReason = appointment.rescheduleReason();
        entity.createdAt = appointment.createdAt();
        entity.updatedAt = appointment.updatedAt();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Appointment toDomain() {
        return new Appointment(id, providerId, serviceId, startTime, endTime, status,
                patientName, patientEmail, patientPhone, customFieldValues,
                reminderSent, reminderSentAt, rescheduleReason, createdAt, updatedAt);
    }
}
