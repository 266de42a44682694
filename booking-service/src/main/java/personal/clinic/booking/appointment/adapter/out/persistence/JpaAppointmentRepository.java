package personal.clinic.booking.appointment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

/**
 * Spring Data JPA Repository for Appointment
 */
public interface JpaAppointmentRepository extends JpaRepository<AppointmentEntity, String>,
        JpaSpecificationExecutor<AppointmentEntity> {

    @Query("SELECT COUNT(DISTINCT a.patientEmail) FROM AppointmentEntity a")
    long countDistinctPatientEmails();

    /**
     * 리마인더 발송 선점 (조건부 UPDATE)
     * 영향받은 행이 1이면 선점 성공
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AppointmentEntity a SET a.reminderSent = true, a.reminderSentAt = :sentAt " +
            "WHERE a.id = :id AND a.reminderSent = false")
    int claimReminder(@Param("id") String id, @Param("sentAt") Instant sentAt);
}
