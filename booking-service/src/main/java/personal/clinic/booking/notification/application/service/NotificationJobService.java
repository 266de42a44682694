package personal.clinic.booking.notification.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.notification.application.port.in.DispatchNotificationUseCase;
import personal.clinic.booking.notification.application.port.in.EnqueueNotificationUseCase;
import personal.clinic.booking.notification.application.port.in.ProcessNotificationJobsUseCase;
import personal.clinic.booking.notification.application.port.out.NotificationJobRepository;
import personal.clinic.booking.notification.domain.model.NotificationJob;
import personal.clinic.booking.notification.domain.model.NotificationPayload;
import personal.clinic.booking.notification.domain.model.NotificationType;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Notification Job Service (Outbox)
 * 예약 트랜잭션 안에서 작업을 저장하고, 스케줄러가 PENDING 작업을 꺼내 발송
 * 작업은 재시도하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationJobService implements EnqueueNotificationUseCase, ProcessNotificationJobsUseCase {

    private final NotificationJobRepository notificationJobRepository;
    private final NotificationVariablesFactory notificationVariablesFactory;
    private final DispatchNotificationUseCase dispatchNotificationUseCase;
    private final ClinicProperties clinicProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public void enqueue(NotificationType type, Appointment appointment, String rescheduleReason) {
        NotificationPayload payload = notificationVariablesFactory.create(appointment, rescheduleReason);
        NotificationJob saved = notificationJobRepository.save(
                NotificationJob.create(appointment.id(), type, serialize(payload), Instant.now(clock)));
        log.debug("Notification job enqueued: jobId={}, type={}, appointmentId={}",
                saved.id(), type, appointment.id());
    }

    @Override
    public int processPendingJobs() {
        List<NotificationJob> jobs = notificationJobRepository.findPending(
                clinicProperties.notification().outboxBatchSize());

        for (NotificationJob job : jobs) {
            process(job);
        }
        return jobs.size();
    }

    private void process(NotificationJob job) {
        try {
            NotificationPayload payload = objectMapper.readValue(job.payload(), NotificationPayload.class);
            dispatchNotificationUseCase.deliver(job.appointmentId(), job.type(), payload);
            notificationJobRepository.save(job.markDone(Instant.now(clock)));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to process notification job: jobId={}, type={}, appointmentId={}",
                    job.id(), job.type(), job.appointmentId(), e);
            notificationJobRepository.save(job.markFailed(e.getMessage(), Instant.now(clock)));
        }
    }

    private String serialize(NotificationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification payload", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize notification payload", e);
        }
    }
}
