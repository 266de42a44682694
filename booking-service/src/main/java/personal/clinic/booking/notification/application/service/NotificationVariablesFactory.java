package personal.clinic.booking.notification.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.catalog.application.port.in.ManageProvidersUseCase;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.notification.domain.model.NotificationPayload;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 예약 정보로 템플릿 변수를 구성
 * 날짜/시간은 클리닉 시간대 기준
 */
@Component
@RequiredArgsConstructor
public class NotificationVariablesFactory {

    static final String DEFAULT_SERVICE_NAME = "Appointment";
    static final String DEFAULT_PROVIDER_NAME = "Healthcare Provider";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);

    private final ManageServicesUseCase manageServicesUseCase;
    private final ManageProvidersUseCase manageProvidersUseCase;
    private final ClinicProperties clinicProperties;

    public NotificationPayload create(Appointment appointment, String rescheduleReason) {
        ZonedDateTime start = appointment.startTime().atZone(clinicProperties.zoneId());

        Map<String, String> variables = new HashMap<>();
        variables.put("patientName", appointment.patientName());
        variables.put("serviceName", manageServicesUseCase.findService(appointment.serviceId())
                .map(ClinicService::name)
                .orElse(DEFAULT_SERVICE_NAME));
        variables.put("providerName", manageProvidersUseCase.findProvider(appointment.providerId())
                .map(Provider::name)
                .orElse(DEFAULT_PROVIDER_NAME));
        variables.put("appointmentDate", start.format(DATE_FORMAT));
        variables.put("appointmentTime", start.format(TIME_FORMAT));
        variables.put("appointmentId", appointment.id());
        variables.put("duration", String.valueOf(Duration.between(appointment.startTime(), appointment.endTime())
                .toMinutes()));
        variables.put("newStatus", capitalize(appointment.status().value()));
        if (rescheduleReason != null && !rescheduleReason.isBlank()) {
            variables.put("rescheduleReason", rescheduleReason.trim());
        }

        return new NotificationPayload(appointment.patientEmail(), appointment.patientPhone(), variables);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
