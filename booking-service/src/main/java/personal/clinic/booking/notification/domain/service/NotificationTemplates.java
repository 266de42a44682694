package personal.clinic.booking.notification.domain.service;

import personal.clinic.booking.notification.domain.model.NotificationTemplate;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.EnumMap;
import java.util.Map;

/**
 * 알림 종류별 기본 템플릿 (텍스트 전용)
 */
public final class NotificationTemplates {

    private static final String SIGNATURE = "Thank you,\nThe Clinic Team";

    private static final Map<NotificationType, NotificationTemplate> TEMPLATES = new EnumMap<>(NotificationType.class);

    static {
        TEMPLATES.put(NotificationType.BOOKING_PENDING, new NotificationTemplate(
                "Appointment Pending Approval - {{serviceName}}",
                "Hello {{patientName}},\n\n"
                        + "Thank you for booking an appointment with us! Your appointment is pending approval.\n\n"
                        + "Service: {{serviceName}}\n"
                        + "Provider: {{providerName}}\n"
                        + "Date: {{appointmentDate}}\n"
                        + "Time: {{appointmentTime}}\n\n"
                        + "We will confirm your appointment within 24 hours. "
                        + "You will receive an email confirmation once approved.\n\n"
                        + SIGNATURE,
                "Hello {{patientName}}, thank you for booking! Your appointment is pending approval. "
                        + "We'll confirm within 24 hours. Service: {{serviceName}} on {{appointmentDate}}."));

        TEMPLATES.put(NotificationType.STATUS_CHANGED, new NotificationTemplate(
                "Appointment Status Updated - {{serviceName}}",
                "Hello {{patientName}},\n\n"
                        + "Your appointment status has been updated.\n\n"
                        + "Service: {{serviceName}}\n"
                        + "Status: {{newStatus}}\n"
                        + "Date: {{appointmentDate}}\n"
                        + "Time: {{appointmentTime}}\n\n"
                        + "If you have any questions, please contact us.\n\n"
                        + SIGNATURE,
                "Your {{serviceName}} appointment on {{appointmentDate}} at {{appointmentTime}} "
                        + "status: {{newStatus}}. Contact us with questions."));

        TEMPLATES.put(NotificationType.APPOINTMENT_RESCHEDULED, new NotificationTemplate(
                "Appointment Rescheduled - {{serviceName}}",
                "Hello {{patientName}},\n\n"
                        + "Your appointment has been rescheduled successfully.\n\n"
                        + "Service: {{serviceName}}\n"
                        + "Provider: {{providerName}}\n"
                        + "New Date: {{appointmentDate}}\n"
                        + "New Time: {{appointmentTime}}\n\n"
                        + "{{#rescheduleReason}}Reason for reschedule: {{rescheduleReason}}\n\n{{/rescheduleReason}}"
                        + "If you have any questions, please contact us.\n\n"
                        + SIGNATURE,
                "Your {{serviceName}} appointment has been rescheduled to {{appointmentDate}} "
                        + "at {{appointmentTime}} with {{providerName}}. Thank you!"));

        TEMPLATES.put(NotificationType.APPOINTMENT_REMINDER, new NotificationTemplate(
                "Reminder: Your appointment is coming up - {{serviceName}}",
                "Hello {{patientName}},\n\n"
                        + "This is a reminder about your upcoming appointment.\n\n"
                        + "Service: {{serviceName}}\n"
                        + "Provider: {{providerName}}\n"
                        + "Date: {{appointmentDate}}\n"
                        + "Time: {{appointmentTime}}\n\n"
                        + "Please arrive 10 minutes early. "
                        + "If you need to cancel or reschedule, please contact us as soon as possible.\n\n"
                        + SIGNATURE,
                "Reminder: {{serviceName}} with {{providerName}} on {{appointmentDate}} "
                        + "at {{appointmentTime}}. Please arrive 10 minutes early."));
    }

    private NotificationTemplates() {
    }

    public static NotificationTemplate of(NotificationType type) {
        return TEMPLATES.get(type);
    }
}
