package personal.clinic.booking.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.audit.domain.model.AuditEntityType;

/**
 * 쿼리 파라미터/경로 변수의 소문자 enum 값 변환 (예: status=pending)
 */
@Configuration
public class WebConversionConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, AppointmentStatus.class, AppointmentStatus::from);
        registry.addConverter(String.class, AuditEntityType.class, AuditEntityType::from);
    }
}
