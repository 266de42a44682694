package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

import java.time.Instant;

/**
 * 예약 목록 검색 조건. startDate/endDate는 시작 시각 기준 (양 끝 포함)
 */
public record AppointmentSearchQuery(
        AppointmentStatus status,
        String providerId,
        Instant startDate,
        Instant endDate,
        int limit,
        int skip
) {
}
