package personal.clinic.booking.appointment.adapter.in.web.dto;

import personal.clinic.booking.appointment.application.port.in.AppointmentPage;

import java.util.List;

public record AppointmentListResponse(
        List<AppointmentResponse> appointments,
        long total,
        int limit,
        int skip
) {
    public static AppointmentListResponse from(AppointmentPage page) {
        return new AppointmentListResponse(
                page.appointments().stream().map(AppointmentResponse::from).toList(),
                page.total(),
                page.limit(),
                page.skip());
    }
}
