package personal.clinic.booking.appointment.adapter.in.web.dto;

/**
 * 단순 처리 결과 응답 DTO
 */
public record ActionResponse(
        boolean success,
        String message
) {
    public static ActionResponse ok(String message) {
        return new ActionResponse(true, message);
    }
}
