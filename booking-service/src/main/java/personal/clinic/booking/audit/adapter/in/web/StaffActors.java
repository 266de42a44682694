package personal.clinic.booking.audit.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import personal.clinic.booking.audit.domain.model.StaffActor;

/**
 * 요청에서 감사 로그용 직원 정보 추출
 */
public final class StaffActors {

    public static final String STAFF_EMAIL_HEADER = "X-Staff-Email";

    private StaffActors() {
    }

    public static StaffActor from(String staffEmail, HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        String ipAddress = forwarded != null && !forwarded.isBlank()
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        String email = staffEmail == null || staffEmail.isBlank() ? "unknown" : staffEmail.trim();
        return new StaffActor(email, ipAddress, request.getHeader("User-Agent"));
    }
}
