package personal.clinic.booking.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Booking Service HTTP Adapter
 * 인수 테스트용 HTTP 클라이언트 (포트는 요청 시점에 Environment에서 조회)
 */
@Slf4j
@Component
public class BookingHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private static final String STAFF_EMAIL = "front-desk@clinic.test";

    private final Environment environment;

    public BookingHttpAdapter(Environment environment) {
        this.environment = environment;
    }

    private int getPort() {
        return environment.getProperty("local.server.port", Integer.class, 8080);
    }

    private RequestSpecification givenRequest() {
        return RestAssured.given()
                .baseUri(BASE_URI)
                .port(getPort())
                .contentType(ContentType.JSON);
    }

    private RequestSpecification givenStaffRequest() {
        return givenRequest().header("X-Staff-Email", STAFF_EMAIL);
    }

    // ==========================================
    // 카탈로그 API
    // ==========================================

    public String createService(String name, int durationMinutes) {
        log.debug(">>> HTTP: POST /services - name={}", name);
        return givenStaffRequest()
                .body(Map.of("name", name, "duration", durationMinutes))
                .when()
                .post("/api/services")
                .then()
                .statusCode(201)
                .extract()
                .path("id");
    }

    public String createProvider(String name, String serviceId) {
        log.debug(">>> HTTP: POST /providers - name={}", name);
        return givenStaffRequest()
                .body(Map.of("name", name, "email", "provider@clinic.test", "serviceIds", Set.of(serviceId)))
                .when()
                .post("/api/providers")
                .then()
                .statusCode(201)
                .extract()
                .path("id");
    }

    /**
     * 월~금 지정 시간 근무, 나머지 요일 휴무
     */
    public void replaceWeekdayAvailability(String providerId, String start, String end, List<LocalDate> blockedDates) {
        List<Map<String, Object>> hours = new ArrayList<>();
        for (int day = 0; day <= 6; day++) {
            boolean open = day >= 1 && day <= 5;
            hours.add(open
                    ? Map.of("dayOfWeek", day, "isOpen", true, "startTime", start, "endTime", end)
                    : Map.of("dayOfWeek", day, "isOpen", false));
        }

        givenStaffRequest()
                .body(Map.of("businessHours", hours,
                        "blockedDates", blockedDates.stream().map(LocalDate::toString).toList()))
                .when()
                .put("/api/providers/{providerId}/availability", providerId)
                .then()
                .statusCode(200);
    }

    // ==========================================
    // 예약 API
    // ==========================================

    public Response getSlots(String providerId, LocalDate date, int duration) {
        log.debug(">>> HTTP: GET /slots - providerId={}, date={}", providerId, date);
        return givenRequest()
                .queryParam("providerId", providerId)
                .queryParam("date", date.toString())
                .queryParam("duration", duration)
                .when()
                .get("/api/slots");
    }

    public Response bookAppointment(String providerId, String serviceId, Instant start, Instant end,
                                    String patientEmail) {
        log.debug(">>> HTTP: POST /appointments - providerId={}, start={}", providerId, start);
        return givenRequest()
                .body(Map.of(
                        "providerId", providerId,
                        "serviceId", serviceId,
                        "startTime", start.toString(),
                        "endTime", end.toString(),
                        "patientName", "Acceptance Patient",
                        "patientEmail", patientEmail,
                        "patientPhone", "555-123-4567"))
                .when()
                .post("/api/appointments");
    }

    public Response cancelAppointment(String appointmentId) {
        return givenStaffRequest()
                .when()
                .post("/api/admin/appointments/{appointmentId}/cancel", appointmentId);
    }

    // ==========================================
    // 알림 API
    // ==========================================

    public Response getNotificationLogs(String appointmentId) {
        return givenRequest()
                .queryParam("appointmentId", appointmentId)
                .when()
                .get("/api/admin/notifications/logs");
    }
}
