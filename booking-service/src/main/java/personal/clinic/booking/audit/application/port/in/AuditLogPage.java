package personal.clinic.booking.audit.application.port.in;

import personal.clinic.booking.audit.domain.model.AuditLog;

import java.util.List;

public record AuditLogPage(
        List<AuditLog> logs,
        long total,
        int limit,
        int skip) {
}
