package personal.clinic.booking.audit.application.port.in;

import personal.clinic.booking.audit.domain.model.AuditLog;

/**
 * Record Audit UseCase (Input Port)
 */
public interface RecordAuditUseCase {

    /**
     * 성공한 작업 기록. 호출자의 트랜잭션에 참여하므로 작업이 롤백되면 기록도 롤백된다.
     */
    void record(AuditLog auditLog);

    /**
     * 실패한 작업 기록. 호출자의 트랜잭션과 무관하게 별도 트랜잭션으로 저장한다.
     */
    void recordFailure(AuditLog auditLog);
}
