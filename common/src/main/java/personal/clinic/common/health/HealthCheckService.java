package personal.clinic.common.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Health Check 공통 유틸리티 서비스
 * 인프라 컴포넌트의 상태를 확인하는 재사용 가능한 메서드 제공
 */
@Slf4j
@Service
public class HealthCheckService {

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource the DataSource to check
     * @return "UP" if database is reachable, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return "DOWN";
        }
    }

    /**
     * 백그라운드 스케줄러 상태 확인
     * 마지막 실행 시각이 허용 지연(maxLagMillis)보다 오래되었으면 DOWN
     *
     * @param lastRunEpochMillis 마지막 실행 시각 (0이면 아직 실행 전)
     * @param nowEpochMillis     현재 시각
     * @param maxLagMillis       허용 지연
     */
    public String checkScheduler(long lastRunEpochMillis, long nowEpochMillis, long maxLagMillis) {
        if (lastRunEpochMillis == 0) {
            return "STARTING";
        }
        return nowEpochMillis - lastRunEpochMillis <= maxLagMillis ? "UP" : "DOWN";
    }
}
