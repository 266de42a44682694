package personal.clinic.common.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@DisplayName("HealthCheckService 단위 테스트")
class HealthCheckServiceTest {

    private final HealthCheckService healthCheckService = new HealthCheckService();

    @Test
    @DisplayName("유효한 연결이면 UP, 연결 실패면 DOWN")
    void checkDatabase() throws SQLException {
        DataSource healthy = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        given(healthy.getConnection()).willReturn(connection);
        given(connection.isValid(1)).willReturn(true);

        DataSource broken = mock(DataSource.class);
        given(broken.getConnection()).willThrow(new SQLException("refused"));

        assertThat(healthCheckService.checkDatabase(healthy)).isEqualTo("UP");
        assertThat(healthCheckService.checkDatabase(broken)).isEqualTo("DOWN");
    }

    @Test
    @DisplayName("스케줄러: 실행 전 STARTING, 허용 지연 이내 UP, 초과 시 DOWN")
    void checkScheduler() {
        assertThat(healthCheckService.checkScheduler(0, 1_000_000, 180_000)).isEqualTo("STARTING");
        assertThat(healthCheckService.checkScheduler(900_000, 1_000_000, 180_000)).isEqualTo("UP");
        assertThat(healthCheckService.checkScheduler(500_000, 1_000_000, 180_000)).isEqualTo("DOWN");
    }
}
