package personal.clinic.booking.reminder.adapter.out.timer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("ReminderTimerRegistry 테스트")
class ReminderTimerRegistryTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private ReminderTimerRegistry registry;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.initialize();
        registry = new ReminderTimerRegistry(taskScheduler);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("등록한 타이머는 지정 시각에 한 번 실행되고 목록에서 제거된다")
    void firesOnce() {
        // given
        AtomicInteger fired = new AtomicInteger();

        // when
        registry.arm("a1", Instant.now().plusMillis(100), fired::incrementAndGet);

        // then
        assertThat(registry.armedCount()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            assertThat(fired.get()).isEqualTo(1);
            assertThat(registry.armedCount()).isZero();
        });
    }

    @Test
    @DisplayName("같은 키로 다시 등록하면 기존 타이머를 교체한다")
    void sameKeyReplaces() {
        // given
        Instant fireAt = Instant.now().plusMillis(200);
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        // when
        registry.arm("a1", fireAt, first::incrementAndGet);
        registry.arm("a1", fireAt, second::incrementAndGet);

        // then
        assertThat(registry.armedCount()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(second.get()).isEqualTo(1));
        assertThat(first.get()).isZero();
    }

    @Test
    @DisplayName("해제하면 예약의 모든 타이머가 실행되지 않는다")
    void cancelAllPreventsFiring() throws InterruptedException {
        // given
        AtomicInteger fired = new AtomicInteger();
        registry.arm("a1", Instant.now().plusMillis(200), fired::incrementAndGet);
        registry.arm("a1", Instant.now().plusMillis(300), fired::incrementAndGet);
        registry.arm("a2", Instant.now().plusSeconds(60), fired::incrementAndGet);

        // when
        int cancelled = registry.cancelAll("a1");

        // then
        assertThat(cancelled).isEqualTo(2);
        assertThat(registry.armedCount()).isEqualTo(1);
        Thread.sleep(500);
        assertThat(fired.get()).isZero();
    }

    @Test
    @DisplayName("해제는 정확히 같은 예약 ID의 타이머만 대상으로 한다")
    void cancelAllMatchesExactAppointmentId() {
        // given: "abc"와 구분자를 포함한 "abc_x"
        AtomicInteger fired = new AtomicInteger();
        registry.arm("abc", Instant.now().plusSeconds(60), fired::incrementAndGet);
        registry.arm("abc_x", Instant.now().plusMillis(200), fired::incrementAndGet);

        // when
        int cancelled = registry.cancelAll("abc");

        // then
        assertThat(cancelled).isEqualTo(1);
        assertThat(registry.armedCount()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(fired.get()).isEqualTo(1));
    }
}
