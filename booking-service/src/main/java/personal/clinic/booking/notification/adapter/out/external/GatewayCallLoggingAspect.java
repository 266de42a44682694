package personal.clinic.booking.notification.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Gateway Call Logging Aspect
 *
 * @CircuitBreaker 가 붙은 외부 게이트웨이 호출의 소요 시간 측정 (fallback 포함)
 *
 *            보안: 수신자, 본문 등 인자 값은 로깅하지 않음
 */
@Slf4j
@Aspect
@Component
public class GatewayCallLoggingAspect {

    @Around("@annotation(io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker)")
    public Object logGatewayCall(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        String methodName = joinPoint.getSignature().toShortString();

        try {
            Object result = joinPoint.proceed();
            log.debug("Gateway call completed: method={}, totalTime={}ms",
                    methodName, (System.nanoTime() - startTime) / 1_000_000);
            return result;
        } catch (Throwable e) {
            log.warn("Gateway call failed: method={}, totalTime={}ms, error={}",
                    methodName, (System.nanoTime() - startTime) / 1_000_000, e.getClass().getSimpleName());
            throw e;
        }
    }
}
