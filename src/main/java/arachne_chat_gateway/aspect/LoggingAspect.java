package arachne_chat_gateway.aspect;

import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.security.AuthenticatedUser;
import io.micrometer.core.instrument.MeterRegistry;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);
    private final MeterRegistry meterRegistry;

    public LoggingAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Pointcut("execution(public * arachne_chat_gateway.service.AuthSessionService.refresh(..))"
            + " || execution(public * arachne_chat_gateway.service.AuthSessionService.logout(..))")
    public void sessionLifecyclePointcut() {}

    @Pointcut("execution(public * arachne_chat_gateway.service.ChatStreamService.openStream(..))")
    public void streamOpeningPointcut() {}

    @Around("sessionLifecyclePointcut() || streamOpeningPointcut()")
    public Object logGatewayOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().getName();
        Object[] args = joinPoint.getArgs();
        String subject = "N/A";

        if (args.length > 0 && args[0] instanceof ClientContext context) {
            subject = context.getSubject();
        } else {
            subject = AuthenticatedUser.currentClaims().map(TokenClaims::getSubject).orElse(subject);
        }

        log.info(">> Iniciando: {}() | Sujeito: '{}'", methodName, subject);
        long startTime = System.currentTimeMillis();
        Throwable thrownException = null;
        String status = "success";

        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            thrownException = e;
            status = "failure";
            throw e;
        } finally {
            long executionTime = System.currentTimeMillis() - startTime;
            if (thrownException == null) {
                log.info("<< Finalizado com sucesso: {}() | Tempo de Execução Total: {}ms", methodName, executionTime);
            } else {
                log.warn("<< Finalizado com erro: {}() | Tempo de Execução Total: {}ms | Erro: {}", methodName, executionTime, thrownException.getMessage());
            }

            meterRegistry.timer("gateway.operation.time", "method", methodName, "status", status)
                    .record(executionTime, TimeUnit.MILLISECONDS);
        }
    }
}
