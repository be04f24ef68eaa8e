package com.williamcallahan.orderedlists.logging;

import com.williamcallahan.orderedlists.domain.lists.ListEditOutcome;
import java.util.List;
import java.util.Locale;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each list operation that passes through the service, with its duration.
 */
@Aspect
@Component
public class ListProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    // Thread-local storage for request tracking
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
        "REQ-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log list parsing and lookup
     */
    @Around("execution(public * com.williamcallahan.orderedlists.service.ListMarkerService.parse(..)) || "
            + "execution(public * com.williamcallahan.orderedlists.service.ListMarkerService.findListContaining(..))")
    public Object logListParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "LIST PARSING");
    }

    /**
     * Log editing operations
     */
    @Around("execution(public com.williamcallahan.orderedlists.domain.lists.ListEditOutcome "
            + "com.williamcallahan.orderedlists.service.ListMarkerService.*(..))")
    public Object logListEdit(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "LIST EDIT");
    }

    private Object logStep(ProceedingJoinPoint joinPoint, String step) throws Throwable {
        String requestId = REQUEST_ID.get();
        String operation = joinPoint.getSignature().getName().toUpperCase(Locale.ROOT);
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.debug("[{}] {} {} - Starting with {} line(s)", requestId, step, operation,
            lineCount(joinPoint.getArgs()));

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof ListEditOutcome.Rejected rejected) {
                PIPELINE_LOG.info("[{}] {} {} - Rejected ({}) in {}ms", requestId, step, operation,
                    rejected.reason(), duration);
            } else if (result instanceof ListEditOutcome.Applied applied) {
                PIPELINE_LOG.info("[{}] {} {} - Completed with {} change(s) in {}ms", requestId, step, operation,
                    applied.plan().changes().size(), duration);
            } else if (result instanceof List<?> lists) {
                PIPELINE_LOG.info("[{}] {} {} - Found {} list(s) in {}ms", requestId, step, operation,
                    lists.size(), duration);
            } else {
                PIPELINE_LOG.info("[{}] {} {} - Completed in {}ms", requestId, step, operation, duration);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} {} - Failed: {}", requestId, step, operation, e.getMessage());
            throw e;
        }
    }

    private static int lineCount(Object[] args) {
        if (args.length > 0 && args[0] instanceof List<?> lines) {
            return lines.size();
        }
        return 0;
    }
}
