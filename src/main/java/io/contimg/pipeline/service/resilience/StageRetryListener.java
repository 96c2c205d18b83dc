package io.contimg.pipeline.service.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StageRetryListener implements RetryListener {

    static final String OPERATION_ATTRIBUTE = "operation";

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("[{}] Attempt {} failed: {}", context.getAttribute(OPERATION_ATTRIBUTE), context.getRetryCount(),
                 throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("[{}] Giving up after {} attempts.", context.getAttribute(OPERATION_ATTRIBUTE),
                      context.getRetryCount());
        }
    }
}
