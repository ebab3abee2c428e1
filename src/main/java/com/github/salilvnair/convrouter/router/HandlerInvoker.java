package com.github.salilvnair.convrouter.router;

import com.github.salilvnair.convrouter.config.ConvRouterDispatchConfig;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.route.RouteHandler;
import com.github.salilvnair.convrouter.session.IntentContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs route handlers on a bounded worker pool so a slow handler can be abandoned after its timeout.
 * A non-positive timeout runs the handler on the calling thread without a bound.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HandlerInvoker {

    private final ConvRouterDispatchConfig dispatchConfig;

    private volatile ThreadPoolExecutor executor;

    @PostConstruct
    public void init() {
        int workers = Math.max(1, dispatchConfig.getWorkerThreads());
        int queueCapacity = Math.max(1, dispatchConfig.getQueueCapacity());
        long keepAliveSeconds = Math.max(0, dispatchConfig.getKeepAliveSeconds());
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                workers,
                workers,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new HandlerThreadFactory()
        );
        pool.allowCoreThreadTimeOut(keepAliveSeconds > 0);
        executor = pool;
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(dispatchConfig.getHandlerTimeoutMs());
    }

    public HandlerOutcome invoke(RouteHandler handler, Intent intent, IntentContext context, Duration timeout) {
        Duration effective = timeout == null ? defaultTimeout() : timeout;
        ThreadPoolExecutor pool = executor;
        if (effective.isZero() || effective.isNegative() || pool == null || pool.isShutdown()) {
            return invokeInline(handler, intent, context);
        }

        Future<Object> future;
        try {
            future = pool.submit(() -> handler.execute(intent, context));
        } catch (RejectedExecutionException e) {
            log.warn("Handler pool saturated, running intent {} on caller thread", intent.getIntentId());
            return invokeInline(handler, intent, context);
        }

        try {
            return new HandlerOutcome.Completed(future.get(effective.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return new HandlerOutcome.TimedOut(effective);
        } catch (ExecutionException e) {
            return new HandlerOutcome.Failed(e.getCause() == null ? e : e.getCause());
        } catch (CancellationException e) {
            return new HandlerOutcome.Cancelled("Handler execution was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new HandlerOutcome.Cancelled("Interrupted while waiting for handler");
        }
    }

    @PreDestroy
    public void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
    }

    private HandlerOutcome invokeInline(RouteHandler handler, Intent intent, IntentContext context) {
        try {
            return new HandlerOutcome.Completed(handler.execute(intent, context));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HandlerOutcome.Cancelled("Handler was interrupted");
        } catch (Throwable e) {
            return new HandlerOutcome.Failed(e);
        }
    }

    private static final class HandlerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "convrouter-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
