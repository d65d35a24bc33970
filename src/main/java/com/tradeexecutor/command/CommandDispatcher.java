package com.tradeexecutor.command;

import com.tradeexecutor.command.TerminalCommandExecutor.ExecutionOutcome;
import com.tradeexecutor.config.CommandConfig;
import com.tradeexecutor.domain.model.Command;
import com.tradeexecutor.domain.model.CommandResult;
import com.tradeexecutor.event.EventPublisherHelper;
import com.tradeexecutor.event.SystemEventType;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.exception.TransportTimeoutException;
import com.tradeexecutor.safety.KillSwitchService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Dedicated consumer thread that drains the {@link CommandQueue} and sends commands to the
 * terminal through the {@link TerminalCommandExecutor}.
 *
 * <p>{@link #process} is also the entry point for out-of-band dispatch, so queued and
 * out-of-band commands share the same steps:
 * <ol>
 *   <li>claim the id in the {@link InFlightGuard}; a duplicate is skipped</li>
 *   <li>re-check the kill switch for open-trade kinds</li>
 *   <li>take a send slot from the rate limiter</li>
 *   <li>send with a timeout on {@code dispatchExecutor}; only that send is cancelled on timeout</li>
 *   <li>retry timeouts and transport faults with the configured delay table</li>
 *   <li>report COMPLETED or FAILED exactly once</li>
 * </ol>
 */
@Component
public class CommandDispatcher implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandQueue commandQueue;
    private final TerminalCommandExecutor terminalCommandExecutor;
    private final InFlightGuard inFlightGuard;
    private final CommandResultReporter commandResultReporter;
    private final KillSwitchService killSwitchService;
    private final RateLimiter commandRateLimiter;
    private final CommandConfig commandConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final ExecutorService dispatchExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public CommandDispatcher(
            CommandQueue commandQueue,
            TerminalCommandExecutor terminalCommandExecutor,
            InFlightGuard inFlightGuard,
            CommandResultReporter commandResultReporter,
            KillSwitchService killSwitchService,
            RateLimiter commandRateLimiter,
            CommandConfig commandConfig,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor) {
        this.commandQueue = commandQueue;
        this.terminalCommandExecutor = terminalCommandExecutor;
        this.inFlightGuard = inFlightGuard;
        this.commandResultReporter = commandResultReporter;
        this.killSwitchService = killSwitchService;
        this.commandRateLimiter = commandRateLimiter;
        this.commandConfig = commandConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.dispatchExecutor = dispatchExecutor;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "command-dispatcher");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("CommandDispatcher started");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("CommandDispatcher stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Start early so the queue is draining before strategies begin evaluating
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void processLoop() {
        while (running.get()) {
            try {
                QueuedCommand queued = commandQueue.take();
                log.debug("Dequeued {} after {}ms", queued.getCommand().getId(),
                        System.currentTimeMillis() - queued.getEnqueuedAt());
                process(queued.getCommand());
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("CommandDispatcher interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("CommandDispatcher interrupted unexpectedly, resuming");
            } catch (RuntimeException e) {
                log.error("Unhandled error in command dispatcher", e);
                eventPublisherHelper.publishSystemEvent(
                        this,
                        SystemEventType.DISPATCHER_CRASHED,
                        "Dispatcher error: " + e.getMessage(),
                        Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        cancelRemaining();
    }

    /** Queued commands left at shutdown are reported CANCELLED rather than sent to a closing terminal. */
    private void cancelRemaining() {
        int cancelled = 0;
        QueuedCommand remaining;
        while ((remaining = commandQueue.poll()) != null) {
            Command command = remaining.getCommand();
            commandResultReporter.report(command, CommandResult.cancelled(command, "Executor shutting down"));
            cancelled++;
        }
        if (cancelled > 0) {
            log.info("Cancelled {} queued commands during shutdown", cancelled);
        }
    }

    // ========================
    // DISPATCH
    // ========================

    /**
     * Runs one command to completion. Called from the consumer thread for queued commands
     * and from {@code dispatchExecutor} for out-of-band ones.
     */
    public void process(Command command) {
        if (!inFlightGuard.tryAcquire(command.getId())) {
            return;
        }
        try {
            CommandResult result = executeWithRetry(command);
            commandResultReporter.report(command, result);
        } finally {
            inFlightGuard.release(command.getId());
        }
    }

    CommandResult executeWithRetry(Command command) {
        while (true) {
            if (command.getKind().opensExposure() && killSwitchService.isTripped()) {
                return CommandResult.denied(command, "Kill switch is tripped");
            }
            try {
                awaitSendSlot(command);
                ExecutionOutcome outcome = sendWithTimeout(command);
                return outcome.success()
                        ? CommandResult.completed(command, outcome.message(), outcome.data())
                        : CommandResult.failed(command, outcome.message());
            } catch (TransportException e) {
                int retry = command.incrementRetryCount();
                if (retry > command.getMaxRetries()) {
                    log.error("Command {} exhausted {} retries: {}", command.getId(), command.getMaxRetries(), e.getMessage());
                    return CommandResult.executionFailed(command, "Failed after " + retry + " attempts: " + e.getMessage());
                }
                long delay = commandConfig.retryDelayMs(retry);
                log.warn("Command {} attempt {} failed ({}), retrying in {}ms",
                        command.getId(), retry, e.getMessage(), delay);
                if (!sleep(delay)) {
                    return CommandResult.executionFailed(command, "Interrupted while waiting to retry");
                }
            } catch (RuntimeException e) {
                log.error("Command {} failed with unexpected error", command.getId(), e);
                return CommandResult.executionFailed(command, "Unexpected error: " + e.getMessage());
            }
        }
    }

    /** Waits for a rate-limit permission; running out of patience counts as a retryable fault. */
    private void awaitSendSlot(Command command) {
        if (!commandRateLimiter.acquirePermission()) {
            throw new TransportException("Rate limit window exhausted for command " + command.getId());
        }
    }

    private ExecutionOutcome sendWithTimeout(Command command) {
        Duration timeout = command.getTimeout() != null
                ? command.getTimeout()
                : Duration.ofMillis(commandConfig.getSendTimeoutMs());
        Future<ExecutionOutcome> send = dispatchExecutor.submit(() -> terminalCommandExecutor.execute(command));
        try {
            return send.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            send.cancel(true);
            throw new TransportTimeoutException(
                    "Command " + command.getId() + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            send.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while sending command " + command.getId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Send failed for command " + command.getId(), cause);
        }
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
