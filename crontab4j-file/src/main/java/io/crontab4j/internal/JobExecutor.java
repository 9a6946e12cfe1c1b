package io.crontab4j.internal;

import io.crontab4j.MessageSender;
import io.crontab4j.SkillHandlerResolver;
import io.crontab4j.SkillTask;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronPayload;
import io.crontab4j.core.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a job payload on the worker pool under a hard timeout.
 *
 * <p>Failures never escape: they are folded into an {@link ExecutionResult} with
 * {@link RunStatus#ERROR}. A timed-out payload is left running; its result is discarded.
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String MESSAGE_SENT = "Message sent";
    static final String TIMED_OUT = "cron: job execution timed out";

    private final MessageSender messageSender;
    private final SkillHandlerResolver skillResolver;
    private final Duration timeout;
    private final Supplier<Instant> clock;
    private final ExecutorService workers;

    public JobExecutor(MessageSender messageSender, SkillHandlerResolver skillResolver,
                       Duration timeout, Supplier<Instant> clock) {
        this.messageSender = Objects.requireNonNull(messageSender, "messageSender must not be null");
        this.skillResolver = Objects.requireNonNull(skillResolver, "skillResolver must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("crontab.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutionResult execute(CronJob job, Instant startedAt) {
        Outcome outcome;
        CompletableFuture<Outcome> future = CompletableFuture.supplyAsync(() -> runPayload(job.getPayload()), workers);
        try {
            outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            outcome = Outcome.failed(TIMED_OUT);
        } catch (ExecutionException e) {
            outcome = Outcome.failed(describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = Outcome.failed("cron: interrupted while waiting for job");
        }
        if (outcome.status() == RunStatus.ERROR) {
            log.warn("cron job failed id={} name={} error={}", job.getId(), job.getName(), outcome.error());
        }
        return new ExecutionResult(job.getId(), outcome.status(), outcome.error(), outcome.output(),
                startedAt, clock.get());
    }

    private Outcome runPayload(CronPayload payload) {
        if (payload instanceof CronPayload.Message m) {
            try {
                messageSender.send(m.chatId(), m.text(), m.botId());
                return Outcome.ok(MESSAGE_SENT);
            } catch (Exception e) {
                return Outcome.failed(describe(e));
            }
        }
        if (payload instanceof CronPayload.SkillJob s) {
            SkillTask task = skillResolver.resolve(s.skillId(), s.jobId());
            if (task == null) {
                return new Outcome(RunStatus.SKIPPED,
                        "Skill handler not found: " + s.skillId() + "/" + s.jobId(), null);
            }
            try {
                String output = task.run();
                return Outcome.ok(output == null || output.isBlank() ? null : output);
            } catch (Exception e) {
                return Outcome.failed(describe(e));
            }
        }
        return new Outcome(RunStatus.SKIPPED, "Unknown payload kind", null);
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private record Outcome(RunStatus status, String error, String output) {
        static Outcome ok(String output) {
            return new Outcome(RunStatus.OK, null, output);
        }

        static Outcome failed(String error) {
            return new Outcome(RunStatus.ERROR, error, null);
        }
    }
}
