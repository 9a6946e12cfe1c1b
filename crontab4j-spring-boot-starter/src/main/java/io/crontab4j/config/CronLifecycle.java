package io.crontab4j.config;

import io.crontab4j.CronService;
import io.crontab4j.SkillJobHandler;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronJobCreate;
import io.crontab4j.core.CronPayload;
import io.crontab4j.core.SkillJobRegistry;
import io.crontab4j.core.Schedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Bridges cron start/stop with the Spring container lifecycle.
 *
 * <p>On start, every {@link SkillJobHandler} without a matching job in the store is registered
 * before the timer is armed.
 */
public class CronLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CronLifecycle.class);

    private final CronService cronService;
    private final SkillJobRegistry skillJobRegistry;
    private volatile boolean running = false;

    public CronLifecycle(CronService cronService, SkillJobRegistry skillJobRegistry) {
        this.cronService = cronService;
        this.skillJobRegistry = skillJobRegistry;
    }

    @Override
    public void start() {
        registerSkillJobs();
        cronService.start();
        running = true;
    }

    @Override
    public void stop() {
        cronService.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void registerSkillJobs() {
        List<CronJob> existing = cronService.list(true);
        for (SkillJobHandler handler : skillJobRegistry.handlers()) {
            boolean registered = existing.stream().anyMatch(job ->
                    job.getPayload() instanceof CronPayload.SkillJob s
                            && s.skillId().equals(handler.skillId())
                            && s.jobId().equals(handler.jobId()));
            if (registered) {
                continue;
            }
            CronJob job = cronService.add(CronJobCreate.builder()
                    .name(handler.skillId() + ": " + handler.jobId())
                    .schedule(Schedules.parse(handler.schedule(), handler.timezone()))
                    .skillJob(handler.skillId(), handler.jobId())
                    .build());
            log.info("cron skill job registered skillId={} jobId={} schedule={} id={}",
                    handler.skillId(), handler.jobId(), handler.schedule(), job.getId());
        }
    }
}
