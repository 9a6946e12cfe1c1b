package io.crontab4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crontab4j.CronEventListener;
import io.crontab4j.CronService;
import io.crontab4j.MessageSender;
import io.crontab4j.SkillJobHandler;
import io.crontab4j.core.SkillJobRegistry;
import io.crontab4j.internal.file.FileCronService;
import io.crontab4j.internal.file.FileJobStore;
import io.crontab4j.internal.file.FileRunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for the cron service.
 */
@AutoConfiguration
@ConditionalOnClass(CronService.class)
@EnableConfigurationProperties(CronProperties.class)
@ConditionalOnProperty(prefix = "crontab", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronConfig {
    private static final Logger log = LoggerFactory.getLogger(CronConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public FileJobStore fileJobStore(CronProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new FileJobStore(Path.of(props.getStorePath()), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FileRunLog fileRunLog(CronProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new FileRunLog(objectMapper.getIfAvailable(ObjectMapper::new),
                props.getRunLogMaxBytes(), props.getRunLogKeepLines());
    }

    @Bean
    @ConditionalOnMissingBean
    public SkillJobRegistry skillJobRegistry(ObjectProvider<List<SkillJobHandler>> handlersProvider) {
        List<SkillJobHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new SkillJobRegistry(handlers);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CronService cronService(CronProperties props,
                                   FileJobStore jobStore,
                                   FileRunLog runLog,
                                   SkillJobRegistry skillJobRegistry,
                                   ObjectProvider<MessageSender> messageSender,
                                   ObjectProvider<CronEventListener> listeners,
                                   ObjectProvider<Clock> clock) {
        return new FileCronService(
                props,
                jobStore,
                runLog,
                messageSender.getIfAvailable(() -> CronConfig::missingSender),
                skillJobRegistry,
                compose(listeners.orderedStream().collect(Collectors.toList())),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public CronLifecycle cronLifecycle(CronService cronService, SkillJobRegistry skillJobRegistry) {
        return new CronLifecycle(cronService, skillJobRegistry);
    }

    private static void missingSender(long chatId, String text, String botId) {
        throw new IllegalStateException("no MessageSender configured");
    }

    static CronEventListener compose(List<CronEventListener> listeners) {
        if (listeners.isEmpty()) {
            return event -> log.debug("cron event {}", event);
        }
        if (listeners.size() == 1) {
            return listeners.get(0);
        }
        return event -> {
            for (CronEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("cron event listener failed listener={} id={} action={} msg={}",
                            listener.getClass().getName(), event.jobId(), event.action(), e.getMessage());
                }
            }
        };
    }
}
