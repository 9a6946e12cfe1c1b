package io.crontab4j.core;

import io.crontab4j.SkillHandlerResolver;
import io.crontab4j.SkillJobHandler;
import io.crontab4j.SkillTask;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of {@link SkillJobHandler}s keyed by {@code skillId/jobId}.
 */
public class SkillJobRegistry implements SkillHandlerResolver {

    private final Map<String, SkillJobHandler> handlersByKey;

    public SkillJobRegistry(List<SkillJobHandler> handlers) {
        this.handlersByKey = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        h -> key(h.skillId(), h.jobId()),
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate SkillJobHandler: " + key(a.skillId(), a.jobId()));
                        }
                ));
    }

    @Override
    public SkillTask resolve(String skillId, String jobId) {
        SkillJobHandler handler = handlersByKey.get(key(skillId, jobId));
        return handler == null ? null : handler::execute;
    }

    public Collection<SkillJobHandler> handlers() {
        return handlersByKey.values();
    }

    private static String key(String skillId, String jobId) {
        return skillId + "/" + jobId;
    }
}
