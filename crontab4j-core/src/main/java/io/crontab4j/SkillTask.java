package io.crontab4j;

/**
 * A resolved unit of skill work. The returned text, if not blank, is recorded as run output.
 */
@FunctionalInterface
public interface SkillTask {
    String run() throws Exception;
}
