package com.scriptorium.core.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkingTreeLockConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkingTreeLockConfig.class);

    @Bean
    @ConditionalOnProperty(name = "scriptorium.locking.strategy", havingValue = "none", matchIfMissing = true)
    public WorkingTreeLock noOpWorkingTreeLock() {
        log.info("Working-tree locking disabled; concurrent writes to one project are not serialized");
        return new NoOpWorkingTreeLock();
    }

    @Bean
    @ConditionalOnProperty(name = "scriptorium.locking.strategy", havingValue = "local")
    public WorkingTreeLock stripedWorkingTreeLock() {
        log.info("Using JVM-local striped working-tree locks");
        return new StripedWorkingTreeLock();
    }
}
