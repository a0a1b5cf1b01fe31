package com.phillippitts.leaderkey.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The config I/O pool and the main pool are single-threaded by default: one file operation
 * at a time, and one thread that owns the canonical tree. The scheduler drives debounced saves.
 */
@Component
@ConfigurationProperties(prefix = "leaderkey.threadpool")
public class ThreadPoolProperties {

    private PoolProperties configIo = new PoolProperties("config-io-");
    private PoolProperties main = new PoolProperties("leaderkey-main-");
    private SchedulerProperties scheduler = new SchedulerProperties();

    public PoolProperties getConfigIo() {
        return configIo;
    }

    public void setConfigIo(PoolProperties configIo) {
        this.configIo = configIo;
    }

    public PoolProperties getMain() {
        return main;
    }

    public void setMain(PoolProperties main) {
        this.main = main;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Single-consumer executor configuration.
     */
    public static class PoolProperties {
        private int queueCapacity = 100;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Debounce scheduler configuration.
     */
    public static class SchedulerProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "config-debounce-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
