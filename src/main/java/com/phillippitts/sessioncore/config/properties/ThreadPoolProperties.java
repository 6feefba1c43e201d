package com.phillippitts.sessioncore.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the upload executor (file read + encode + dispatch) and the
 * scheduler that fires acknowledgment timeouts.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private UploadPoolProperties upload = new UploadPoolProperties();
    private SchedulerProperties ackTimeout = new SchedulerProperties();

    public UploadPoolProperties getUpload() {
        return upload;
    }

    public void setUpload(UploadPoolProperties upload) {
        this.upload = upload;
    }

    public SchedulerProperties getAckTimeout() {
        return ackTimeout;
    }

    public void setAckTimeout(SchedulerProperties ackTimeout) {
        this.ackTimeout = ackTimeout;
    }

    /**
     * Upload executor pool configuration.
     */
    public static class UploadPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "upload-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Timeout scheduler configuration.
     */
    public static class SchedulerProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "ack-timeout-";

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
