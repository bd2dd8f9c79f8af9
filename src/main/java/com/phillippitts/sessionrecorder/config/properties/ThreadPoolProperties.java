package com.phillippitts.sessionrecorder.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>The recorder loop is deliberately not configurable: it is always a single thread, because all
 * recorder state is mutated from it. Only the transcription pool and the presentation scheduler are
 * tunable.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private TranscriptionPoolProperties transcription = new TranscriptionPoolProperties();
    private SchedulerProperties presentation = new SchedulerProperties();

    public TranscriptionPoolProperties getTranscription() {
        return transcription;
    }

    public void setTranscription(TranscriptionPoolProperties transcription) {
        this.transcription = transcription;
    }

    public SchedulerProperties getPresentation() {
        return presentation;
    }

    public void setPresentation(SchedulerProperties presentation) {
        this.presentation = presentation;
    }

    /**
     * Transcription executor pool configuration.
     */
    public static class TranscriptionPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 16;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "transcription-";

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
     * Scheduler used for delayed presentation actions (linger/closeAfter).
     */
    public static class SchedulerProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "presentation-";

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
