package com.phillippitts.livescribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The session pool runs one long-lived fragment pump per live session, so its maximum size is
 * the ceiling on concurrent sessions. It hands tasks off directly (queue capacity 0) and rejects
 * work when full. The lifecycle pool runs parallel session teardown at shutdown.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SessionPoolProperties session = new SessionPoolProperties();
    private LifecyclePoolProperties lifecycle = new LifecyclePoolProperties();

    public SessionPoolProperties getSession() {
        return session;
    }

    public void setSession(SessionPoolProperties session) {
        this.session = session;
    }

    public LifecyclePoolProperties getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(LifecyclePoolProperties lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Fragment pump pool configuration.
     */
    public static class SessionPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 200;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "session-pump-";

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
     * Session teardown pool configuration.
     */
    public static class LifecyclePoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
        private String threadNamePrefix = "session-lifecycle-";

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

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
