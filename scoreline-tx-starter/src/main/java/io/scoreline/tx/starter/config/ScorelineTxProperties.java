package io.scoreline.tx.starter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scoreline.tx")
public class ScorelineTxProperties {

    private Store store = new Store();
    private Manager manager = new Manager();
    private Monitor monitor = new Monitor();
    private Redis redis = new Redis();
    private Cache cache = new Cache();
    private Jms jms = new Jms();
    private Observability observability = new Observability();

    public enum StoreType {
        /**
         * JPA when an EntityManagerFactory is present, otherwise in-memory
         */
        AUTO,
        JPA,
        MEMORY
    }

    public static class Store {
        private StoreType type = StoreType.AUTO;

        public StoreType getType() { return type; }
        public void setType(StoreType type) { this.type = type; }
    }

    public static class Manager {
        private long timeoutGraceMs = 5000;

        public long getTimeoutGraceMs() { return timeoutGraceMs; }
        public void setTimeoutGraceMs(long timeoutGraceMs) { this.timeoutGraceMs = timeoutGraceMs; }
    }

    public static class Monitor {
        private int maxEventsHistory = 1000;

        public int getMaxEventsHistory() { return maxEventsHistory; }
        public void setMaxEventsHistory(int maxEventsHistory) { this.maxEventsHistory = maxEventsHistory; }
    }

    public static class Redis {
        private boolean enabled = false;
        private String url = "redis://localhost:6379";
        private String password = "";
        private Pool pool = new Pool();
        private int timeout = 3000;
        private int connectTimeout = 5000;

        public static class Pool {
            private int size = 64;
            private int minIdle = 10;

            public int getSize() { return size; }
            public void setSize(int size) { this.size = size; }
            public int getMinIdle() { return minIdle; }
            public void setMinIdle(int minIdle) { this.minIdle = minIdle; }
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public Pool getPool() { return pool; }
        public void setPool(Pool pool) { this.pool = pool; }
        public int getTimeout() { return timeout; }
        public void setTimeout(int timeout) { this.timeout = timeout; }
        public int getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(int connectTimeout) { this.connectTimeout = connectTimeout; }
    }

    public static class Cache {
        private String prefix = "scoreline:cache:";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    public static class Jms {
        private boolean enabled = false;
        private String topic = "scoreline.events";
        private long defaultTtlMs = 1800000;
        private String existingFactoryBeanName;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public long getDefaultTtlMs() { return defaultTtlMs; }
        public void setDefaultTtlMs(long defaultTtlMs) { this.defaultTtlMs = defaultTtlMs; }
        public String getExistingFactoryBeanName() { return existingFactoryBeanName; }
        public void setExistingFactoryBeanName(String existingFactoryBeanName) { this.existingFactoryBeanName = existingFactoryBeanName; }
    }

    public static class Observability {
        private boolean metricsEnabled = true;

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
    }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Manager getManager() { return manager; }
    public void setManager(Manager manager) { this.manager = manager; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }
    public Redis getRedis() { return redis; }
    public void setRedis(Redis redis) { this.redis = redis; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Jms getJms() { return jms; }
    public void setJms(Jms jms) { this.jms = jms; }
    public Observability getObservability() { return observability; }
    public void setObservability(Observability observability) { this.observability = observability; }
}
