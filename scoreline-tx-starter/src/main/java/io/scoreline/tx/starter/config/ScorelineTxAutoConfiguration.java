package io.scoreline.tx.starter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreline.tx.core.cache.KeyValueCache;
import io.scoreline.tx.core.cache.LocalKeyValueCache;
import io.scoreline.tx.core.event.EventBus;
import io.scoreline.tx.core.event.SimpleEventBus;
import io.scoreline.tx.core.monitor.TransactionMonitorService;
import io.scoreline.tx.core.store.InMemoryTransactionalStore;
import io.scoreline.tx.core.store.TransactionalStore;
import io.scoreline.tx.core.store.jpa.JpaTransactionalStore;
import io.scoreline.tx.core.transaction.DefaultErrorClassifier;
import io.scoreline.tx.core.transaction.ErrorClassifier;
import io.scoreline.tx.core.transaction.TransactionManager;
import io.scoreline.tx.starter.cache.RedissonKeyValueCache;
import io.scoreline.tx.starter.event.JmsEventBus;
import io.scoreline.tx.starter.metrics.TransactionMonitorMicrometerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.jms.ConnectionFactory;
import jakarta.persistence.EntityManagerFactory;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Wires the transaction manager, its monitor and the optional Redis, JMS and
 * Micrometer integrations. Every bean backs off when the application defines
 * its own.
 */
@AutoConfiguration(afterName = {
    "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
    "org.springframework.boot.autoconfigure.jms.artemis.ArtemisAutoConfiguration"
})
@EnableConfigurationProperties(ScorelineTxProperties.class)
public class ScorelineTxAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScorelineTxAutoConfiguration.class);

    private final ScorelineTxProperties properties;

    public ScorelineTxAutoConfiguration(ScorelineTxProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void logConfiguration() {
        log.info("═══════════════════════════════════════════════════════════");
        log.info("Scoreline Transaction Manager - Initializing...");
        log.info("═══════════════════════════════════════════════════════════");
        log.info("  Store: {}", properties.getStore().getType());
        log.info("  Timeout grace: {}ms", properties.getManager().getTimeoutGraceMs());
        log.info("  Event history: {}", properties.getMonitor().getMaxEventsHistory());
        log.info("{} Redis cache: {}", mark(properties.getRedis().isEnabled()), status(properties.getRedis().isEnabled()));
        log.info("{} JMS events: {}", mark(properties.getJms().isEnabled()), status(properties.getJms().isEnabled()));
        log.info("{} Micrometer metrics: {}", mark(properties.getObservability().isMetricsEnabled()),
            status(properties.getObservability().isMetricsEnabled()));
        log.info("═══════════════════════════════════════════════════════════");
    }

    private static String mark(boolean enabled) {
        return enabled ? "✓" : "○";
    }

    private static String status(boolean enabled) {
        return enabled ? "ENABLED" : "DISABLED";
    }

    @Bean(name = "scorelineTxObjectMapper")
    @ConditionalOnMissingBean(name = "scorelineTxObjectMapper")
    public ObjectMapper scorelineTxObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionalStore transactionalStore(ObjectProvider<EntityManagerFactory> entityManagerFactory) {
        ScorelineTxProperties.StoreType type = properties.getStore().getType();
        EntityManagerFactory emf = type == ScorelineTxProperties.StoreType.MEMORY ? null : entityManagerFactory.getIfAvailable();

        if (type == ScorelineTxProperties.StoreType.JPA && emf == null) {
            throw new IllegalStateException(
                "scoreline.tx.store.type=JPA but no EntityManagerFactory bean is available");
        }

        if (emf != null) {
            log.info("✓ JpaTransactionalStore created");
            return new JpaTransactionalStore(emf);
        }
        log.info("✓ InMemoryTransactionalStore created");
        return new InMemoryTransactionalStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionMonitorService transactionMonitorService(BeanFactory beanFactory) {
        ObjectMapper mapper = beanFactory.getBean("scorelineTxObjectMapper", ObjectMapper.class);
        log.info("✓ TransactionMonitorService created");
        return new TransactionMonitorService(mapper, properties.getMonitor().getMaxEventsHistory());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new DefaultErrorClassifier();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TransactionManager transactionManager(TransactionalStore store,
                                                 TransactionMonitorService monitor,
                                                 ErrorClassifier errorClassifier) {
        TransactionManager manager = TransactionManager.builder(store)
            .errorClassifier(errorClassifier)
            .timeoutGraceMs(properties.getManager().getTimeoutGraceMs())
            .build();
        manager.registerHooks(monitor.createHooks());
        log.info("✓ TransactionManager created");
        return manager;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.redisson.api.RedissonClient")
    static class RedisConfiguration {

        @Bean(destroyMethod = "shutdown")
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "scoreline.tx.redis", name = "enabled", havingValue = "true")
        public RedissonClient redissonClient(ScorelineTxProperties properties) {
            ScorelineTxProperties.Redis redis = properties.getRedis();
            Config config = new Config();
            config.useSingleServer()
                .setAddress(redis.getUrl())
                .setPassword(redis.getPassword() != null && !redis.getPassword().isEmpty() ? redis.getPassword() : null)
                .setConnectionPoolSize(redis.getPool().getSize())
                .setConnectionMinimumIdleSize(redis.getPool().getMinIdle())
                .setTimeout(redis.getTimeout())
                .setConnectTimeout(redis.getConnectTimeout())
                .setRetryAttempts(3)
                .setRetryInterval(1500);

            log.info("✓ RedissonClient created: {}", redis.getUrl());
            return Redisson.create(config);
        }

        @Bean
        @ConditionalOnMissingBean(KeyValueCache.class)
        @ConditionalOnBean(RedissonClient.class)
        public KeyValueCache redissonKeyValueCache(RedissonClient redissonClient, BeanFactory beanFactory,
                                                   ScorelineTxProperties properties) {
            ObjectMapper mapper = beanFactory.getBean("scorelineTxObjectMapper", ObjectMapper.class);
            log.info("✓ RedissonKeyValueCache created (prefix: {})", properties.getCache().getPrefix());
            return new RedissonKeyValueCache(redissonClient, mapper, properties.getCache().getPrefix());
        }
    }

    @Bean
    @ConditionalOnMissingBean(KeyValueCache.class)
    public KeyValueCache localKeyValueCache(BeanFactory beanFactory) {
        log.info("✓ LocalKeyValueCache created");
        return new LocalKeyValueCache(beanFactory.getBean("scorelineTxObjectMapper", ObjectMapper.class));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "jakarta.jms.ConnectionFactory")
    @ConditionalOnProperty(prefix = "scoreline.tx.jms", name = "enabled", havingValue = "true")
    static class JmsConfiguration {

        @Bean
        @ConditionalOnMissingBean(EventBus.class)
        @ConditionalOnBean(ConnectionFactory.class)
        public EventBus jmsEventBus(BeanFactory beanFactory, ScorelineTxProperties properties) {
            ScorelineTxProperties.Jms jms = properties.getJms();
            ConnectionFactory connectionFactory = null;

            String existingBeanName = jms.getExistingFactoryBeanName();
            if (existingBeanName != null && !existingBeanName.trim().isEmpty()) {
                if (beanFactory.containsBean(existingBeanName)) {
                    connectionFactory = beanFactory.getBean(existingBeanName, ConnectionFactory.class);
                    log.info("✓ Using existing ConnectionFactory: {}", existingBeanName);
                } else {
                    log.warn("Cannot find ConnectionFactory bean '{}', using the default one", existingBeanName);
                }
            }
            if (connectionFactory == null) {
                connectionFactory = beanFactory.getBean(ConnectionFactory.class);
            }

            ObjectMapper mapper = beanFactory.getBean("scorelineTxObjectMapper", ObjectMapper.class);
            log.info("✓ JmsEventBus created (topic: {})", jms.getTopic());
            return new JmsEventBus(connectionFactory, mapper, jms.getTopic(), jms.getDefaultTtlMs());
        }
    }

    @Bean
    @ConditionalOnMissingBean(EventBus.class)
    public EventBus simpleEventBus() {
        log.info("✓ SimpleEventBus created (in-process)");
        return new SimpleEventBus();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(prefix = "scoreline.tx.observability", name = "metrics-enabled",
        havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public TransactionMonitorMicrometerMetrics transactionMonitorMicrometerMetrics(
                MeterRegistry registry, TransactionMonitorService monitor) {
            return new TransactionMonitorMicrometerMetrics(registry, monitor);
        }
    }
}
