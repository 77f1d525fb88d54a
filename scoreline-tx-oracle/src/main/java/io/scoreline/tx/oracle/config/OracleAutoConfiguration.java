package io.scoreline.tx.oracle.config;

import io.scoreline.tx.core.cache.KeyValueCache;
import io.scoreline.tx.core.event.EventBus;
import io.scoreline.tx.core.store.TransactionalStore;
import io.scoreline.tx.core.transaction.TransactionManager;
import io.scoreline.tx.oracle.entity.OracleSnapshot;
import io.scoreline.tx.oracle.service.OracleService;
import io.scoreline.tx.oracle.signature.Ed25519SignatureVerifier;
import io.scoreline.tx.oracle.signature.SignatureVerifier;
import io.scoreline.tx.starter.config.ScorelineTxAutoConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers the oracle service on top of the transaction starter. The entity
 * package is added to the auto-configuration packages so JPA picks up the
 * oracle tables without an explicit entity scan.
 */
@AutoConfiguration(after = ScorelineTxAutoConfiguration.class)
@AutoConfigurationPackage(basePackageClasses = OracleSnapshot.class)
@EnableConfigurationProperties(OracleProperties.class)
public class OracleAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OracleAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SignatureVerifier signatureVerifier() {
        return new Ed25519SignatureVerifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public OracleService oracleService(TransactionManager transactionManager, TransactionalStore store,
                                       SignatureVerifier signatureVerifier, EventBus eventBus,
                                       KeyValueCache cache, OracleProperties properties) {
        if (properties.hasSignerAddress()) {
            log.info("✓ OracleService created (signer pinned)");
        } else {
            log.warn("✓ OracleService created without scoreline.oracle.signer-address; any valid signer is accepted");
        }
        return new OracleService(transactionManager, store, signatureVerifier, eventBus, cache, properties);
    }
}
