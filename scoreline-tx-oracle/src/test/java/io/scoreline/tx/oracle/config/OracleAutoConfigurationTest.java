package io.scoreline.tx.oracle.config;

import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.transaction.ExecutionOptions;
import io.scoreline.tx.oracle.service.OracleService;
import io.scoreline.tx.oracle.signature.Ed25519SignatureVerifier;
import io.scoreline.tx.oracle.signature.SignatureVerifier;
import io.scoreline.tx.starter.config.ScorelineTxAutoConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class OracleAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ScorelineTxAutoConfiguration.class, OracleAutoConfiguration.class));

    @Test
    void defaults_createServiceWithEd25519Verifier() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(OracleService.class));
            assertInstanceOf(Ed25519SignatureVerifier.class, context.getBean(SignatureVerifier.class));
        });
    }

    @Test
    void properties_bindToTransactionOptions() {
        contextRunner
            .withPropertyValues(
                "scoreline.oracle.signer-address=abc",
                "scoreline.oracle.max-clock-skew-ms=5000",
                "scoreline.oracle.transaction.max-retries=5",
                "scoreline.oracle.transaction.timeout-ms=0",
                "scoreline.oracle.transaction.isolation-level=SERIALIZABLE")
            .run(context -> {
                OracleProperties properties = context.getBean(OracleProperties.class);
                assertEquals("abc", properties.getSignerAddress());
                assertEquals(5000, properties.getMaxClockSkewMs());

                ExecutionOptions options = properties.toExecutionOptions(OracleService.UPDATE_SNAPSHOT_LABEL);
                assertEquals(5, options.getMaxRetries());
                assertFalse(options.hasTimeout());
                assertEquals(IsolationLevel.SERIALIZABLE, options.getIsolationLevel());
                assertEquals(5000, options.getMaxBackoffMs());
            });
    }

    @Test
    void customVerifier_takesPrecedence() {
        SignatureVerifier custom = (request, expected) -> "fixed";
        contextRunner
            .withBean(SignatureVerifier.class, () -> custom)
            .run(context -> assertSame(custom, context.getBean(SignatureVerifier.class)));
    }
}
