package com.onboarding.core.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link ProtocolStore} bean.
 * <p>
 * With {@code onboarding.protocol.store=jdbc} a {@link JdbcProtocolStore} is
 * created against the application's {@link DataSource}. Otherwise an
 * {@link InMemoryProtocolStore} is used, which does not survive restarts.
 * Either store is seeded from {@code onboarding.protocol.seeds}.
 */
@Configuration
public class ProtocolStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ProtocolStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnProperty(name = "onboarding.protocol.store", havingValue = "jdbc")
    public ProtocolStore jdbcProtocolStore(DataSource dataSource, ProtocolProperties properties) throws Exception {
        log.info("Configuring JDBC protocol store");
        var store = new JdbcProtocolStore(dataSource, new ProtocolValidator(properties.getMaxSteps()));
        store.createTables();
        new ProtocolSeeder(properties).seed(store);
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ProtocolStore.class)
    public ProtocolStore inMemoryProtocolStore(ProtocolProperties properties) {
        log.info("Using in-memory protocol store (protocols will not persist across restarts)");
        var store = new InMemoryProtocolStore(Clock.systemUTC(), new ProtocolValidator(properties.getMaxSteps()));
        new ProtocolSeeder(properties).seed(store);
        return store;
    }
}
