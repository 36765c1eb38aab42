package dev.newsroom.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.dialect.H2Dialect;
import org.springframework.data.r2dbc.dialect.R2dbcDialect;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.newsroom.repository")
@EnableTransactionManagement
public class R2dbcConfig {

    @Value("${app.schema.file:schema-postgres.sql}")
    private String schemaFile;

    /**
     * Applies the bundled schema on startup when {@code app.schema.init=true}:
     * {@code schema-postgres.sql} by default, {@code schema-h2.sql} in the dev profile.
     * Production schemas are migrated externally.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true")
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }

    /**
     * H2 runs in PostgreSQL mode in the dev profile; keep its own dialect so the
     * conditional stage updates are rendered without Postgres quoting.
     */
    @Bean
    @Primary
    @Profile("dev")
    public R2dbcDialect devR2dbcDialect(ConnectionFactory connectionFactory) {
        return H2Dialect.INSTANCE;
    }
}
