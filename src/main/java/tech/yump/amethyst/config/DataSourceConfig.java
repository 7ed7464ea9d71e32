package tech.yump.amethyst.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.util.Arrays;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    static final String POOL_NAME = "AmethystKeyPostgresPool";

    private final AmethystProperties amethystProperties;

    @Bean
    @Primary
    public DataSource dataSource() {
        log.info("Configuring Hikari DataSource for the secret store...");

        AmethystProperties.PostgresProperties pgProps = amethystProperties.store().postgres();
        HikariConfig config = buildHikariConfig(pgProps);

        log.info("Creating HikariDataSource for URL: {}, User: {}, pool {}..{}",
                config.getJdbcUrl(), config.getUsername(), config.getMinimumIdle(), config.getMaximumPoolSize());
        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("HikariDataSource configured successfully.");
            return dataSource;
        } catch (RuntimeException e) {
            log.error("Failed to configure DataSource: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to configure DataSource", e);
        }
    }

    /**
     * Builds the pool configuration. A caller waiting longer than the connection timeout for a
     * pooled connection gets an exception instead of blocking.
     */
    static HikariConfig buildHikariConfig(AmethystProperties.PostgresProperties pgProps) {
        char[] passwordChars = null;
        try {
            passwordChars = pgProps.password().clone();

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(pgProps.connectionUrl());
            config.setUsername(pgProps.username());
            // HikariConfig has no char[] setter.
            config.setPassword(new String(passwordChars));
            config.setDriverClassName("org.postgresql.Driver");

            config.setPoolName(POOL_NAME);
            config.setMinimumIdle(pgProps.minimumIdle());
            config.setMaximumPoolSize(pgProps.maximumPoolSize());
            config.setConnectionTimeout(pgProps.connectionTimeout().toMillis());
            return config;
        } finally {
            if (passwordChars != null) {
                Arrays.fill(passwordChars, '\0');
                log.debug("Local copy of DB password char array cleared from memory.");
            }
        }
    }
}
