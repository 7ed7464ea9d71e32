package tech.yump.amethyst.store;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Repository;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.config.AmethystProperties;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * PostgreSQL implementation of {@link SecretRepository} on top of {@link JdbcTemplate}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSecretRepository implements SecretRepository {

    static final int BATCH_SIZE = 1000;
    static final String SCHEMA_LOCATION = "db/schema.sql";

    static final String INSERT_BUCKET_KEY_SQL =
            "INSERT INTO bucket_keys (app_name, bucket_name, encryption_key_salt, client_id) VALUES (?, ?, ?, ?) "
                    + "ON CONFLICT (app_name, bucket_name) DO NOTHING";
    static final String SELECT_BUCKET_KEY_SQL =
            "SELECT app_name, bucket_name, encryption_key_salt, client_id FROM bucket_keys WHERE app_name = ? AND bucket_name = ?";
    static final String SELECT_ALL_BUCKET_KEYS_SQL =
            "SELECT app_name, bucket_name, encryption_key_salt, client_id FROM bucket_keys ORDER BY app_name, bucket_name";
    static final String UPSERT_SECRET_SQL =
            "INSERT INTO secrets (app_name, bucket_name, secret_name, encrypted_secret) VALUES (?, ?, ?, ?) "
                    + "ON CONFLICT (app_name, bucket_name, secret_name) DO UPDATE SET encrypted_secret = EXCLUDED.encrypted_secret";
    static final String UPDATE_SECRET_SQL =
            "UPDATE secrets SET encrypted_secret = ? WHERE app_name = ? AND bucket_name = ? AND secret_name = ?";
    static final String SELECT_SECRET_SQL =
            "SELECT app_name, bucket_name, secret_name, encrypted_secret FROM secrets "
                    + "WHERE app_name = ? AND bucket_name = ? AND secret_name = ?";
    static final String DELETE_SECRET_SQL =
            "DELETE FROM secrets WHERE app_name = ? AND bucket_name = ? AND secret_name = ?";
    static final String SELECT_FIRST_SECRET_BATCH_SQL =
            "SELECT app_name, bucket_name, secret_name, encrypted_secret FROM secrets "
                    + "ORDER BY app_name, bucket_name, secret_name LIMIT ?";
    static final String SELECT_NEXT_SECRET_BATCH_SQL =
            "SELECT app_name, bucket_name, secret_name, encrypted_secret FROM secrets "
                    + "WHERE (app_name, bucket_name, secret_name) > (?, ?, ?) "
                    + "ORDER BY app_name, bucket_name, secret_name LIMIT ?";

    // Null for rows with names this service would never have written.
    static final RowMapper<BucketKeyRecord> BUCKET_KEY_MAPPER = (rs, rowNum) -> {
        String appName = rs.getString("app_name");
        String bucketName = rs.getString("bucket_name");
        if (!BucketId.isValidName(appName) || !BucketId.isValidName(bucketName)) {
            log.warn("Skipping bucket key row with invalid name '{}/{}'.", appName, bucketName);
            return null;
        }
        return new BucketKeyRecord(BucketId.of(appName, bucketName),
                rs.getBytes("encryption_key_salt"),
                rs.getObject("client_id", UUID.class));
    };

    private static final RowMapper<SecretRow> SECRET_ROW_MAPPER = (rs, rowNum) -> new SecretRow(
            rs.getString("app_name"),
            rs.getString("bucket_name"),
            rs.getString("secret_name"),
            rs.getBytes("encrypted_secret"));

    /**
     * Raw secret row; keyset pagination continues from it even when its names are invalid.
     */
    record SecretRow(String appName, String bucketName, String secretName, byte[] encryptedSecret) {

        Optional<SecretRecord> toRecord() {
            if (!BucketId.isValidName(appName) || !BucketId.isValidName(bucketName) || !BucketId.isValidName(secretName)) {
                log.warn("Skipping secret row with invalid name '{}/{}/{}'.", appName, bucketName, secretName);
                return Optional.empty();
            }
            return Optional.of(new SecretRecord(BucketId.of(appName, bucketName), secretName, encryptedSecret));
        }
    }

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;
    private final AmethystProperties properties;

    /**
     * Applies {@code db/schema.sql} when enabled, then verifies that a connection can be obtained.
     */
    @PostConstruct
    public void initialize() {
        if (Boolean.TRUE.equals(properties.store().postgres().initializeSchema())) {
            log.info("Ensuring database schema from classpath:{}", SCHEMA_LOCATION);
            try {
                ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
                populator.setContinueOnError(false);
                populator.execute(dataSource);
                log.info("Database schema is in place.");
            } catch (DataAccessException e) {
                log.error("Failed to apply database schema: {}", e.getMessage(), e);
                throw translate("apply database schema", e);
            }
        }
        checkDbConnection();
    }

    private void checkDbConnection() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(2)) {
                log.info("Successfully connected to the secret store database: URL='{}'", connection.getMetaData().getURL());
            } else {
                log.error("Connection to the secret store database is not valid (isValid returned false).");
            }
        } catch (SQLException e) {
            log.error("Failed to connect to the secret store database during startup check: {}", e.getMessage());
            log.debug("SQL Exception details:", e);
        }
    }

    @Override
    public boolean insertBucketKey(BucketKeyRecord record) {
        BucketId bucket = record.bucket();
        try {
            int rows = jdbcTemplate.update(INSERT_BUCKET_KEY_SQL,
                    bucket.appName(), bucket.bucketName(), record.keyBlob(), record.clientId());
            if (rows == 0) {
                log.debug("Bucket key row for {} already exists, nothing inserted.", bucket);
                return false;
            }
            log.debug("Inserted bucket key row for {}", bucket);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert of bucket key row for {} lost the race.", bucket);
            return false;
        } catch (DataAccessException e) {
            log.error("Database error inserting bucket key for {}: {}", bucket, e.getMessage(), e);
            throw translate("insert bucket key for " + bucket, e);
        }
    }

    @Override
    public Optional<BucketKeyRecord> findBucketKey(BucketId bucket) {
        try {
            List<BucketKeyRecord> rows = jdbcTemplate.query(SELECT_BUCKET_KEY_SQL, BUCKET_KEY_MAPPER,
                    bucket.appName(), bucket.bucketName());
            return rows.stream().filter(Objects::nonNull).findFirst();
        } catch (DataAccessException e) {
            log.error("Database error reading bucket key for {}: {}", bucket, e.getMessage(), e);
            throw translate("read bucket key for " + bucket, e);
        }
    }

    @Override
    public List<BucketKeyRecord> findAllBucketKeys() {
        try {
            List<BucketKeyRecord> rows = jdbcTemplate.query(SELECT_ALL_BUCKET_KEYS_SQL, BUCKET_KEY_MAPPER).stream()
                    .filter(Objects::nonNull)
                    .toList();
            log.debug("Read {} bucket key rows.", rows.size());
            return rows;
        } catch (DataAccessException e) {
            log.error("Database error reading bucket keys: {}", e.getMessage(), e);
            throw translate("read bucket keys", e);
        }
    }

    @Override
    public void upsertSecret(SecretRecord record) {
        BucketId bucket = record.bucket();
        try {
            jdbcTemplate.update(UPSERT_SECRET_SQL,
                    bucket.appName(), bucket.bucketName(), record.secretName(), record.encryptedSecret());
            log.debug("Upserted secret '{}' of {}", record.secretName(), bucket);
        } catch (DataAccessException e) {
            log.error("Database error upserting secret '{}' of {}: {}", record.secretName(), bucket, e.getMessage(), e);
            throw translate("upsert secret '" + record.secretName() + "' of " + bucket, e);
        }
    }

    @Override
    public boolean updateSecret(SecretRecord record) {
        BucketId bucket = record.bucket();
        try {
            int rows = jdbcTemplate.update(UPDATE_SECRET_SQL,
                    record.encryptedSecret(), bucket.appName(), bucket.bucketName(), record.secretName());
            log.debug("Updated {} row(s) for secret '{}' of {}", rows, record.secretName(), bucket);
            return rows > 0;
        } catch (DataAccessException e) {
            log.error("Database error updating secret '{}' of {}: {}", record.secretName(), bucket, e.getMessage(), e);
            throw translate("update secret '" + record.secretName() + "' of " + bucket, e);
        }
    }

    @Override
    public Optional<SecretRecord> findSecret(BucketId bucket, String secretName) {
        try {
            return jdbcTemplate.query(SELECT_SECRET_SQL, SECRET_ROW_MAPPER,
                            bucket.appName(), bucket.bucketName(), secretName).stream()
                    .findFirst()
                    .flatMap(SecretRow::toRecord);
        } catch (DataAccessException e) {
            log.error("Database error reading secret '{}' of {}: {}", secretName, bucket, e.getMessage(), e);
            throw translate("read secret '" + secretName + "' of " + bucket, e);
        }
    }

    @Override
    public boolean deleteSecret(BucketId bucket, String secretName) {
        try {
            int rows = jdbcTemplate.update(DELETE_SECRET_SQL, bucket.appName(), bucket.bucketName(), secretName);
            log.debug("Deleted {} row(s) for secret '{}' of {}", rows, secretName, bucket);
            return rows > 0;
        } catch (DataAccessException e) {
            log.error("Database error deleting secret '{}' of {}: {}", secretName, bucket, e.getMessage(), e);
            throw translate("delete secret '" + secretName + "' of " + bucket, e);
        }
    }

    @Override
    public void forEachSecret(Consumer<SecretRecord> consumer) {
        List<SecretRow> batch = fetchSecretBatch(null);
        int total = 0;
        while (!batch.isEmpty()) {
            batch.forEach(row -> row.toRecord().ifPresent(consumer));
            total += batch.size();
            if (batch.size() < BATCH_SIZE) {
                break;
            }
            batch = fetchSecretBatch(batch.get(batch.size() - 1));
        }
        log.debug("Scanned {} secret rows.", total);
    }

    private List<SecretRow> fetchSecretBatch(SecretRow after) {
        try {
            if (after == null) {
                return jdbcTemplate.query(SELECT_FIRST_SECRET_BATCH_SQL, SECRET_ROW_MAPPER, BATCH_SIZE);
            }
            return jdbcTemplate.query(SELECT_NEXT_SECRET_BATCH_SQL, SECRET_ROW_MAPPER,
                    after.appName(), after.bucketName(), after.secretName(), BATCH_SIZE);
        } catch (DataAccessException e) {
            log.error("Database error scanning secrets: {}", e.getMessage(), e);
            throw translate("scan secrets", e);
        }
    }

    static StoreException translate(String action, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException) {
            return new StoreUnavailableException("Secret store unavailable, could not " + action, e);
        }
        return new StoreException("Failed to " + action, e);
    }
}
