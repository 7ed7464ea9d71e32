package tech.yump.amethyst.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tech.yump.amethyst.bucket.BucketId;
import tech.yump.amethyst.support.TestProperties;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcSecretRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;
    @Mock
    private DataSource dataSource;

    private JdbcSecretRepository repository;

    private final BucketId bucket = BucketId.of("billing", "prod");
    private final UUID clientId = UUID.fromString("7f3c1f5e-6a0b-4c55-9d0e-1b2a3c4d5e6f");
    private final byte[] keyBlob = {1, 2, 3};

    @BeforeEach
    void setUp() {
        repository = new JdbcSecretRepository(jdbcTemplate, dataSource, TestProperties.withMirrorAt(Path.of("unused")));
    }

    @Test
    @DisplayName("insertBucketKey returns true when one row is inserted")
    void insertBucketKey_Inserted() {
        when(jdbcTemplate.update(eq(JdbcSecretRepository.INSERT_BUCKET_KEY_SQL),
                eq("billing"), eq("prod"), any(byte[].class), eq(clientId))).thenReturn(1);

        assertThat(repository.insertBucketKey(new BucketKeyRecord(bucket, keyBlob, clientId))).isTrue();
    }

    @Test
    @DisplayName("insertBucketKey returns false when the row already exists")
    void insertBucketKey_Conflict() {
        when(jdbcTemplate.update(eq(JdbcSecretRepository.INSERT_BUCKET_KEY_SQL),
                eq("billing"), eq("prod"), any(byte[].class), eq(clientId))).thenReturn(0);

        assertThat(repository.insertBucketKey(new BucketKeyRecord(bucket, keyBlob, clientId))).isFalse();
    }

    @Test
    @DisplayName("insertBucketKey treats a unique violation as an existing row")
    void insertBucketKey_DuplicateKey() {
        when(jdbcTemplate.update(eq(JdbcSecretRepository.INSERT_BUCKET_KEY_SQL),
                eq("billing"), eq("prod"), any(byte[].class), eq(clientId)))
                .thenThrow(new DuplicateKeyException("duplicate key value violates unique constraint"));

        assertThat(repository.insertBucketKey(new BucketKeyRecord(bucket, keyBlob, clientId))).isFalse();
    }

    @Test
    @DisplayName("Connection failures surface as StoreUnavailableException")
    void insertBucketKey_ConnectionFailure() {
        when(jdbcTemplate.update(eq(JdbcSecretRepository.INSERT_BUCKET_KEY_SQL),
                eq("billing"), eq("prod"), any(byte[].class), eq(clientId)))
                .thenThrow(new CannotGetJdbcConnectionException("Connection is not available, request timed out after 30000ms."));

        assertThatThrownBy(() -> repository.insertBucketKey(new BucketKeyRecord(bucket, keyBlob, clientId)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(CannotGetJdbcConnectionException.class);
    }

    @Test
    @DisplayName("findBucketKey returns the first matching row or empty")
    void findBucketKey() {
        BucketKeyRecord row = new BucketKeyRecord(bucket, keyBlob, clientId);
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_BUCKET_KEY_SQL),
                ArgumentMatchers.<RowMapper<BucketKeyRecord>>any(), eq("billing"), eq("prod")))
                .thenReturn(List.of(row));
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_BUCKET_KEY_SQL),
                ArgumentMatchers.<RowMapper<BucketKeyRecord>>any(), eq("billing"), eq("dev")))
                .thenReturn(List.of());

        assertThat(repository.findBucketKey(bucket)).contains(row);
        assertThat(repository.findBucketKey(BucketId.of("billing", "dev"))).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("updateSecret reports whether a row was changed")
    void updateSecret() {
        byte[] ciphertext = {9, 9, 9};
        when(jdbcTemplate.update(eq(JdbcSecretRepository.UPDATE_SECRET_SQL),
                any(byte[].class), eq("billing"), eq("prod"), eq("db_password"))).thenReturn(1);
        when(jdbcTemplate.update(eq(JdbcSecretRepository.UPDATE_SECRET_SQL),
                any(byte[].class), eq("billing"), eq("prod"), eq("missing"))).thenReturn(0);

        assertThat(repository.updateSecret(new SecretRecord(bucket, "db_password", ciphertext))).isTrue();
        assertThat(repository.updateSecret(new SecretRecord(bucket, "missing", ciphertext))).isFalse();
    }

    @Test
    @DisplayName("deleteSecret reports whether a row was removed")
    void deleteSecret() {
        when(jdbcTemplate.update(JdbcSecretRepository.DELETE_SECRET_SQL, "billing", "prod", "db_password")).thenReturn(1);

        assertThat(repository.deleteSecret(bucket, "db_password")).isTrue();
    }

    @Test
    @DisplayName("Non-transient database errors surface as StoreException")
    void upsertSecret_SqlError() {
        when(jdbcTemplate.update(eq(JdbcSecretRepository.UPSERT_SECRET_SQL),
                eq("billing"), eq("prod"), eq("db_password"), any(byte[].class)))
                .thenThrow(new BadSqlGrammarException("upsert", JdbcSecretRepository.UPSERT_SECRET_SQL, new SQLException("relation does not exist")));

        assertThatThrownBy(() -> repository.upsertSecret(new SecretRecord(bucket, "db_password", new byte[] {1})))
                .isInstanceOf(StoreException.class)
                .isNotInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("forEachSecret pages through all rows in key order")
    void forEachSecret_Paginates() {
        List<JdbcSecretRepository.SecretRow> firstBatch = new ArrayList<>();
        for (int i = 0; i < JdbcSecretRepository.BATCH_SIZE; i++) {
            firstBatch.add(new JdbcSecretRepository.SecretRow("billing", "prod", String.format("s%04d", i), new byte[] {1}));
        }
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_FIRST_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(firstBatch);
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_NEXT_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(),
                eq("billing"), eq("prod"), eq("s0999"), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(List.of(new JdbcSecretRepository.SecretRow("reporting", "dev", "tail", new byte[] {2})));

        List<SecretRecord> seen = new ArrayList<>();
        repository.forEachSecret(seen::add);

        assertThat(seen).hasSize(JdbcSecretRepository.BATCH_SIZE + 1);
        SecretRecord last = seen.get(seen.size() - 1);
        assertThat(last.bucket()).isEqualTo(BucketId.of("reporting", "dev"));
        assertThat(last.secretName()).isEqualTo("tail");
    }

    @Test
    @DisplayName("forEachSecret stops after a short first batch")
    void forEachSecret_SingleBatch() {
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_FIRST_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(List.of(new JdbcSecretRepository.SecretRow("billing", "prod", "db_password", new byte[] {1})));

        List<SecretRecord> seen = new ArrayList<>();
        repository.forEachSecret(seen::add);

        assertThat(seen).extracting(SecretRecord::secretName).containsExactly("db_password");
        verify(jdbcTemplate, never()).query(eq(JdbcSecretRepository.SELECT_NEXT_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("forEachSecret skips rows with invalid names and keeps scanning")
    void forEachSecret_SkipsInvalidRows() {
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_FIRST_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(List.of(
                        new JdbcSecretRepository.SecretRow("billing", "prod", "../escape", new byte[] {1}),
                        new JdbcSecretRepository.SecretRow("bad app", "prod", "api_key", new byte[] {1}),
                        new JdbcSecretRepository.SecretRow("billing", "prod", "db_password", new byte[] {2})));

        List<SecretRecord> seen = new ArrayList<>();
        repository.forEachSecret(seen::add);

        assertThat(seen).extracting(SecretRecord::secretName).containsExactly("db_password");
    }

    @Test
    @DisplayName("Pagination continues after a full batch that ends with an invalid row")
    void forEachSecret_InvalidRowAtBatchEnd() {
        List<JdbcSecretRepository.SecretRow> firstBatch = new ArrayList<>();
        for (int i = 0; i < JdbcSecretRepository.BATCH_SIZE - 1; i++) {
            firstBatch.add(new JdbcSecretRepository.SecretRow("billing", "prod", String.format("s%04d", i), new byte[] {1}));
        }
        firstBatch.add(new JdbcSecretRepository.SecretRow("billing", "prod", "with space", new byte[] {1}));
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_FIRST_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(firstBatch);
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_NEXT_SECRET_BATCH_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(),
                eq("billing"), eq("prod"), eq("with space"), eq(JdbcSecretRepository.BATCH_SIZE)))
                .thenReturn(List.of(new JdbcSecretRepository.SecretRow("billing", "prod", "zeta", new byte[] {2})));

        List<SecretRecord> seen = new ArrayList<>();
        repository.forEachSecret(seen::add);

        assertThat(seen).hasSize(JdbcSecretRepository.BATCH_SIZE);
        assertThat(seen.get(seen.size() - 1).secretName()).isEqualTo("zeta");
    }

    @Test
    @DisplayName("Bucket key rows with invalid names map to null and are left out")
    void bucketKeyMapper_SkipsInvalidRows() throws SQLException {
        ResultSet invalid = mock(ResultSet.class);
        when(invalid.getString("app_name")).thenReturn("../etc");
        when(invalid.getString("bucket_name")).thenReturn("prod");
        ResultSet valid = mock(ResultSet.class);
        when(valid.getString("app_name")).thenReturn("billing");
        when(valid.getString("bucket_name")).thenReturn("prod");
        when(valid.getBytes("encryption_key_salt")).thenReturn(keyBlob);
        when(valid.getObject("client_id", UUID.class)).thenReturn(clientId);

        assertThat(JdbcSecretRepository.BUCKET_KEY_MAPPER.mapRow(invalid, 0)).isNull();
        BucketKeyRecord row = JdbcSecretRepository.BUCKET_KEY_MAPPER.mapRow(valid, 1);
        assertThat(row.bucket()).isEqualTo(bucket);
        assertThat(row.clientId()).isEqualTo(clientId);

        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_ALL_BUCKET_KEYS_SQL),
                ArgumentMatchers.<RowMapper<BucketKeyRecord>>any()))
                .thenReturn(Arrays.asList(null, row));

        assertThat(repository.findAllBucketKeys()).containsExactly(row);
    }

    @Test
    @DisplayName("findSecret returns the row when present")
    void findSecret() {
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_SECRET_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(),
                eq("billing"), eq("prod"), eq("db_password")))
                .thenReturn(List.of(new JdbcSecretRepository.SecretRow("billing", "prod", "db_password", new byte[] {7})));
        when(jdbcTemplate.query(eq(JdbcSecretRepository.SELECT_SECRET_SQL),
                ArgumentMatchers.<RowMapper<JdbcSecretRepository.SecretRow>>any(),
                eq("billing"), eq("prod"), eq("missing")))
                .thenReturn(List.of());

        assertThat(repository.findSecret(bucket, "db_password"))
                .hasValueSatisfying(r -> assertThat(r.encryptedSecret()).containsExactly(7));
        assertThat(repository.findSecret(bucket, "missing")).isEmpty();
    }

    @Test
    @DisplayName("translate separates transient failures from permanent ones")
    void translate() {
        assertThat(JdbcSecretRepository.translate("read", new QueryTimeoutException("timeout")))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("read");
        assertThat(JdbcSecretRepository.translate("read", new BadSqlGrammarException("read", "SELECT", new SQLException())))
                .isExactlyInstanceOf(StoreException.class);
    }
}
