package com.unifiedinbox.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Makes sure the uniqueness the dedup logic relies on exists in databases
 * whose tables predate the JPA constraints, and that removing an account
 * removes its threads, messages and attachments.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "sync.schema.ensure-indexes", havingValue = "true", matchIfMissing = true)
public class DatabaseMigration implements ApplicationRunner {

    private final JdbcTemplate jdbcTemplate;

    public DatabaseMigration(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        createUniqueIndexIfNotExists("ux_messages_provider_message_id", "messages", "provider_message_id");
        createUniqueIndexIfNotExists("ux_threads_account_provider_thread", "threads", "account_id, provider_thread_id");
        addCascadingForeignKeyIfNotExists("fk_threads_account", "threads", "account_id", "email_accounts");
        addCascadingForeignKeyIfNotExists("fk_messages_thread", "messages", "thread_id", "threads");
        addCascadingForeignKeyIfNotExists("fk_attachments_message", "attachments", "message_id", "messages");
        log.info("Database migration completed.");
    }

    private void createUniqueIndexIfNotExists(String index, String table, String columns) {
        try {
            jdbcTemplate.execute(String.format("CREATE UNIQUE INDEX IF NOT EXISTS %s ON %s (%s)", index, table, columns));
        } catch (DataAccessException e) {
            log.warn("Migration warning for index {} on {}: {}", index, table, e.getMessage());
        }
    }

    private void addCascadingForeignKeyIfNotExists(String constraint, String table, String column, String parent) {
        try {
            Integer existing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.table_constraints WHERE LOWER(constraint_name) = ?",
                Integer.class, constraint);
            if (existing != null && existing > 0) {
                return;
            }
            jdbcTemplate.execute(String.format(
                "ALTER TABLE %s ADD CONSTRAINT %s FOREIGN KEY (%s) REFERENCES %s (id) ON DELETE CASCADE",
                table, constraint, column, parent));
        } catch (DataAccessException e) {
            log.warn("Migration warning for foreign key {} on {}: {}", constraint, table, e.getMessage());
        }
    }
}
