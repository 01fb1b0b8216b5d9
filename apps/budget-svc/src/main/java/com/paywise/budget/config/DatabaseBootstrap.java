package com.paywise.budget.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@code db/schema.sql} when the budget tables are missing and
 * {@code paywise.db.bootstrap-enabled} is set (env PAYWISE_DB_BOOTSTRAP=true).
 * Every statement in the script is idempotent.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource, PaywiseProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.db().bootstrapEnabledFlag();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (paywise.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, "pay_settings")) {
                log.info("DB bootstrap skipped: schema already present (pay_settings table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) continue;
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (Exception e) {
            // Do not prevent application from starting; operations can inspect logs
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean tableExists(Connection conn, String table) throws java.sql.SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, table, new String[] {"TABLE"})) {
            return rs.next();
        }
    }

    private String loadSchemaSql() throws java.io.IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    private List<String> splitStatements(String sql) {
        // schema.sql contains no procedural blocks
        return Arrays.asList(sql.split(";"));
    }
}
