package in.tradewell.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.tradewell.util.Env;

import java.util.Optional;

/**
 * Builds the connection pool from {@code DB_URL}, {@code DB_USER},
 * {@code DB_PASS} and {@code DB_POOL_SIZE}.
 */
public final class DataSources {

    private DataSources() {}

    /**
     * @return the pool, or empty when {@code DB_URL} is not set
     */
    public static Optional<HikariDataSource> fromEnvironment() {
        String url = Env.get("DB_URL", null);
        if (url == null) {
            return Optional.empty();
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(Env.get("DB_USER", "postgres"));
        config.setPassword(Env.get("DB_PASS", "postgres"));
        config.setMaximumPoolSize(Env.getInt("DB_POOL_SIZE", 2));
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("tradewell-journal");
        return Optional.of(new HikariDataSource(config));
    }

    /**
     * JDBC URL with credentials stripped, for logs.
     */
    public static String redact(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "<none>";
        }
        return jdbcUrl.replaceAll("(?i)(password=)[^&;]*", "$1***")
            .replaceAll("//[^/@]*@", "//***@");
    }
}
