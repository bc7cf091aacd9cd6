package io.lunacore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JobRunr configuration. Background ingestion jobs are persisted in their own SQLite file, separate
 * from the Luna database, so job bookkeeping never contends with the single-writer memory store.
 * The jobrunr-spring-boot-3-starter auto-configures the StorageProvider from this DataSource.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);

    @Bean
    public DataSource dataSource(
            @Value("${jobrunr.database.url:jdbc:sqlite:./data/jobrunr.db}") String url
    ) {
        createParentDirectory(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("JobRunr SQLite DataSource configured: {}", url);
        return ds;
    }

    private static void createParentDirectory(String url) {
        String prefix = "jdbc:sqlite:";
        if (!url.startsWith(prefix) || url.contains(":memory:")) {
            return;
        }
        Path parent = Path.of(url.substring(prefix.length())).toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.error("Failed to create JobRunr storage directory: {}", parent, e);
        }
    }
}
