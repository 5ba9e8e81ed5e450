package io.hivememory.config;

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
 * JobRunr keeps its job state in a SQLite file of its own. Unless
 * {@code jobrunr.database.url} says otherwise, that file is {@code jobrunr.db} inside
 * the memory directory. The jobrunr-spring-boot-3-starter builds its StorageProvider
 * from this DataSource.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);

    @Bean
    public DataSource dataSource(MemoryProperties properties,
                                 @Value("${jobrunr.database.url:}") String url) {
        String resolved = url.isBlank() ? defaultUrl(Path.of(properties.path())) : url;
        var ds = new SQLiteDataSource();
        ds.setUrl(resolved);
        log.info("JobRunr job store: {}", resolved);
        return ds;
    }

    static String defaultUrl(Path memoryDirectory) {
        try {
            Files.createDirectories(memoryDirectory);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", memoryDirectory, e);
        }
        return "jdbc:sqlite:" + memoryDirectory.resolve("jobrunr.db");
    }
}
