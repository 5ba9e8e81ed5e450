package io.hivememory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.MemoryDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the engine's shared context: one database, one clock, one node id.
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public MemoryContext memoryContext(MemoryProperties properties, Clock clock, ObjectMapper objectMapper) {
        MemoryDatabase database = MemoryDatabase.inDirectory(Path.of(properties.path()));
        database.open();
        log.info("Memory engine node {} using {}", properties.sync().nodeId(), database.getPath());
        return new MemoryContext(database, clock, objectMapper, properties.sync().nodeId());
    }
}
