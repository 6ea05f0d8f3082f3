package com.agentloop.core.persistence;

import com.agentloop.config.LoopProperties;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Selects the {@link BaseCheckpointSaver} the loop graph is compiled with.
 * <p>
 * A {@link DataSource} bean wins and gets a {@link JdbcCheckpointSaver}. Without one,
 * {@code agentloop.checkpoint.store=file} writes JSON files to the configured directory and
 * anything else keeps checkpoints in a {@link MemorySaver}, which does not survive a restart.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public BaseCheckpointSaver jdbcCheckpointSaver(DataSource dataSource) throws SQLException {
        log.info("Configuring JDBC checkpoint saver");
        var saver = new JdbcCheckpointSaver(dataSource);
        saver.createTables();
        return saver;
    }

    @Bean
    @ConditionalOnMissingBean(BaseCheckpointSaver.class)
    public BaseCheckpointSaver fallbackCheckpointSaver(LoopProperties properties) {
        var checkpoint = properties.getCheckpoint();
        if (checkpoint.isFileStore()) {
            Path directory = Path.of(checkpoint.getDirectory());
            log.info("No DataSource available; writing checkpoints to {}", directory.toAbsolutePath());
            return new FileCheckpointSaver(directory);
        }
        log.info("No DataSource available; using in-memory checkpoint saver (state will not persist across restarts)");
        return new MemorySaver();
    }
}
