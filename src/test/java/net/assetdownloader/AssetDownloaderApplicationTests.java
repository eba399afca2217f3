package net.assetdownloader;

import net.assetdownloader.application.download.DownloadOrchestrator;
import net.assetdownloader.config.DownloaderProperties;
import net.assetdownloader.model.RunState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/**
 * Context load test for the asset downloader.
 *
 * Verifies that the application context starts with the "test" profile, that
 * {@code downloader.*} properties bind, and that the run executor is a single slot.
 */
@SpringBootTest
@ActiveProfiles("test")
class AssetDownloaderApplicationTests {

    @Autowired
    private DownloaderProperties properties;

    @Autowired
    private DownloadOrchestrator orchestrator;

    @Autowired
    @Qualifier("downloadRunExecutor")
    private TaskExecutor downloadRunExecutor;

    @Test
    void contextLoads() {
        assertEquals(RunState.IDLE, orchestrator.state());
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void should_BindDownloaderProperties_When_TestProfileIsActive() {
        assertEquals(5, properties.getDefaultWorkers());
        assertEquals(95, properties.getDefaultJpegQuality());
        assertEquals(3, properties.getHttp().getRetryAttempts());
        assertEquals(Duration.ofMillis(10), properties.getHttp().getBackoffBase());
        assertEquals(Duration.ofSeconds(5), properties.getHttp().getTimeout());
    }

    @Test
    void should_RunOneDownloadAtATime_When_ExecutorIsConfigured() {
        ThreadPoolTaskExecutor executor = assertInstanceOf(ThreadPoolTaskExecutor.class, downloadRunExecutor);
        assertEquals(1, executor.getCorePoolSize());
        assertEquals(1, executor.getMaxPoolSize());
        assertEquals("DownloadRun-", executor.getThreadNamePrefix());
    }
}
