/**
 * Main application class for the digital asset downloader
 *
 * Features:
 * - Exposes download runs over REST and Server-Sent Events
 * - Binds downloader settings from application.yml
 * - Entry point for Spring Boot application
 */

package net.assetdownloader;

import net.assetdownloader.config.DownloaderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetDownloaderApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AssetDownloaderApplication.class);

    private final DownloaderProperties properties;

    public AssetDownloaderApplication(DownloaderProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(AssetDownloaderApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Asset downloader ready: defaultWorkers={}, retryAttempts={}, httpTimeout={}",
            properties.getDefaultWorkers(),
            properties.getHttp().getRetryAttempts(),
            properties.getHttp().getTimeout());
    }
}
