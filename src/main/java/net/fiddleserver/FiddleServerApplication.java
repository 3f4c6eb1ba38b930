/**
 * Main application class for the fiddle server
 *
 * Features:
 * - Loads a local .env file into system properties before the context starts
 * - Serves versioned sandbox bundles from S3 and gist sources from the gist API
 * - Entry point for Spring Boot application
 */

package net.fiddleserver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FiddleServerApplication {

    private static final Logger log = LoggerFactory.getLogger(FiddleServerApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(FiddleServerApplication.class, args);
    }

    /**
     * Copies entries of {@code envFile} into system properties unless the process environment already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
            log.info("Loaded {} entries from {}", props.size(), envFile);
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
