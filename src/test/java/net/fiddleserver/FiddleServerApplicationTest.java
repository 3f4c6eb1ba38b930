package net.fiddleserver;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FiddleServerApplicationTest {

    private static final String KEY = "FIDDLE_SERVER_TEST_ENTRY";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void should_CopyEntriesIntoSystemProperties_When_EnvFileExists(@TempDir Path dir) throws Exception {
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, KEY + "=from-file\n");

        FiddleServerApplication.loadDotEnvFile(envFile);

        assertThat(System.getProperty(KEY)).isEqualTo("from-file");
    }

    @Test
    void should_KeepExistingProperty_When_AlreadySet(@TempDir Path dir) throws Exception {
        System.setProperty(KEY, "explicit");
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, KEY + "=from-file\n");

        FiddleServerApplication.loadDotEnvFile(envFile);

        assertThat(System.getProperty(KEY)).isEqualTo("explicit");
    }

    @Test
    void should_DoNothing_When_EnvFileIsMissing(@TempDir Path dir) {
        FiddleServerApplication.loadDotEnvFile(dir.resolve(".env"));

        assertThat(System.getProperty(KEY)).isNull();
    }
}
