package com.staybot.app;

import com.staybot.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StayBotApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void createConfig_shouldWriteLoadableDefaults() {
        Path target = tempDir.resolve("conf/config.properties");

        int exit = new StayBotApplication().run(new String[]{"--create-config", target.toString()});

        assertEquals(StayBotApplication.EXIT_OK, exit);
        assertTrue(Files.isRegularFile(target));
        Config loaded = Config.load(tempDir, target);
        assertEquals("București, România", loaded.getString("search.destination"));
        assertEquals("override", loaded.sourceOf("schedule.search_hours"));
    }

    @Test
    void createConfig_existingFile_shouldRefuseToOverwrite() throws Exception {
        Path target = tempDir.resolve("config.properties");
        Files.writeString(target, "search.guests=4\n");

        int exit = new StayBotApplication().run(new String[]{"--create-config", target.toString()});

        assertEquals(StayBotApplication.EXIT_USAGE, exit);
        assertEquals("search.guests=4\n", Files.readString(target));
    }

    @Test
    void run_usageErrors_shouldReturnUsageExitCode() {
        assertEquals(StayBotApplication.EXIT_USAGE, new StayBotApplication().run(new String[]{"--bogus"}));
        assertEquals(StayBotApplication.EXIT_USAGE, new StayBotApplication().run(new String[]{"--once", "--daemon"}));
        assertEquals(StayBotApplication.EXIT_OK, new StayBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void escape_shouldProduceLatin1SafeText() {
        assertEquals("Bucure\\u0219ti, Rom\\u00e2nia", StayBotApplication.escape("București, România"));
        assertEquals("C:\\\\data", StayBotApplication.escape("C:\\data"));
    }
}
