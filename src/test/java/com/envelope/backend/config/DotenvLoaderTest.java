package com.envelope.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotenvLoaderTest {

    private static final String KEY_A = "ENVELOPE_DOTENV_TEST_A";
    private static final String KEY_B = "ENVELOPE_DOTENV_TEST_B";
    private static final String KEY_C = "ENVELOPE_DOTENV_TEST_C";

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(KEY_A);
        System.clearProperty(KEY_B);
        System.clearProperty(KEY_C);
    }

    @Test
    void parseLine_handlesCommentsExportAndQuotes() {
        assertTrue(DotenvLoader.parseLine("# comment").isEmpty());
        assertTrue(DotenvLoader.parseLine("   ").isEmpty());
        assertTrue(DotenvLoader.parseLine("NO_EQUALS_SIGN").isEmpty());
        assertTrue(DotenvLoader.parseLine("EMPTY=").isEmpty());

        Optional<Map.Entry<String, String>> exported = DotenvLoader.parseLine("export DB_URL=jdbc:postgresql://db/envelope");
        assertEquals("DB_URL", exported.get().getKey());
        assertEquals("jdbc:postgresql://db/envelope", exported.get().getValue());

        assertEquals("s3cr=t", DotenvLoader.parseLine("DB_PASSWORD=\"s3cr=t\"").get().getValue());
        assertEquals("envelope", DotenvLoader.parseLine("DB_USERNAME = 'envelope'").get().getValue());
    }

    @Test
    void load_setsOnlyKeysNotAlreadyDefined() throws IOException {
        Path env = tempDir.resolve(".env");
        Files.writeString(env, String.join("\n",
                "# local settings",
                KEY_A + "=from-file",
                KEY_B + "=from-file",
                KEY_C + "=from-file"));

        System.setProperty(KEY_B, "from-system");
        Map<String, String> environment = Map.of(KEY_C, "from-env");

        int loaded = DotenvLoader.load(env, environment::get);

        assertEquals(1, loaded);
        assertEquals("from-file", System.getProperty(KEY_A));
        assertEquals("from-system", System.getProperty(KEY_B));
        assertNull(System.getProperty(KEY_C));
    }

    @Test
    void load_missingFileIsANoOp() {
        int loaded = DotenvLoader.load(tempDir.resolve("missing.env"), key -> null);

        assertEquals(0, loaded);
        assertFalse(System.getProperties().containsKey(KEY_A));
    }
}
