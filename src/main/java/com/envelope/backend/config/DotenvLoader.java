package com.envelope.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads KEY=value pairs from a local ".env" file into System properties for development runs.
 *
 * Existing environment variables and System properties always win; a missing file is a no-op.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final List<Path> DEFAULT_CANDIDATES = List.of(
            Path.of(".env"),
            Path.of("envelope-backend", ".env")
    );

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        DEFAULT_CANDIDATES.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .ifPresent(path -> load(path, System::getenv));
    }

    static int load(Path envPath, Function<String, String> environment) {
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[DotenvLoader] Could not read {} (ignored): {}", envPath, e.getMessage());
            return 0;
        }

        int loaded = 0;
        for (String raw : lines) {
            Optional<Map.Entry<String, String>> entry = parseLine(raw);
            if (entry.isEmpty()) continue;

            String key = entry.get().getKey();
            if (isDefined(environment.apply(key)) || isDefined(System.getProperty(key))) {
                continue;
            }
            System.setProperty(key, entry.get().getValue());
            loaded++;
        }

        if (loaded > 0) {
            log.info("[DotenvLoader] Loaded {} keys from {} (values hidden)", loaded, envPath.toAbsolutePath());
        }
        return loaded;
    }

    static Optional<Map.Entry<String, String>> parseLine(String raw) {
        if (raw == null) return Optional.empty();
        String line = raw.trim();
        if (line.isEmpty() || line.startsWith("#")) return Optional.empty();
        if (line.startsWith("export ")) {
            line = line.substring("export ".length()).trim();
        }

        int idx = line.indexOf('=');
        if (idx <= 0) return Optional.empty();

        String key = line.substring(0, idx).trim();
        String value = unquote(line.substring(idx + 1).trim());
        if (key.isEmpty() || value.isEmpty()) return Optional.empty();

        return Optional.of(Map.entry(key, value));
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
