package com.releasefeed.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.releasefeed.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    public static final String PRODUCTS_FILE = "products.json";

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    /**
     * Reads {@code products.json} from {@code configDir}, or the copy bundled on the classpath when the
     * directory has none.
     */
    public static FeedCatalog loadCatalog(Path configDir) {
        Path file = configDir.resolve(PRODUCTS_FILE);
        if (Files.exists(file)) {
            return read(file, new TypeReference<>() {
            });
        }
        LOGGER.info("No " + file + " found; using bundled product catalogue");
        return readResource(PRODUCTS_FILE, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static <T> T readResource(String name, TypeReference<T> ref) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Bundled config not found on classpath: " + name);
            }
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from classpath:" + name, e);
        }
    }
}
