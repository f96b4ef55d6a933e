package com.releasefeed.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the one {@link HttpClient} a run shares across discovery, validation and parsing, so
 * keep-alive connections to the portal are reused. Redirects are followed; a private CA can be
 * trusted through {@code TRUSTSTORE_PATH} / {@code TRUSTSTORE_PASSWORD}.
 */
public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        TruststoreSettings.fromEnvironment(environment)
                .map(HttpClientFactory::sslContext)
                .ifPresent(builder::sslContext);
        return builder.build();
    }

    private static SSLContext sslContext(TruststoreSettings settings) {
        try (InputStream in = Files.newInputStream(settings.path())) {
            KeyStore trustStore = KeyStore.getInstance(settings.type());
            trustStore.load(in, settings.password());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            LOGGER.info("Using " + settings.type() + " truststore " + settings.path());
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + settings.path(), e);
        }
    }

    record TruststoreSettings(Path path, char[] password, String type) {
        static Optional<TruststoreSettings> fromEnvironment(Map<String, String> environment) {
            String location = environment.get("TRUSTSTORE_PATH");
            if (location == null || location.isBlank()) {
                return Optional.empty();
            }
            String password = environment.get("TRUSTSTORE_PASSWORD");
            if (password == null) {
                throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
            }
            Path path = Path.of(location);
            if (!Files.isRegularFile(path)) {
                throw new IllegalStateException("Truststore file does not exist: " + path);
            }
            return Optional.of(new TruststoreSettings(path, password.toCharArray(), typeOf(path)));
        }

        private static String typeOf(Path path) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            boolean pkcs12 = name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12");
            return pkcs12 ? "PKCS12" : "JKS";
        }
    }
}
