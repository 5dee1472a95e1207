package com.crisisnavigator.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        truststoreContext(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<SSLContext> truststoreContext(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH);
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }
        String truststorePassword = environment.get(TRUSTSTORE_PASSWORD);
        if (truststorePassword == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(truststorePath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(storeType(path));
            trustStore.load(in, truststorePassword.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return Optional.of(sslContext);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    static String storeType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
