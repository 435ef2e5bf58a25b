package com.eventedge.hypepipe.auth;

import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Resolves the HS256 signing secret.
 *
 * <p>Lookup order: {@code hypepipe.auth.jwt-secret} (bound to {@code HYPEPIPE_JWT_SECRET}),
 * then the secret file (default {@code .hypepipe_jwt_secret} in the deployment directory),
 * which covers hosts where the service environment cannot be edited. The secret is
 * resolved on every call so a file dropped in at runtime takes effect without a restart.
 */
@Component
public class SigningSecretProvider {

    private static final Logger log = LoggerFactory.getLogger(SigningSecretProvider.class);

    /** HS256 needs a 256-bit key. */
    static final int MIN_SECRET_BYTES = 32;

    private final String configuredSecret;
    private final Path secretFile;

    public SigningSecretProvider(
            @Value("${hypepipe.auth.jwt-secret:}") String configuredSecret,
            @Value("${hypepipe.auth.jwt-secret-file:.hypepipe_jwt_secret}") String secretFile) {
        this.configuredSecret = configuredSecret;
        this.secretFile       = Path.of(secretFile);
    }

    /**
     * @throws AuthConfigurationException when no usable secret is configured anywhere
     */
    public SecretKey signingKey() {
        String secret = resolveSecret();
        if (secret.isEmpty()) {
            log.error("HYPEPIPE_JWT_SECRET is not set and {} not found", secretFile.toAbsolutePath());
            throw new AuthConfigurationException("Server auth configuration missing");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            log.error("HypePipe signing secret is {} bytes; at least {} are required", bytes.length, MIN_SECRET_BYTES);
            throw new AuthConfigurationException("Server auth configuration invalid");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    String resolveSecret() {
        if (configuredSecret != null && !configuredSecret.isBlank()) {
            return configuredSecret.trim();
        }
        try {
            return Files.readString(secretFile, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            return "";
        } catch (IOException e) {
            log.warn("Could not read signing secret file. path={}", secretFile.toAbsolutePath(), e);
            return "";
        }
    }
}
