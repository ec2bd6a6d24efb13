package tech.yump.rotator.rotation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotator.template.ProviderTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one in-flight cycle per (template, credential identity). A second request for the
 * same credential is rejected, not queued.
 * <p>
 * The identity key is a SHA-256 digest of the identity input values, so keys held in memory do
 * not reveal connection details.
 */
@Slf4j
@Component
public class RotationLockRegistry {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @throws RotationInProgressException if a cycle for the same credential is running.
     */
    public Lock acquire(ProviderTemplate template, JsonNode inputs) {
        String key = identityKey(template, inputs);
        if (!inFlight.add(key)) {
            log.warn("Rejected concurrent rotation for template '{}' (identity {})", template.name(), shortKey(key));
            throw new RotationInProgressException(template.name());
        }
        log.debug("Acquired rotation lock for template '{}' (identity {})", template.name(), shortKey(key));
        return () -> {
            inFlight.remove(key);
            log.debug("Released rotation lock for template '{}' (identity {})", template.name(), shortKey(key));
        };
    }

    public boolean isLocked(ProviderTemplate template, JsonNode inputs) {
        return inFlight.contains(identityKey(template, inputs));
    }

    static String identityKey(ProviderTemplate template, JsonNode inputs) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        for (String field : template.identityFields()) {
            JsonNode value = inputs.get(field);
            digest.update(field.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update((value == null ? "" : value.toString()).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return template.name() + ":" + HexFormat.of().formatHex(digest.digest());
    }

    private static String shortKey(String key) {
        int colon = key.indexOf(':');
        return key.substring(colon + 1, Math.min(key.length(), colon + 13));
    }

    /**
     * A held lock; closing it releases the credential for the next cycle.
     */
    @FunctionalInterface
    public interface Lock extends AutoCloseable {
        @Override
        void close();
    }
}
