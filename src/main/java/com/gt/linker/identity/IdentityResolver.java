package com.gt.linker.identity;

import com.gt.linker.exception.IdentityUnresolvableException;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.remote.RemoteKnowledgePointKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Computes the single string identity used for a knowledge point everywhere outside the stores.
 * <p>
 * Resolution order is composite id, legacy id, ancient id, and finally a hash of the correct phrase.
 * The hash is MD5 over the UTF-8 bytes so the same phrase maps to the same id across restarts.
 */
@Component
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final String FALLBACK_PREFIX = "fallback_";

    public String effectiveId(KnowledgePoint point) {
        if (point.compositeId() != null) {
            return point.compositeId().canonical();
        } else if (point.legacyId() != null) {
            return Long.toString(point.legacyId());
        } else if (point.ancientId() != null) {
            return Long.toString(point.ancientId());
        }

        if (point.correctPhrase() == null || point.correctPhrase().isBlank()) {
            String errMsg = "Knowledge point in category " + point.category() + " has no identifier and no correct phrase";

            log.error(errMsg);
            throw new IdentityUnresolvableException(errMsg);
        }

        return FALLBACK_PREFIX + stableHash(point.correctPhrase());
    }

    public boolean isFallbackId(String effectiveId) {
        return effectiveId != null && effectiveId.startsWith(FALLBACK_PREFIX);
    }

    // The legacy field is kept only so older server endpoints can still be addressed.
    public Optional<RemoteKnowledgePointKey> remoteKey(KnowledgePoint point) {
        if (point.compositeId() != null) {
            return Optional.of(RemoteKnowledgePointKey.composite(point.compositeId()));
        } else if (point.legacyId() != null) {
            return Optional.of(RemoteKnowledgePointKey.legacy(point.legacyId()));
        } else if (point.ancientId() != null) {
            return Optional.of(RemoteKnowledgePointKey.legacy(point.ancientId()));
        }

        return Optional.empty();
    }

    static String stableHash(String correctPhrase) {
        return DigestUtils.md5DigestAsHex(correctPhrase.getBytes(StandardCharsets.UTF_8));
    }
}
