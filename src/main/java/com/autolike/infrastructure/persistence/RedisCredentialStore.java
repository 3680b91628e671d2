package com.autolike.infrastructure.persistence;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.exception.CredentialCodecException;
import com.autolike.domain.model.Credential;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credentials kept as fields of a single Redis hash, keyed by subject id.
 *
 * The snapshot is one HGETALL and each write is one HSET, so both are atomic
 * on the Redis side. Concurrent writes for the same subject resolve last-write-wins.
 */
@Slf4j
@Repository
public class RedisCredentialStore implements CredentialStore {

    private final StringRedisTemplate redis;
    private final CredentialCodec codec;
    private final MeterRegistry meterRegistry;
    private final String hashKey;

    public RedisCredentialStore(StringRedisTemplate redis,
                                CredentialCodec codec,
                                MeterRegistry meterRegistry,
                                AutoLikeProperties properties) {
        this.redis = redis;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
        this.hashKey = properties.getStore().getKey();
    }

    @Override
    public Map<String, Credential> getAll() {
        Map<String, String> entries = hash().entries(hashKey);
        Map<String, Credential> snapshot = new LinkedHashMap<>();

        entries.forEach((subjectId, json) -> {
            try {
                snapshot.put(subjectId, codec.decode(subjectId, json));
            } catch (CredentialCodecException e) {
                // A broken record only costs that subscriber this cycle
                log.warn("Skipping credential record: {}", e.getMessage());
                meterRegistry.counter("autolike.store.records.skipped").increment();
            }
        });

        log.debug("Loaded {} credential records ({} skipped)", snapshot.size(), entries.size() - snapshot.size());
        return snapshot;
    }

    @Override
    public void put(String subjectId, Credential credential) {
        hash().put(hashKey, subjectId, codec.encode(credential));
        log.debug("Stored credential for subject {}", subjectId);
    }

    private HashOperations<String, String, String> hash() {
        return redis.opsForHash();
    }
}
