package com.cred.freestyle.lottery.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Redis cache for the UPC families of activated packs.
 * Holds a pack's UPCs for a retry window so deactivation can remove them from the POS.
 *
 * Cache Keys:
 * - pack_upcs:{pack_id} -> CachedPackUpcs (JSON)
 *
 * Every Redis failure is logged and reported as false or empty; nothing is thrown to callers.
 *
 * @author Lottery Back Office Team
 */
@Service
public class PackUpcCacheService {

    private static final Logger logger = LoggerFactory.getLogger(PackUpcCacheService.class);

    private static final String PACK_UPCS_PREFIX = "pack_upcs:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration retryWindow;

    public PackUpcCacheService(
            RedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            @Value("${lottery.pack-upc.cache-ttl-minutes:60}") long cacheTtlMinutes
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retryWindow = Duration.ofMinutes(cacheTtlMinutes);
    }

    /**
     * Store a pack's UPCs, stamping generatedAt and expiresAt.
     *
     * @param entry Pack UPC entry
     * @return true if the write succeeded
     */
    public boolean store(CachedPackUpcs entry) {
        try {
            Instant now = Instant.now();
            entry.setGeneratedAt(now);
            entry.setExpiresAt(now.plus(retryWindow));

            String json = objectMapper.writeValueAsString(entry);
            redisTemplate.opsForValue().set(key(entry.getPackId()), json, retryWindow);
            logger.debug("Cached {} UPCs for pack {}", entry.getUpcs().size(), entry.getPackId());
            return true;
        } catch (JsonProcessingException e) {
            logger.error("Error serializing UPCs for pack: {}", entry.getPackId(), e);
            return false;
        } catch (Exception e) {
            logger.error("Error caching UPCs for pack: {}", entry.getPackId(), e);
            return false;
        }
    }

    /**
     * Get a pack's cached UPCs.
     *
     * @param packId Pack ID
     * @return Optional containing the entry if cached and inside its retry window
     */
    public Optional<CachedPackUpcs> get(String packId) {
        try {
            String json = redisTemplate.opsForValue().get(key(packId));
            if (json == null) {
                logger.debug("Cache miss for pack UPCs: {}", packId);
                return Optional.empty();
            }

            CachedPackUpcs entry = objectMapper.readValue(json, CachedPackUpcs.class);
            if (entry.isExpiredAt(Instant.now())) {
                logger.debug("Cached UPCs for pack {} expired at {}", packId, entry.getExpiresAt());
                return Optional.empty();
            }

            logger.debug("Cache hit for pack UPCs: {}", packId);
            return Optional.of(entry);
        } catch (Exception e) {
            logger.error("Error getting UPCs from cache for pack: {}", packId, e);
            return Optional.empty();
        }
    }

    /**
     * Delete a pack's cached UPCs.
     *
     * @param packId Pack ID
     * @return true if the delete call succeeded, whether or not the key existed
     */
    public boolean delete(String packId) {
        try {
            redisTemplate.delete(key(packId));
            logger.debug("Deleted cached UPCs for pack: {}", packId);
            return true;
        } catch (Exception e) {
            logger.error("Error deleting UPCs from cache for pack: {}", packId, e);
            return false;
        }
    }

    private static String key(String packId) {
        return PACK_UPCS_PREFIX + packId;
    }
}
