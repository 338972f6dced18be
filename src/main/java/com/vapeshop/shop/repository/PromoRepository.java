package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.PromoCodec;
import com.vapeshop.shop.domain.model.Promo;
import com.vapeshop.shop.domain.model.PromoRedemption;
import com.vapeshop.shop.exception.DuplicatePromoCodeException;
import com.vapeshop.shop.exception.PromoLimitReachedException;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.exception.StoreException;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Promo codes stored as {@code promo:<code>} records.
 *
 * Known races, left as they are:
 * - create checks existence and then writes, so two concurrent creates of the same
 *   code both succeed and the later write wins;
 * - apply checks the limit and then increments, so concurrent redemptions near the
 *   limit can push {@code used} past {@code uses}. The increment itself is atomic.
 *
 * @author Vape Shop Team
 */
@Repository
public class PromoRepository extends KeyValueRepository<Promo> {

    private static final Logger logger = LoggerFactory.getLogger(PromoRepository.class);

    public static final String ENTITY = "promo";

    public PromoRepository(KeyValueStore store, PromoCodec codec) {
        super(store, codec, ENTITY);
    }

    public List<Promo> list() {
        return loadAll();
    }

    public Optional<Promo> findByCode(String code) {
        return load(keyFor(code));
    }

    /**
     * Create a promo code.
     *
     * @param promo Promo data; {@code used} defaults to 0
     * @return The stored promo
     * @throws DuplicatePromoCodeException if the code already exists
     */
    public Promo create(Promo promo) {
        String key = keyFor(promo.getCode());
        if (store.existsKey(key)) {
            logger.warn("Promo code {} already exists", promo.getCode());
            throw new DuplicatePromoCodeException(promo.getCode());
        }

        Instant now = Instant.now();
        if (promo.getUsed() == null) {
            promo.setUsed(0);
        }
        promo.setCreatedAt(now);
        promo.setUpdatedAt(now);

        store.setFields(key, codec.encode(promo));
        logger.info("Created promo code {} ({}% off, {} uses)", promo.getCode(), promo.getDiscount(), promo.getUses());
        return promo;
    }

    /**
     * Redeem a promo code once.
     *
     * @param code Promo code
     * @param userId User applying the code, for the log only
     * @return Discount and the redemption counter after this use
     * @throws ResourceNotFoundException if the code does not exist
     * @throws PromoLimitReachedException if no redemptions are left
     */
    public PromoRedemption apply(String code, Long userId) {
        Promo promo = findByCode(code)
                .orElseThrow(() -> new ResourceNotFoundException("Promo", code));

        if (!promo.hasRemainingUses()) {
            logger.warn("Promo code {} exhausted ({} / {}), rejected for user {}",
                    code, promo.getUsed(), promo.getUses(), userId);
            throw new PromoLimitReachedException(code, promo.getUses(), promo.getUsed());
        }

        String key = keyFor(code);
        long used = store.incrementField(key, PromoCodec.USED, 1);
        store.setFields(key, Map.of(PromoCodec.UPDATED_AT, Instant.now().toString()));
        logger.info("User {} applied promo code {} ({} / {})", userId, code, used, promo.getUses());

        try {
            return new PromoRedemption(code, promo.getDiscount(), Math.toIntExact(used));
        } catch (ArithmeticException e) {
            throw new StoreException(key, "Redemption counter out of range: " + used, e);
        }
    }
}
