package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Promo;
import com.vapeshop.shop.domain.model.PromoRedemption;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.PromoRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Promo code management. Codes are case-insensitive and stored upper-case.
 *
 * @author Vape Shop Team
 */
@Service
public class PromoService {

    private final PromoRepository promoRepository;

    public PromoService(PromoRepository promoRepository) {
        this.promoRepository = promoRepository;
    }

    public List<Promo> listPromos() {
        return promoRepository.list();
    }

    /**
     * @param code Promo code
     * @param discount Discount percentage, 1 to 100
     * @param uses Maximum number of redemptions, at least 1
     * @return Created promo
     */
    public Promo createPromo(String code, Integer discount, Integer uses) {
        String normalized = normalize(code);
        if (discount == null || discount < 1 || discount > 100) {
            throw new ValidationException("discount", "Discount must be between 1 and 100");
        }
        if (uses == null || uses < 1) {
            throw new ValidationException("uses", "Uses must be at least 1");
        }
        return promoRepository.create(Promo.builder()
                .code(normalized)
                .discount(discount)
                .uses(uses)
                .used(0)
                .build());
    }

    public PromoRedemption applyPromo(String code, Long userId) {
        return promoRepository.apply(normalize(code), userId);
    }

    private static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("code", "Field 'code' is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
