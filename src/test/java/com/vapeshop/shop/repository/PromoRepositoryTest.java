package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.model.Promo;
import com.vapeshop.shop.domain.model.PromoRedemption;
import com.vapeshop.shop.exception.DuplicatePromoCodeException;
import com.vapeshop.shop.exception.PromoLimitReachedException;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.testutil.InMemoryShop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PromoRepository against the in-memory store.
 */
@DisplayName("PromoRepository Tests")
class PromoRepositoryTest {

    private PromoRepository promoRepository;

    @BeforeEach
    void setUp() {
        promoRepository = new InMemoryShop().promoRepository;
    }

    private static Promo promo(String code, int discount, int uses) {
        return Promo.builder().code(code).discount(discount).uses(uses).build();
    }

    // ========================================
    // create() Tests
    // ========================================

    @Test
    @DisplayName("create - New code: Should store it with used = 0")
    void create_NewCode() {
        // When
        Promo created = promoRepository.create(promo("SALE15", 15, 10));

        // Then
        assertThat(created.getUsed()).isZero();
        Promo loaded = promoRepository.findByCode("SALE15").orElseThrow();
        assertThat(loaded.getDiscount()).isEqualTo(15);
        assertThat(loaded.getUses()).isEqualTo(10);
        assertThat(loaded.getUsed()).isZero();
        assertThat(promoRepository.list()).hasSize(1);
    }

    @Test
    @DisplayName("create - Existing code: Should throw DuplicatePromoCodeException and keep the original")
    void create_Duplicate() {
        // Given
        promoRepository.create(promo("SALE15", 15, 10));

        // When / Then
        assertThatThrownBy(() -> promoRepository.create(promo("SALE15", 50, 1)))
                .isInstanceOf(DuplicatePromoCodeException.class);
        assertThat(promoRepository.findByCode("SALE15").orElseThrow().getDiscount()).isEqualTo(15);
    }

    // ========================================
    // apply() Tests
    // ========================================

    @Test
    @DisplayName("apply - Single-use code: Should succeed once, then report the limit")
    void apply_SingleUse() {
        // Given
        promoRepository.create(promo("ONCE", 20, 1));

        // When
        PromoRedemption redemption = promoRepository.apply("ONCE", 42L);

        // Then
        assertThat(redemption.getCode()).isEqualTo("ONCE");
        assertThat(redemption.getDiscount()).isEqualTo(20);
        assertThat(redemption.getUsed()).isEqualTo(1);

        assertThatThrownBy(() -> promoRepository.apply("ONCE", 43L))
                .isInstanceOf(PromoLimitReachedException.class)
                .satisfies(ex -> {
                    PromoLimitReachedException limit = (PromoLimitReachedException) ex;
                    assertThat(limit.getUses()).isEqualTo(1);
                    assertThat(limit.getUsed()).isEqualTo(1);
                });
        assertThat(promoRepository.findByCode("ONCE").orElseThrow().getUsed()).isEqualTo(1);
    }

    @Test
    @DisplayName("apply - Several uses: Should count redemptions up")
    void apply_CountsUp() {
        // Given
        promoRepository.create(promo("MULTI", 10, 3));

        // When
        promoRepository.apply("MULTI", 1L);
        PromoRedemption second = promoRepository.apply("MULTI", 2L);

        // Then
        assertThat(second.getUsed()).isEqualTo(2);
        assertThat(promoRepository.findByCode("MULTI").orElseThrow().hasRemainingUses()).isTrue();
    }

    @Test
    @DisplayName("apply - Unknown code: Should throw ResourceNotFoundException")
    void apply_Unknown() {
        assertThatThrownBy(() -> promoRepository.apply("NOPE", 42L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("NOPE");
    }
}
