package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Promo;
import com.vapeshop.shop.domain.model.PromoRedemption;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.PromoRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PromoService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PromoService Unit Tests")
class PromoServiceTest {

    @Mock
    private PromoRepository promoRepository;

    @InjectMocks
    private PromoService promoService;

    @Test
    @DisplayName("createPromo - Lower-case code: Should be stored upper-case with used = 0")
    void createPromo_NormalizesCode() {
        // Given
        when(promoRepository.create(any(Promo.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        promoService.createPromo(" summer10 ", 10, 5);

        // Then
        ArgumentCaptor<Promo> captor = ArgumentCaptor.forClass(Promo.class);
        verify(promoRepository).create(captor.capture());
        assertThat(captor.getValue().getCode()).isEqualTo("SUMMER10");
        assertThat(captor.getValue().getUsed()).isZero();
    }

    @Test
    @DisplayName("createPromo - Discount out of range: Should throw ValidationException")
    void createPromo_BadDiscount() {
        assertThatThrownBy(() -> promoService.createPromo("X", 0, 5))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("discount");
        assertThatThrownBy(() -> promoService.createPromo("X", 101, 5))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(promoRepository);
    }

    @Test
    @DisplayName("createPromo - Zero uses: Should throw ValidationException")
    void createPromo_ZeroUses() {
        assertThatThrownBy(() -> promoService.createPromo("X", 10, 0))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("uses");
    }

    @Test
    @DisplayName("applyPromo - Mixed case code: Should look up the upper-case code")
    void applyPromo_NormalizesCode() {
        // Given
        when(promoRepository.apply("SALE15", 42L)).thenReturn(new PromoRedemption("SALE15", 15, 1));

        // When
        PromoRedemption redemption = promoService.applyPromo("Sale15", 42L);

        // Then
        assertThat(redemption.getDiscount()).isEqualTo(15);
    }

    @Test
    @DisplayName("applyPromo - Blank code: Should throw ValidationException")
    void applyPromo_Blank() {
        assertThatThrownBy(() -> promoService.applyPromo(" ", 42L))
                .isInstanceOf(ValidationException.class);
    }
}
