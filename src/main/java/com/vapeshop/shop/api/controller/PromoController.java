package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.dto.PromoApplyRequest;
import com.vapeshop.shop.api.dto.PromoRequest;
import com.vapeshop.shop.domain.model.Promo;
import com.vapeshop.shop.domain.model.PromoRedemption;
import com.vapeshop.shop.security.SecurityUtils;
import com.vapeshop.shop.service.PromoService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for promo codes.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/promos")
public class PromoController {

    private static final Logger logger = LoggerFactory.getLogger(PromoController.class);

    private final PromoService promoService;

    public PromoController(PromoService promoService) {
        this.promoService = promoService;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<Promo>> listPromos() {
        return ResponseEntity.ok(promoService.listPromos());
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Promo> createPromo(@Valid @RequestBody PromoRequest request) {
        Promo promo = promoService.createPromo(request.getCode(), request.getDiscount(), request.getUses());
        return ResponseEntity.status(HttpStatus.CREATED).body(promo);
    }

    /**
     * Redeem a promo code once.
     *
     * @param request Code, and optionally the user it is applied for (defaults to the caller)
     * @return Discount percentage and redemption counter
     */
    @PostMapping("/apply")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PromoRedemption> applyPromo(@Valid @RequestBody PromoApplyRequest request) {
        Long userId = request.getUserId() != null ? request.getUserId() : SecurityUtils.getCurrentUserId();
        SecurityUtils.verifyUserAccess(userId);

        PromoRedemption redemption = promoService.applyPromo(request.getCode(), userId);
        logger.debug("Promo {} applied for user {}: {}% off", redemption.getCode(), userId, redemption.getDiscount());
        return ResponseEntity.ok(redemption);
    }
}
