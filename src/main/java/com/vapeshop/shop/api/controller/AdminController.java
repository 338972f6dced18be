package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.dto.BroadcastRequest;
import com.vapeshop.shop.api.dto.BroadcastResponse;
import com.vapeshop.shop.security.SecurityUtils;
import com.vapeshop.shop.service.BroadcastService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-only operations that do not belong to a single entity.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final BroadcastService broadcastService;

    public AdminController(BroadcastService broadcastService) {
        this.broadcastService = broadcastService;
    }

    @PostMapping("/broadcast")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BroadcastResponse> broadcast(@Valid @RequestBody BroadcastRequest request) {
        int recipients = broadcastService.broadcast(request.getMessage());
        logger.info("Admin {} broadcast a message to {} users", SecurityUtils.getCurrentUserId(), recipients);
        return ResponseEntity.ok(new BroadcastResponse(true, recipients));
    }
}
