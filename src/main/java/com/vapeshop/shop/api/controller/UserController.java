package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.dto.ReferralRequest;
import com.vapeshop.shop.api.dto.UserUpdateRequest;
import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.security.SecurityUtils;
import com.vapeshop.shop.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for user profiles and referrals.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /**
     * Get a profile, creating it on first access.
     *
     * @param id User id
     * @param username Username to store if the profile is new
     * @return The profile
     */
    @GetMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<User> getUser(
            @PathVariable long id,
            @RequestParam(required = false) String username
    ) {
        SecurityUtils.verifyUserAccess(id);
        return ResponseEntity.ok(userService.getOrCreate(id, username));
    }

    /**
     * Update a profile. Only admins may change the bonus balance.
     */
    @PutMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<User> updateUser(
            @PathVariable long id,
            @Valid @RequestBody UserUpdateRequest request
    ) {
        SecurityUtils.verifyUserAccess(id);
        if (request.getBonus() != null) {
            SecurityUtils.verifyAdminAccess();
        }
        return ResponseEntity.ok(userService.updateUser(id, request.getUsername(), request.getBonus()));
    }

    @PostMapping("/{id}/referral")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<User> applyReferral(
            @PathVariable long id,
            @Valid @RequestBody ReferralRequest request
    ) {
        SecurityUtils.verifyUserAccess(id);
        return ResponseEntity.ok(userService.applyReferral(id, request.getReferralCode()));
    }
}
