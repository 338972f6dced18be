package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * User profiles and referral bonuses.
 *
 * @author Vape Shop Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final int referralBonus;

    public UserService(
            UserRepository userRepository,
            @Value("${vapeshop.referral.bonus:100}") int referralBonus
    ) {
        this.userRepository = userRepository;
        this.referralBonus = referralBonus;
    }

    /**
     * Read a user profile, creating a default one on first access.
     *
     * @param id External user id
     * @param username Username for a new profile, may be null
     * @return The user
     */
    public User getOrCreate(long id, String username) {
        return userRepository.getOrCreate(id, username);
    }

    /**
     * Change profile fields. Null arguments leave the stored value alone.
     *
     * @param id User id
     * @param username New username
     * @param bonus New bonus balance, must not be negative
     * @return Updated user
     */
    public User updateUser(long id, String username, Integer bonus) {
        User user = userRepository.getOrCreate(id, username);
        if (username != null && !username.isBlank()) {
            user.setUsername(username.trim());
        }
        if (bonus != null) {
            if (bonus < 0) {
                throw new ValidationException("bonus", "Bonus must not be negative");
            }
            user.setBonus(bonus);
        }
        return userRepository.save(user);
    }

    /**
     * Register that a user signed up with someone's referral code and credit the referrer.
     *
     * @param userId User who was referred
     * @param referralCode Code of the referrer, case-insensitive
     * @return The referred user
     * @throws ResourceNotFoundException if no user has that code
     * @throws ValidationException for self-referral or if the user was already referred
     */
    public User applyReferral(long userId, String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            throw new ValidationException("referralCode", "Field 'referralCode' is required");
        }
        String code = referralCode.trim();
        User user = userRepository.getOrCreate(userId, null);

        List<User> users = userRepository.list();
        User referrer = users.stream()
                .filter(candidate -> code.equalsIgnoreCase(candidate.getReferralCode()))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Referral code", code));

        if (referrer.getId() == userId) {
            throw new ValidationException("referralCode", "Cannot use your own referral code");
        }
        boolean alreadyReferred = users.stream()
                .anyMatch(candidate -> candidate.getReferrals() != null && candidate.getReferrals().contains(userId));
        if (alreadyReferred) {
            throw new ValidationException("referralCode", "User " + userId + " was already referred");
        }

        referrer.getReferrals().add(userId);
        referrer.setBonus(referrer.getBonus() + referralBonus);
        userRepository.save(referrer);
        logger.info("User {} referred by {}, credited {} bonus", userId, referrer.getId(), referralBonus);
        return user;
    }
}
