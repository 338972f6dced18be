package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.UserCodec;
import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import com.vapeshop.shop.security.AdminAllowList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Users stored as {@code user:<id>} records, keyed by their external id.
 *
 * The admin flag is always recomputed from the {@link AdminAllowList}; whatever a
 * stored record or a caller says about it is ignored.
 *
 * @author Vape Shop Team
 */
@Repository
public class UserRepository extends KeyValueRepository<User> {

    private static final Logger logger = LoggerFactory.getLogger(UserRepository.class);

    public static final String ENTITY = "user";

    private static final String REFERRAL_CODE_PREFIX = "REF";

    private final AdminAllowList adminAllowList;

    public UserRepository(KeyValueStore store, UserCodec codec, AdminAllowList adminAllowList) {
        super(store, codec, ENTITY);
        this.adminAllowList = adminAllowList;
    }

    public Optional<User> get(long id) {
        return load(keyFor(id)).map(user -> withDerivedFields(user, id));
    }

    public List<User> list() {
        List<User> users = loadAll();
        users.forEach(user -> user.setIsAdmin(adminAllowList.isAdmin(user.getId())));
        return users;
    }

    /**
     * Return the user, creating and persisting a default profile first if none exists.
     * A new profile has zero bonus, no referrals and the referral code {@code REF<id>}.
     *
     * @param id External user id
     * @param username Username for a new profile, may be null
     * @return Stored or newly created user
     */
    public User getOrCreate(long id, String username) {
        Optional<User> existing = get(id);
        if (existing.isPresent()) {
            return existing.get();
        }

        User user = User.builder()
                .id(id)
                .username(username)
                .bonus(0)
                .referrals(new LinkedHashSet<>())
                .referralCode(defaultReferralCode(id))
                .build();
        logger.info("Creating profile for new user {}", id);
        return save(user);
    }

    /**
     * Write a user record. Non-null fields overwrite stored values; the stored
     * creation time is kept unless one is supplied.
     *
     * @param user User data; mutated with timestamps and admin flag
     * @return The same user
     */
    public User save(User user) {
        if (user.getId() == null) {
            throw new IllegalArgumentException("User id is required");
        }
        Instant now = Instant.now();
        if (user.getCreatedAt() == null) {
            user.setCreatedAt(load(keyFor(user.getId())).map(User::getCreatedAt).orElse(now));
        }
        user.setUpdatedAt(now);

        store.setFields(keyFor(user.getId()), codec.encode(user));
        logger.debug("Saved user {}", user.getId());
        return withDerivedFields(user, user.getId());
    }

    public static String defaultReferralCode(long id) {
        return REFERRAL_CODE_PREFIX + id;
    }

    private User withDerivedFields(User user, long id) {
        if (user.getId() == null) {
            user.setId(id);
        }
        user.setIsAdmin(adminAllowList.isAdmin(user.getId()));
        return user;
    }
}
