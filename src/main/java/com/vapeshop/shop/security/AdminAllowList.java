package com.vapeshop.shop.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static set of user ids trusted as shop admins.
 * Built once from configuration and passed to whoever needs the admin check.
 *
 * @author Vape Shop Team
 */
public class AdminAllowList {

    private final Set<Long> adminIds;

    public AdminAllowList(Collection<Long> adminIds) {
        this.adminIds = Collections.unmodifiableSet(new LinkedHashSet<>(adminIds));
    }

    /**
     * Parse a comma-separated id list such as {@code "1001, 1002"}. Blank entries are ignored.
     *
     * @param commaSeparatedIds Raw configuration value
     * @return Allow-list with the parsed ids
     * @throws IllegalArgumentException if an entry is not a number
     */
    public static AdminAllowList parse(String commaSeparatedIds) {
        Set<Long> ids = new LinkedHashSet<>();
        if (commaSeparatedIds != null) {
            for (String part : commaSeparatedIds.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    try {
                        ids.add(Long.parseLong(trimmed));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid admin id: " + trimmed, e);
                    }
                }
            }
        }
        return new AdminAllowList(ids);
    }

    public boolean isAdmin(Long userId) {
        return userId != null && adminIds.contains(userId);
    }

    public Set<Long> getAdminIds() {
        return adminIds;
    }
}
