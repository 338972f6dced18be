package com.vapeshop.shop.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates requests from the {@code X-User-Id} header.
 *
 * The messaging front end sets the header after identifying the user, so its value
 * is trusted as the caller's identity. Roles are never taken from the request:
 * every caller gets ROLE_USER, and callers in the {@link AdminAllowList} also get
 * ROLE_ADMIN. A missing or non-numeric header leaves the request unauthenticated.
 *
 * @author Vape Shop Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";

    private final AdminAllowList adminAllowList;

    public HeaderAuthenticationFilter(AdminAllowList adminAllowList) {
        this.adminAllowList = adminAllowList;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        Long userId = parseUserId(request.getHeader(USER_ID_HEADER));

        if (userId != null) {
            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority(SecurityUtils.ROLE_USER));
            if (adminAllowList.isAdmin(userId)) {
                authorities.add(new SimpleGrantedAuthority(SecurityUtils.ROLE_ADMIN));
            }

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(userId.toString(), null, authorities);
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with authorities: {}", userId, authorities);
        } else {
            logger.debug("No usable {} header, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }

    private static Long parseUserId(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed {} header: {}", USER_ID_HEADER, header);
            return null;
        }
    }
}
