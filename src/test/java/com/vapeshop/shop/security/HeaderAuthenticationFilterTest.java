package com.vapeshop.shop.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HeaderAuthenticationFilter.
 */
@DisplayName("HeaderAuthenticationFilter Unit Tests")
class HeaderAuthenticationFilterTest {

    private final HeaderAuthenticationFilter filter = new HeaderAuthenticationFilter(new AdminAllowList(Set.of(1L)));

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Authentication filterWithHeader(String header) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/orders");
        if (header != null) {
            request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, header);
        }
        FilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return SecurityContextHolder.getContext().getAuthentication();
    }

    @Test
    @DisplayName("Regular user id: Should authenticate with ROLE_USER only")
    void regularUser() throws Exception {
        // When
        Authentication authentication = filterWithHeader("42");

        // Then
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo("42");
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly(SecurityUtils.ROLE_USER);
    }

    @Test
    @DisplayName("Allow-listed id: Should add ROLE_ADMIN")
    void adminUser() throws Exception {
        // When
        Authentication authentication = filterWithHeader(" 1 ");

        // Then
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder(SecurityUtils.ROLE_USER, SecurityUtils.ROLE_ADMIN);
    }

    @Test
    @DisplayName("Missing or malformed header: Should leave the request unauthenticated")
    void noUsableHeader() throws Exception {
        assertThat(filterWithHeader(null)).isNull();
        assertThat(filterWithHeader("")).isNull();
        assertThat(filterWithHeader("admin")).isNull();
    }
}
