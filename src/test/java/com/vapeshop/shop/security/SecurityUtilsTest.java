package com.vapeshop.shop.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SecurityUtils.
 */
@DisplayName("SecurityUtils Unit Tests")
class SecurityUtilsTest {

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private static void authenticate(String userId, String... roles) {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                userId, null, AuthorityUtils.createAuthorityList(roles)));
    }

    // ========================================
    // getCurrentUserId Tests
    // ========================================

    @Test
    @DisplayName("getCurrentUserId - Authenticated caller: Should return the numeric id")
    void getCurrentUserId_Authenticated() {
        authenticate("42", SecurityUtils.ROLE_USER);

        assertThat(SecurityUtils.getCurrentUserId()).isEqualTo(42L);
        assertThat(SecurityUtils.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("getCurrentUserId - Anonymous token: Should return null")
    void getCurrentUserId_Anonymous() {
        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

        assertThat(SecurityUtils.getCurrentUserId()).isNull();
    }

    // ========================================
    // verifyUserAccess Tests
    // ========================================

    @Test
    @DisplayName("verifyUserAccess - Owner: Should pass")
    void verifyUserAccess_Owner() {
        authenticate("42", SecurityUtils.ROLE_USER);

        assertThatCode(() -> SecurityUtils.verifyUserAccess(42L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("verifyUserAccess - Another user: Should throw AccessDeniedException")
    void verifyUserAccess_OtherUser() {
        authenticate("7", SecurityUtils.ROLE_USER);

        assertThatThrownBy(() -> SecurityUtils.verifyUserAccess(42L))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("user 7")
                .hasMessageContaining("user 42");
    }

    @Test
    @DisplayName("verifyUserAccess - Admin: Should pass for any owner")
    void verifyUserAccess_Admin() {
        authenticate("1", SecurityUtils.ROLE_USER, SecurityUtils.ROLE_ADMIN);

        assertThatCode(() -> SecurityUtils.verifyUserAccess(42L)).doesNotThrowAnyException();
        assertThatCode(SecurityUtils::verifyAdminAccess).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("verifyUserAccess - No authentication: Should throw AccessDeniedException")
    void verifyUserAccess_Unauthenticated() {
        assertThatThrownBy(() -> SecurityUtils.verifyUserAccess(42L))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage("User not authenticated");
    }

    @Test
    @DisplayName("verifyAdminAccess - Regular user: Should throw AccessDeniedException")
    void verifyAdminAccess_NonAdmin() {
        authenticate("42", SecurityUtils.ROLE_USER);

        assertThatThrownBy(SecurityUtils::verifyAdminAccess)
                .isInstanceOf(AccessDeniedException.class);
    }
}
