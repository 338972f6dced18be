package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.exception.GlobalExceptionHandler;
import com.vapeshop.shop.config.SecurityConfig;
import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.service.UserService;
import com.vapeshop.shop.testutil.ControllerTestConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for UserController using MockMvc.
 */
@WebMvcTest(UserController.class)
@ContextConfiguration(classes = {UserController.class, GlobalExceptionHandler.class, SecurityConfig.class, ControllerTestConfig.class})
@DisplayName("UserController Tests")
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserService userService;

    private static User user(long id) {
        return User.builder().id(id).username("vaper").referralCode("REF" + id).isAdmin(false).build();
    }

    @Test
    @DisplayName("GET /api/users/{id} - Own profile: Should return it with the admin flag")
    void getUser_Owner() throws Exception {
        // Given
        when(userService.getOrCreate(42L, "vaper")).thenReturn(user(42L));

        // When / Then
        mockMvc.perform(get("/api/users/{id}", 42).param("username", "vaper").header("X-User-Id", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.referralCode").value("REF42"))
                .andExpect(jsonPath("$.bonus").value(0))
                .andExpect(jsonPath("$.isAdmin").value(false));
    }

    @Test
    @DisplayName("GET /api/users/{id} - Another user's profile: Should return 403")
    void getUser_OtherUser() throws Exception {
        mockMvc.perform(get("/api/users/{id}", 42).header("X-User-Id", "7"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(userService);
    }

    @Test
    @DisplayName("PUT /api/users/{id} - Owner changes own bonus: Should return 403")
    void updateUser_BonusByOwner() throws Exception {
        mockMvc.perform(put("/api/users/{id}", 42)
                        .header("X-User-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bonus\":1000}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(userService);
    }

    @Test
    @DisplayName("PUT /api/users/{id} - Admin sets bonus: Should update")
    void updateUser_BonusByAdmin() throws Exception {
        // Given
        User updated = user(42L);
        updated.setBonus(300);
        when(userService.updateUser(42L, null, 300)).thenReturn(updated);

        // When / Then
        mockMvc.perform(put("/api/users/{id}", 42)
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bonus\":300}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bonus").value(300));
    }

    @Test
    @DisplayName("POST /api/users/{id}/referral - Self-referral: Should return 400")
    void applyReferral_SelfReferral() throws Exception {
        // Given
        when(userService.applyReferral(eq(42L), anyString()))
                .thenThrow(new ValidationException("referralCode", "Cannot use your own referral code"));

        // When / Then
        mockMvc.perform(post("/api/users/{id}/referral", 42)
                        .header("X-User-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"referralCode\":\"REF42\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("referralCode"));
    }
}
