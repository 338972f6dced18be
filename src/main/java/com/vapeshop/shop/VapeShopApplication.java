package com.vapeshop.shop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for the vape shop backend.
 *
 * Architecture:
 * - API Layer: REST controllers under /api, caller identity from the X-User-Id header
 * - Service Layer: validation, referral bonuses, broadcasts
 * - Repository Layer: typed entities mapped onto Redis hashes through record codecs
 * - Infrastructure Layer: Redis key-value store client (Lettuce, pooled)
 *
 * @author Vape Shop Team
 */
@SpringBootApplication
public class VapeShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(VapeShopApplication.class, args);
    }
}
