package com.vapeshop.shop.config;

import com.vapeshop.shop.security.AdminAllowList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shop-level settings.
 *
 * @author Vape Shop Team
 */
@Configuration
public class ShopConfig {

    private static final Logger logger = LoggerFactory.getLogger(ShopConfig.class);

    @Value("${vapeshop.admin-ids:}")
    private String adminIds;

    @Bean
    public AdminAllowList adminAllowList() {
        AdminAllowList allowList = AdminAllowList.parse(adminIds);
        logger.info("Admin allow-list contains {} ids", allowList.getAdminIds().size());
        return allowList;
    }
}
