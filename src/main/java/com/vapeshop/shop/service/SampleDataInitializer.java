package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Product;
import com.vapeshop.shop.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the catalog with a few sample products on startup when it is empty.
 *
 * @author Vape Shop Team
 */
@Component
@ConditionalOnProperty(name = "vapeshop.sample-data.enabled", havingValue = "true")
public class SampleDataInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataInitializer.class);

    private final ProductRepository productRepository;

    public SampleDataInitializer(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!productRepository.list().isEmpty()) {
            logger.debug("Catalog already populated, skipping sample data");
            return;
        }
        List<Product> samples = sampleProducts();
        samples.forEach(productRepository::save);
        logger.info("Seeded catalog with {} sample products", samples.size());
    }

    static List<Product> sampleProducts() {
        return List.of(
                product("Mango liquid", "liquids", 450, 10, "Juicy mango flavour", "🥭"),
                product("JUUL cartridge", "cartridges", 300, 20, "Original cartridges", "💨"),
                product("RELX Mint pod", "pods", 280, 12, "Fresh mint flavour", "🔥"),
                product("Vaporesso XROS 3", "devices", 2800, 5, "Compact pod system", "⚡")
        );
    }

    private static Product product(String name, String category, int price, int stock,
                                   String description, String emoji) {
        return Product.builder()
                .name(name)
                .category(category)
                .price(price)
                .stock(stock)
                .description(description)
                .emoji(emoji)
                .build();
    }
}
