package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.Product;
import com.vapeshop.shop.exception.ResourceNotFoundException;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Catalog management on top of {@link ProductRepository}.
 *
 * @author Vape Shop Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public List<Product> listProducts() {
        return productRepository.list();
    }

    /**
     * @param id Product id
     * @return The product
     * @throws ResourceNotFoundException if there is no such product
     */
    public Product getProduct(long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", id));
    }

    /**
     * Create a product under a freshly allocated id. Any id in the input is ignored.
     *
     * @param product Product data with name, category, price and stock
     * @return Created product
     * @throws ValidationException if a required field is missing or negative
     */
    public Product createProduct(Product product) {
        requireText("name", product.getName());
        requireText("category", product.getCategory());
        requireNonNegative("price", product.getPrice(), true);
        requireNonNegative("stock", product.getStock(), true);

        product.setId(null);
        product.setCreatedAt(null);
        Product created = productRepository.save(product);
        logger.info("Created product {} in category {}", created.getId(), created.getCategory());
        return created;
    }

    /**
     * Update the given fields of an existing product. Fields left null keep their values.
     *
     * @param id Product id
     * @param changes Fields to change
     * @return Product as stored after the update
     * @throws ResourceNotFoundException if there is no such product
     * @throws ValidationException if a given name or category is blank, or price or stock is negative
     */
    public Product updateProduct(long id, Product changes) {
        getProduct(id);
        if (changes.getName() != null) {
            requireText("name", changes.getName());
        }
        if (changes.getCategory() != null) {
            requireText("category", changes.getCategory());
        }
        requireNonNegative("price", changes.getPrice(), false);
        requireNonNegative("stock", changes.getStock(), false);

        changes.setId(id);
        changes.setCreatedAt(null);
        productRepository.save(changes);
        return getProduct(id);
    }

    /**
     * @param id Product id
     * @throws ResourceNotFoundException if there is no such product
     */
    public void deleteProduct(long id) {
        if (!productRepository.delete(id)) {
            throw new ResourceNotFoundException("Product", id);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "Field '" + field + "' is required");
        }
    }

    private static void requireNonNegative(String field, Integer value, boolean required) {
        if (value == null) {
            if (required) {
                throw new ValidationException(field, "Field '" + field + "' is required");
            }
            return;
        }
        if (value < 0) {
            throw new ValidationException(field, "Field '" + field + "' must not be negative");
        }
    }
}
