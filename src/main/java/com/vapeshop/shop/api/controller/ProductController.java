package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.api.dto.ProductRequest;
import com.vapeshop.shop.domain.model.Product;
import com.vapeshop.shop.security.SecurityUtils;
import com.vapeshop.shop.service.ProductService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the product catalog.
 * Reads are public; changes are admin only.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * @return All products, ascending by id
     */
    @GetMapping
    public ResponseEntity<List<Product>> listProducts() {
        List<Product> products = productService.listProducts();
        logger.debug("Returning {} products", products.size());
        return ResponseEntity.ok(products);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Product> getProduct(@PathVariable long id) {
        return ResponseEntity.ok(productService.getProduct(id));
    }

    /**
     * Create a product (admin).
     *
     * @param request Product fields
     * @return Created product with its allocated id
     */
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Product> createProduct(@Valid @RequestBody ProductRequest request) {
        Product product = productService.createProduct(request.toProduct());
        return ResponseEntity.status(HttpStatus.CREATED).body(product);
    }

    /**
     * Update a product (admin). Only the fields present in the body change.
     */
    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Product> updateProduct(
            @PathVariable long id,
            @RequestBody ProductRequest request
    ) {
        logger.info("Admin {} updating product {}", SecurityUtils.getCurrentUserId(), id);
        return ResponseEntity.ok(productService.updateProduct(id, request.toProduct()));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteProduct(@PathVariable long id) {
        productService.deleteProduct(id);
        logger.info("Admin {} deleted product {}", SecurityUtils.getCurrentUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
