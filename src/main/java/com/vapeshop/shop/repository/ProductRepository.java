package com.vapeshop.shop.repository;

import com.vapeshop.shop.domain.codec.ProductCodec;
import com.vapeshop.shop.domain.model.Product;
import com.vapeshop.shop.infrastructure.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Catalog products stored as {@code product:<id>} records.
 *
 * @author Vape Shop Team
 */
@Repository
public class ProductRepository extends KeyValueRepository<Product> {

    private static final Logger logger = LoggerFactory.getLogger(ProductRepository.class);

    public static final String ENTITY = "product";

    private final IdAllocator idAllocator;

    public ProductRepository(KeyValueStore store, ProductCodec codec, IdAllocator idAllocator) {
        super(store, codec, ENTITY);
        this.idAllocator = idAllocator;
    }

    /**
     * List all products.
     *
     * @return Products sorted by id ascending
     */
    public List<Product> list() {
        List<Product> products = loadAll();
        products.sort(Comparator.comparing(Product::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        logger.debug("Loaded {} products", products.size());
        return products;
    }

    public Optional<Product> findById(long id) {
        return load(keyFor(id));
    }

    /**
     * Create or update a product.
     *
     * Without an id a new one is allocated. With an id the record under that id is
     * updated: only non-null fields are written, and the stored creation time is kept
     * unless the caller supplies one.
     *
     * @param product Product data; mutated with id and timestamps
     * @return The same product with id and timestamps populated
     */
    public Product save(Product product) {
        Instant now = Instant.now();
        if (product.getId() == null) {
            product.setId(idAllocator.next(ENTITY));
        } else if (product.getCreatedAt() == null) {
            findById(product.getId()).map(Product::getCreatedAt).ifPresent(product::setCreatedAt);
        }
        if (product.getCreatedAt() == null) {
            product.setCreatedAt(now);
        }
        product.setUpdatedAt(now);

        store.setFields(keyFor(product.getId()), codec.encode(product));
        logger.info("Saved product {} ({})", product.getId(), product.getName());
        return product;
    }

    /**
     * Delete a product. Its id is not reused.
     *
     * @param id Product id
     * @return true if the product existed
     */
    public boolean delete(long id) {
        boolean existed = store.deleteKey(keyFor(id));
        if (existed) {
            logger.info("Deleted product {}", id);
        } else {
            logger.debug("Product {} not found for delete", id);
        }
        return existed;
    }
}
