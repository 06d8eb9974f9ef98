package com.catalogsync.crawl.persistence;

import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.ProductView;
import com.catalogsync.crawl.model.VariantRecord;
import com.catalogsync.crawl.model.VariantView;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Products and their variants. Upserts are UPDATE-then-INSERT so the same SQL runs on PostgreSQL
 * and on H2; callers serialize writes, so the insert never races another writer.
 */
@Repository
public class CatalogJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long upsertProduct(ProductRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", record.url())
            .addValue("title", record.title())
            .addValue("price", record.price())
            .addValue("composition", record.composition())
            .addValue("skeinWeight", record.skeinWeight())
            .addValue("skeinLength", record.skeinLength())
            .addValue("packageWeight", record.packageWeight())
            .addValue("category", record.category())
            .addValue("imageUrl", record.imageUrl())
            .addValue("imagePath", record.imagePath())
            .addValue("lastUpdated", toTimestamp(record.lastUpdated() == null ? Instant.now() : record.lastUpdated()));

        int updated = jdbc.update(
            """
                UPDATE products
                SET title = :title,
                    price = :price,
                    composition = :composition,
                    skein_weight = :skeinWeight,
                    skein_length = :skeinLength,
                    package_weight = :packageWeight,
                    category = :category,
                    image_url = :imageUrl,
                    image_path = :imagePath,
                    last_updated = :lastUpdated,
                    is_complete = TRUE
                WHERE url = :url
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO products (
                        url, title, price, composition, skein_weight, skein_length, package_weight,
                        category, image_url, image_path, last_updated, is_complete
                    )
                    VALUES (
                        :url, :title, :price, :composition, :skeinWeight, :skeinLength, :packageWeight,
                        :category, :imageUrl, :imagePath, :lastUpdated, TRUE
                    )
                    """,
                params
            );
        }

        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM products
                WHERE url = :url
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to upsert product for url " + record.url());
        }
        return id;
    }

    public void upsertVariant(long productId, VariantRecord variant) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("articleNumber", nullToEmpty(variant.articleNumber()))
            .addValue("variantName", nullToEmpty(variant.variantName()))
            .addValue("available", variant.available())
            .addValue("imageUrl", variant.imageUrl())
            .addValue("imagePath", variant.imagePath())
            .addValue("lastUpdated", toTimestamp(variant.lastUpdated() == null ? Instant.now() : variant.lastUpdated()));

        int updated = jdbc.update(
            """
                UPDATE variants
                SET available = :available,
                    image_url = :imageUrl,
                    image_path = :imagePath,
                    last_updated = :lastUpdated,
                    is_complete = TRUE
                WHERE product_id = :productId
                  AND article_number = :articleNumber
                  AND variant_name = :variantName
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO variants (
                        product_id, article_number, variant_name, available, image_url, image_path,
                        last_updated, is_complete
                    )
                    VALUES (
                        :productId, :articleNumber, :variantName, :available, :imageUrl, :imagePath,
                        :lastUpdated, TRUE
                    )
                    """,
                params
            );
        }
    }

    /**
     * Deletes products still flagged incomplete; their variants go with them through the cascade.
     */
    public int deleteIncompleteProducts() {
        return jdbc.update(
            """
                DELETE FROM products
                WHERE is_complete = FALSE
                """,
            new MapSqlParameterSource()
        );
    }

    public List<ProductView> findProducts(String category) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("category", category);
        String where = category == null ? "" : "WHERE p.category = :category";
        List<ProductView> products = jdbc.query(
            """
                SELECT p.id, p.url, p.title, p.price, p.composition, p.skein_weight, p.skein_length,
                       p.package_weight, p.category, p.image_url, p.image_path, p.last_updated, p.is_complete
                FROM products p
                %s
                ORDER BY p.title, p.id
                """.formatted(where),
            params,
            productRowMapper()
        );
        if (products.isEmpty()) {
            return products;
        }

        Map<Long, List<VariantView>> variantsByProduct = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT v.id, v.product_id, v.article_number, v.variant_name, v.available, v.image_url,
                       v.image_path, v.last_updated, v.is_complete
                FROM variants v
                JOIN products p ON p.id = v.product_id
                %s
                ORDER BY v.product_id, v.article_number, v.variant_name
                """.formatted(where),
            params,
            rs -> {
                VariantView variant = new VariantView(
                    rs.getLong("id"),
                    rs.getLong("product_id"),
                    rs.getString("article_number"),
                    rs.getString("variant_name"),
                    rs.getBoolean("available"),
                    rs.getString("image_url"),
                    rs.getString("image_path"),
                    toInstant(rs.getTimestamp("last_updated")),
                    rs.getBoolean("is_complete")
                );
                variantsByProduct.computeIfAbsent(variant.productId(), ignored -> new ArrayList<>()).add(variant);
            }
        );

        List<ProductView> result = new ArrayList<>(products.size());
        for (ProductView product : products) {
            result.add(new ProductView(
                product.id(),
                product.url(),
                product.title(),
                product.price(),
                product.composition(),
                product.skeinWeight(),
                product.skeinLength(),
                product.packageWeight(),
                product.category(),
                product.imageUrl(),
                product.imagePath(),
                product.lastUpdated(),
                product.complete(),
                List.copyOf(variantsByProduct.getOrDefault(product.id(), List.of()))
            ));
        }
        return result;
    }

    public List<String> findCategories() {
        return jdbc.queryForList(
            """
                SELECT DISTINCT category
                FROM products
                WHERE category IS NOT NULL
                ORDER BY category
                """,
            new MapSqlParameterSource(),
            String.class
        );
    }

    public int countVariants(long productId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM variants
                WHERE product_id = :productId
                """,
            new MapSqlParameterSource().addValue("productId", productId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private RowMapper<ProductView> productRowMapper() {
        return (rs, rowNum) -> new ProductView(
            rs.getLong("id"),
            rs.getString("url"),
            rs.getString("title"),
            rs.getString("price"),
            rs.getString("composition"),
            rs.getString("skein_weight"),
            rs.getString("skein_length"),
            rs.getString("package_weight"),
            rs.getString("category"),
            rs.getString("image_url"),
            rs.getString("image_path"),
            toInstant(rs.getTimestamp("last_updated")),
            rs.getBoolean("is_complete"),
            List.of()
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
