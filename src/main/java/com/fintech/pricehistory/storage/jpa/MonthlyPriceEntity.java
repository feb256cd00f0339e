package com.fintech.pricehistory.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Monthly close averages per (isin, year-month).
 */
@Entity
@Table(
    name = "monthly_prices",
    indexes = {
        @Index(name = "idx_monthly_prices_isin_month", columnList = "isin, year_month DESC")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_monthly_price", columnNames = {"isin", "year_month"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyPriceEntity {

    /**
     * Composite key: isin_yyyy-MM
     */
    @Id
    @Column(length = 60)
    private String id;

    @Column(nullable = false, length = 40)
    private String isin;

    /**
     * Bucket as "YYYY-MM"
     */
    @Column(name = "year_month", nullable = false, length = 7)
    private String yearMonth;

    @Column(name = "avg_close", nullable = false)
    private Double avgClose;

    @Column(name = "avg_adj_close", nullable = false)
    private Double avgAdjClose;

    @Column(nullable = false, length = 20)
    private String source;

    /**
     * Unix epoch milliseconds
     */
    @Column(name = "created_at", nullable = false)
    private Long createdAt;

    public static String generateId(String isin, String yearMonth) {
        return isin + "_" + yearMonth;
    }
}
