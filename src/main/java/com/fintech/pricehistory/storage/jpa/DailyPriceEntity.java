package com.fintech.pricehistory.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw daily candle per (isin, trade date).
 */
@Entity
@Table(
    name = "daily_prices",
    indexes = {
        @Index(name = "idx_daily_prices_isin_date", columnList = "isin, trade_date")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_price", columnNames = {"isin", "trade_date"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyPriceEntity {

    /**
     * Composite key: isin_date, e.g. "US0378331005_2024-03-15"
     */
    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 40)
    private String isin;

    /**
     * Trading day as UTC midnight, Unix epoch seconds
     */
    @Column(name = "trade_date", nullable = false)
    private Long tradeDate;

    @Column(nullable = false)
    private Double open;

    @Column(nullable = false)
    private Double high;

    @Column(nullable = false)
    private Double low;

    @Column(nullable = false)
    private Double close;

    private Long volume;

    @Column(name = "adjusted_close")
    private Double adjustedClose;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = System.currentTimeMillis();
    }
}
