package com.fintech.pricehistory.storage.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MonthlyPriceJpaRepository extends JpaRepository<MonthlyPriceEntity, String> {

    /**
     * Newest month first. Pass {@link Pageable#unpaged()} for every row.
     */
    List<MonthlyPriceEntity> findByIsinOrderByYearMonthDesc(String isin, Pageable pageable);

    boolean existsByIsin(String isin);

    @Modifying
    @Query("DELETE FROM MonthlyPriceEntity m WHERE m.isin = :isin")
    int deleteByIsin(@Param("isin") String isin);
}
