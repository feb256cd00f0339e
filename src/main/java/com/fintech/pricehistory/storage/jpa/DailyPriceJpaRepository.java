package com.fintech.pricehistory.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DailyPriceJpaRepository extends JpaRepository<DailyPriceEntity, String> {

    List<DailyPriceEntity> findByIsinOrderByTradeDateAsc(String isin);

    long countByIsin(String isin);

    @Modifying
    @Query("DELETE FROM DailyPriceEntity d WHERE d.isin = :isin")
    int deleteByIsin(@Param("isin") String isin);
}
