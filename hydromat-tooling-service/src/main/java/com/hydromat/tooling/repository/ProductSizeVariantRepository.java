package com.hydromat.tooling.repository;

import com.hydromat.tooling.model.ProductSizeVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductSizeVariantRepository extends JpaRepository<ProductSizeVariant, Long> {

    List<ProductSizeVariant> findByProfileIdOrderByIdAsc(Long profileId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ProductSizeVariant v where v.profileId = :profileId")
    int deleteAllForProfile(@Param("profileId") Long profileId);
}
