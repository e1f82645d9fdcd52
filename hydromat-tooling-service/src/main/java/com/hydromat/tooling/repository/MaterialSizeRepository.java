package com.hydromat.tooling.repository;

import com.hydromat.tooling.model.MaterialSize;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MaterialSizeRepository extends JpaRepository<MaterialSize, Long> {

    /**
     * Finds a catalog entry by exact dimensions.
     */
    Optional<MaterialSize> findByWidthAndThickness(Double width, Double thickness);

    List<MaterialSize> findAllByOrderByWidthAscThicknessAsc();
}
