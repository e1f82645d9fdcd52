package com.hydromat.tooling.repository;

import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.model.ToolPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ToolRepository extends JpaRepository<Tool, Long> {

    /**
     * Finds a tool by its 6-digit code.
     */
    Optional<Tool> findByCode(String code);

    boolean existsByCode(String code);

    Optional<Tool> findFirstByTemplateIdOrderByIdAsc(String templateId);

    /**
     * Lists a profile's tools in code order (position, type, set).
     */
    List<Tool> findByProfileIdOrderByCodeAsc(Long profileId);

    List<Tool> findByProfileIdAndPositionOrderByCodeAsc(Long profileId, ToolPosition position);

    /**
     * Loads the members of one tool set in creation order; the first row owns the set photo.
     */
    List<Tool> findByProfileIdAndCodeStartingWithOrderByIdAsc(Long profileId, String setPrefix);

    /**
     * Removes every tool of a profile.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Tool t where t.profileId = :profileId")
    int deleteAllForProfile(@Param("profileId") Long profileId);
}
