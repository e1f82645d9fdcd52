package com.hydromat.tooling.repository;

import com.hydromat.tooling.model.ToolAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ToolAssignmentRepository extends JpaRepository<ToolAssignment, Long> {

    /**
     * Loads a profile's head assignments ordered by head.
     */
    List<ToolAssignment> findByProfileIdOrderByHeadNumberAsc(Long profileId);

    Optional<ToolAssignment> findByProfileIdAndHeadNumber(Long profileId, Integer headNumber);

    List<ToolAssignment> findByProfileIdAndToolIdOrderByHeadNumberAsc(Long profileId, Long toolId);

    long countByProfileIdAndHeadNumber(Long profileId, Integer headNumber);

    boolean existsByToolId(Long toolId);

    /**
     * Deletes the assignment of one head. Runs immediately so a following insert
     * for the same head does not collide with the unique key.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ToolAssignment a where a.profileId = :profileId and a.headNumber = :headNumber")
    int deleteHead(@Param("profileId") Long profileId, @Param("headNumber") Integer headNumber);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ToolAssignment a where a.profileId = :profileId")
    int deleteAllForProfile(@Param("profileId") Long profileId);
}
