package dev.hypecheck.repository;

import dev.hypecheck.entity.Story;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for submitted stories.
 */
@Repository
public interface StoryRepository extends JpaRepository<Story, String> {

    /**
     * Ids of stories that still hold heuristic scores only, oldest first.
     */
    @Query("SELECT s.id FROM Story s WHERE s.enhanced = false ORDER BY s.createdAt ASC")
    List<String> findIdsAwaitingEnhancement(Pageable pageable);

    long countByEnhancedTrue();

    long countByEnhancedFalse();
}
