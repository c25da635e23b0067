package com.studyassistant.repository;

import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for AIContent entity.
 *
 * Backs the Review Hub: newest-first listings, optionally narrowed to one
 * content kind.
 */
@Repository
public interface AIContentRepository extends JpaRepository<AIContent, Long> {

    /**
     * Find archived content by id, only if it belongs to the given owner.
     *
     * @param id the content id
     * @param ownerId the owner's user id
     * @return Optional containing the content if found for this owner
     */
    Optional<AIContent> findByIdAndOwnerId(Long id, Long ownerId);

    List<AIContent> findByOwnerIdOrderByCreatedAtDescIdDesc(Long ownerId);

    List<AIContent> findByOwnerIdAndKindOrderByCreatedAtDescIdDesc(Long ownerId, ContentKind kind);
}
