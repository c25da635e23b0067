package com.studyassistant.repository;

import com.studyassistant.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for the persistent chat history.
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * Newest messages first; callers reverse for display.
     *
     * @param ownerId the owner's user id
     * @param pageable limit of messages
     * @return the most recent messages, newest first
     */
    List<ChatMessage> findByOwnerIdOrderByIdDesc(Long ownerId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM ChatMessage m WHERE m.ownerId = :ownerId")
    int deleteByOwner(@Param("ownerId") Long ownerId);
}
