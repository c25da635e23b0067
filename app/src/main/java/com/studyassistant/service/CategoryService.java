package com.studyassistant.service;

import com.studyassistant.entity.Category;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.CategoryRepository;
import com.studyassistant.repository.TaskRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Task categories, owned per user and managed from Settings.
 *
 * Names are unique per user. Deleting a category does not delete its tasks:
 * they are moved to "Uncategorized" (category cleared) in the same
 * transaction as the delete.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CategoryService {

    static final List<String> DEFAULT_CATEGORIES =
            List.of("General", "Academic", "Personal", "Project", "Urgent");
    private static final int NAME_MAX_LENGTH = 50;

    private final CategoryRepository categoryRepository;
    private final TaskRepository taskRepository;

    @Transactional(readOnly = true)
    public List<Category> list(Session session) {
        return categoryRepository.findByOwnerIdOrderByNameAsc(session.getUserId());
    }

    /**
     * Look up one of the user's categories.
     *
     * @throws ResourceNotFoundException if it does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public Category get(Session session, Long categoryId) {
        return findOwned(session.getUserId(), categoryId);
    }

    @Transactional
    public Category create(Session session, String name) {
        String normalized = validateName(session.getUserId(), name);
        Category saved = categoryRepository.save(new Category(session.getUserId(), normalized));
        log.info("Created category '{}' (ID: {}) for user {}", normalized, saved.getId(), session.getUserId());
        return saved;
    }

    @Transactional
    public Category rename(Session session, Long categoryId, String newName) {
        Category category = findOwned(session.getUserId(), categoryId);
        String normalized = InputRules.requireText(newName, "category name", NAME_MAX_LENGTH);
        if (normalized.equals(category.getName())) {
            return category;
        }
        validateName(session.getUserId(), normalized);

        log.info("Renaming category {} from '{}' to '{}'", categoryId, category.getName(), normalized);
        category.setName(normalized);
        return categoryRepository.save(category);
    }

    /**
     * Delete a category and move its tasks to Uncategorized.
     *
     * @param session the active session
     * @param categoryId the category to delete
     * @return the number of tasks that were reassigned
     * @throws ResourceNotFoundException if the category is not the user's
     */
    @Transactional
    public int delete(Session session, Long categoryId) {
        Category category = findOwned(session.getUserId(), categoryId);
        int reassigned = taskRepository.clearCategory(category.getId(), session.getUserId());
        categoryRepository.delete(category);
        log.info("Deleted category '{}' (ID: {}), {} task(s) moved to {}",
                category.getName(), categoryId, reassigned, Category.UNCATEGORIZED);
        return reassigned;
    }

    /**
     * Create the starter categories for a freshly registered user.
     *
     * @param userId the new user's ID
     */
    @Transactional
    public void seedDefaults(Long userId) {
        for (String name : DEFAULT_CATEGORIES) {
            if (!categoryRepository.existsByOwnerIdAndName(userId, name)) {
                categoryRepository.save(new Category(userId, name));
            }
        }
        log.debug("Seeded {} default categories for user {}", DEFAULT_CATEGORIES.size(), userId);
    }

    Category findOwned(Long ownerId, Long categoryId) {
        if (categoryId == null) {
            throw ValidationException.blank("category");
        }
        return categoryRepository.findByIdAndOwnerId(categoryId, ownerId)
                .orElseThrow(() -> ResourceNotFoundException.category(categoryId));
    }

    private String validateName(Long ownerId, String name) {
        String normalized = InputRules.requireText(name, "category name", NAME_MAX_LENGTH);
        if (Category.UNCATEGORIZED.equalsIgnoreCase(normalized)) {
            throw new ValidationException("category name",
                    String.format("'%s' is reserved for tasks without a category.", Category.UNCATEGORIZED));
        }
        if (categoryRepository.existsByOwnerIdAndName(ownerId, normalized)) {
            throw new ValidationException("category name",
                    String.format("A category named '%s' already exists.", normalized));
        }
        return normalized;
    }
}
