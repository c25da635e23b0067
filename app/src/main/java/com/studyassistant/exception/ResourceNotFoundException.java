package com.studyassistant.exception;

/**
 * Exception thrown when a referenced entity does not exist for the current owner.
 *
 * Lookups are always owner-scoped, so another user's row is reported exactly
 * like a missing one. Treated as a programmer/data error: logged and shown
 * with a generic message.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final Object resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(String.format("%s '%s' was not found.", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Object getResourceId() {
        return resourceId;
    }

    public static ResourceNotFoundException task(Long id) {
        return new ResourceNotFoundException("Task", id);
    }

    public static ResourceNotFoundException category(Object idOrName) {
        return new ResourceNotFoundException("Category", idOrName);
    }

    public static ResourceNotFoundException studyLog(Long id) {
        return new ResourceNotFoundException("Study log", id);
    }

    public static ResourceNotFoundException quizResult(Long id) {
        return new ResourceNotFoundException("Quiz result", id);
    }

    public static ResourceNotFoundException content(Long id) {
        return new ResourceNotFoundException("Saved content", id);
    }

    public static ResourceNotFoundException user(Long id) {
        return new ResourceNotFoundException("User", id);
    }
}
