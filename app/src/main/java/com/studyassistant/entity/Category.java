package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Task category, named per user.
 *
 * Names are unique per owner. Deleting a category moves its tasks to
 * "Uncategorized" (tasks.category_id = NULL).
 *
 * Database Table: categories
 */
@Entity
@Table(name = "categories", uniqueConstraints = {
    @UniqueConstraint(name = "uq_category_owner_name", columnNames = {"owner_user_id", "name"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    /** Label shown for tasks whose category is NULL. */
    public static final String UNCATEGORIZED = "Uncategorized";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "name", nullable = false)
    private String name;

    public Category(Long ownerId, String name) {
        this.ownerId = ownerId;
        this.name = name;
    }
}
