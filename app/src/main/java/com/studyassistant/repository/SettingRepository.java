package com.studyassistant.repository;

import com.studyassistant.entity.Setting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for per-user settings.
 */
@Repository
public interface SettingRepository extends JpaRepository<Setting, Setting.SettingId> {

    Optional<Setting> findByOwnerIdAndKey(Long ownerId, String key);
}
