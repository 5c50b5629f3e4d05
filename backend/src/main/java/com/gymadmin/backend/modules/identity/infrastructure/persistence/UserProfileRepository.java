package com.gymadmin.backend.modules.identity.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.gymadmin.backend.modules.identity.domain.UserProfile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    Optional<UserProfile> findByAuthUserId(UUID authUserId);
}
