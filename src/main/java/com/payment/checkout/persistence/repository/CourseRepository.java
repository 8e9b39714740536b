package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.CourseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for catalog courses.
 */
@Repository
public interface CourseRepository extends JpaRepository<CourseEntity, UUID> {

    Optional<CourseEntity> findByIdAndSlug(UUID id, String slug);

    List<CourseEntity> findByActiveTrueOrderByNameAsc();
}
