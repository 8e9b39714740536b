package com.payment.checkout.persistence.service;

import com.payment.checkout.domain.CourseOffer;
import com.payment.checkout.persistence.entity.CourseEntity;
import com.payment.checkout.persistence.repository.CourseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the course catalog for pricing checkouts and listing courses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseCatalogService {

    private final CourseRepository courseRepository;

    /**
     * The course a lead enrolled in, matched by both id and slug so a tampered slug cannot reprice a checkout.
     */
    @Transactional(readOnly = true)
    public Optional<CourseOffer> findForCheckout(String courseId, String slug) {
        if (courseId == null || slug == null) return Optional.empty();
        UUID id;
        try {
            id = UUID.fromString(courseId);
        } catch (IllegalArgumentException e) {
            log.warn("Lead references a course id that is not a UUID: {}", courseId);
            return Optional.empty();
        }
        return courseRepository.findByIdAndSlug(id, slug).map(CourseCatalogService::toOffer);
    }

    @Transactional(readOnly = true)
    public List<CourseEntity> listActive() {
        return courseRepository.findByActiveTrueOrderByNameAsc();
    }

    static CourseOffer toOffer(CourseEntity entity) {
        return CourseOffer.builder()
                .id(entity.getId().toString())
                .slug(entity.getSlug())
                .name(entity.getName())
                .priceCents(entity.getPriceCents())
                .build();
    }
}
