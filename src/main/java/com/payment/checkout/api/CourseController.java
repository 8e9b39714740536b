package com.payment.checkout.api;

import com.payment.checkout.persistence.entity.CourseEntity;
import com.payment.checkout.persistence.service.CourseCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only list of active courses for the checkout page.
 */
@Slf4j
@RestController
@RequestMapping("/api/courses")
@Tag(name = "Courses", description = "Active course catalog")
public class CourseController {

    static final String CACHE_CONTROL = "public, max-age=60, s-maxage=300, stale-while-revalidate=600";

    private final CourseCatalogService courseCatalogService;
    private final RateLimitGuard rateLimitGuard;
    private final long windowMs;
    private final int maxRequests;

    public CourseController(CourseCatalogService courseCatalogService,
                            RateLimitGuard rateLimitGuard,
                            @Value("${payment.rate-limit.courses.window-ms:60000}") long windowMs,
                            @Value("${payment.rate-limit.courses.max:120}") int maxRequests) {
        this.courseCatalogService = courseCatalogService;
        this.rateLimitGuard = rateLimitGuard;
        this.windowMs = windowMs;
        this.maxRequests = maxRequests;
    }

    @GetMapping
    @Operation(summary = "List courses", description = "Active courses ordered by name.")
    public Map<String, Object> list(HttpServletRequest request, HttpServletResponse response) {
        response.setHeader(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL);
        rateLimitGuard.enforce("courses", windowMs, maxRequests, request, response);

        List<CourseEntity> courses;
        try {
            courses = courseCatalogService.listActive();
        } catch (RuntimeException e) {
            log.error("courses_fetch_failed: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.COURSES_FETCH_FAILED, e);
        }
        return Map.of("courses", courses.stream().map(CourseController::toView).collect(Collectors.toList()));
    }

    private static Map<String, Object> toView(CourseEntity course) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", course.getId());
        view.put("slug", course.getSlug());
        view.put("name", course.getName());
        view.put("price_cents", course.getPriceCents());
        view.put("active", course.isActive());
        view.put("track", course.getTrack());
        view.put("area", course.getArea());
        view.put("workload_hours", course.getWorkloadHours());
        view.put("modality", course.getModality());
        view.put("duration_months_min", course.getDurationMonthsMin());
        view.put("duration_months_max", course.getDurationMonthsMax());
        view.put("tcc_required", course.getTccRequired());
        return view;
    }
}
