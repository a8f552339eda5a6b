package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.PriceType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 공개 과목과 무료 과목은 멤버십 동기화 대상에서 제외한다.
 */
@Component
public class CourseEligibilityFilter {

    public boolean isMembershipGated(CatalogCourse course) {
        return !course.publicCourse() && course.priceType() != PriceType.FREE;
    }

    public Map<Long, CatalogCourse> filter(Map<Long, CatalogCourse> courses) {
        Map<Long, CatalogCourse> gated = new LinkedHashMap<>();
        courses.forEach((courseId, course) -> {
            if (isMembershipGated(course)) {
                gated.put(courseId, course);
            }
        });
        return gated;
    }
}
