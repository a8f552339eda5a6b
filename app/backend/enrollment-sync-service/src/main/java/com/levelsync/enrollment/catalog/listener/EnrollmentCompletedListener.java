package com.levelsync.enrollment.catalog.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.levelsync.enrollment.reconcile.service.AttributionTagger;
import com.levelsync.shared.dto.sqs.EnrollmentCompletedEvent;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Course Catalog 수강 등록 완료 이벤트 리스너
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrollmentCompletedListener {

    private final AttributionTagger attributionTagger;
    private final ObjectMapper objectMapper;

    @SqsListener(value = "${sqs.catalog-enrollment-queue}")
    public void receiveEnrollmentCompleted(String messageBody) {
        EnrollmentCompletedEvent event;
        try {
            event = objectMapper.readValue(messageBody, EnrollmentCompletedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse enrollment-completed event: {}", messageBody, e);
            return;
        }
        if (event == null) {
            log.warn("Ignoring empty enrollment-completed event: {}", messageBody);
            return;
        }

        log.debug("Received enrollment-completed: userId={}, courseId={}, enrollmentId={}",
                event.getUserId(), event.getCourseId(), event.getEnrollmentId());
        attributionTagger.onEnrollmentCompleted(event.getUserId(), event.getCourseId());
    }
}
