package com.example.schoolidentity.event;

import com.example.common.events.AssignmentPublishedEvent;
import com.example.common.events.SchoolAnnouncementEvent;
import com.example.schoolidentity.realtime.MailboxRouter;
import com.example.schoolidentity.realtime.RealtimeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kafka consumer that turns domain events from other services into real-time pushes.
 */
@Component
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventConsumer {

    static final String ASSIGNMENT_PUBLISHED = "assignment_published";
    static final String SCHOOL_ANNOUNCEMENT = "school_announcement";

    private final MailboxRouter mailboxRouter;

    @KafkaListener(
        topics = "assignment.published",
        groupId = "${spring.kafka.consumer.group-id:school-identity-service}",
        containerFactory = "assignmentPublishedListenerContainerFactory"
    )
    public void handleAssignmentPublished(AssignmentPublishedEvent event) {
        List<String> studentIds = event.getStudentIds() == null ? List.of() : event.getStudentIds();
        log.info("Received assignment.published: assignmentId={}, learners={}", event.getAssignmentId(), studentIds.size());

        if (studentIds.isEmpty()) {
            return;
        }
        mailboxRouter.deliver(toRealtimeEvent(event), studentIds);
    }

    @KafkaListener(
        topics = "school.announcement",
        groupId = "${spring.kafka.consumer.group-id:school-identity-service}",
        containerFactory = "schoolAnnouncementListenerContainerFactory"
    )
    public void handleSchoolAnnouncement(SchoolAnnouncementEvent event) {
        log.info("Received school.announcement: announcementId={}, schoolId={}",
                event.getAnnouncementId(), event.getSchoolId());

        if (event.getSchoolId() == null) {
            log.warn("Announcement {} has no school, skipped", event.getAnnouncementId());
            return;
        }
        mailboxRouter.deliverToSchool(toRealtimeEvent(event), event.getSchoolId());
    }

    static RealtimeEvent toRealtimeEvent(AssignmentPublishedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assignmentId", event.getAssignmentId());
        payload.put("title", event.getTitle());
        payload.put("classId", event.getClassId());
        if (event.getDueDate() != null) {
            payload.put("dueDate", event.getDueDate().toString());
        }
        return new RealtimeEvent(ASSIGNMENT_PUBLISHED, payload);
    }

    static RealtimeEvent toRealtimeEvent(SchoolAnnouncementEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("announcementId", event.getAnnouncementId());
        payload.put("title", event.getTitle());
        payload.put("message", event.getMessage());
        return new RealtimeEvent(SCHOOL_ANNOUNCEMENT, payload);
    }
}
