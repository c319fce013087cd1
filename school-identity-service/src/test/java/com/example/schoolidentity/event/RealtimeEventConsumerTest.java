package com.example.schoolidentity.event;

import com.example.common.events.AssignmentPublishedEvent;
import com.example.common.events.SchoolAnnouncementEvent;
import com.example.schoolidentity.realtime.MailboxRouter;
import com.example.schoolidentity.realtime.RealtimeEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RealtimeEventConsumerTest {

    @Mock
    private MailboxRouter mailboxRouter;

    @InjectMocks
    private RealtimeEventConsumer consumer;

    @Test
    void assignmentIsDeliveredToEveryListedLearner() {
        AssignmentPublishedEvent event = AssignmentPublishedEvent.builder()
                .assignmentId("a-1")
                .schoolId("school-1")
                .classId("class-3")
                .title("Fractions worksheet")
                .dueDate(Instant.parse("2024-09-10T00:00:00Z"))
                .studentIds(List.of("s-1", "s-2"))
                .build();

        consumer.handleAssignmentPublished(event);

        ArgumentCaptor<RealtimeEvent> captor = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(mailboxRouter).deliver(captor.capture(), eq(List.of("s-1", "s-2")));
        RealtimeEvent pushed = captor.getValue();
        assertEquals("assignment_published", pushed.type());
        assertEquals("a-1", pushed.payload().get("assignmentId"));
        assertEquals("2024-09-10T00:00:00Z", pushed.payload().get("dueDate"));
    }

    @Test
    void assignmentWithoutLearnersIsDropped() {
        consumer.handleAssignmentPublished(AssignmentPublishedEvent.builder().assignmentId("a-2").build());

        verifyNoInteractions(mailboxRouter);
    }

    @Test
    void announcementGoesToTheSchoolRoom() {
        SchoolAnnouncementEvent event = SchoolAnnouncementEvent.builder()
                .announcementId("n-1")
                .schoolId("school-1")
                .title("Closed Friday")
                .message("Staff training day")
                .build();

        consumer.handleSchoolAnnouncement(event);

        verify(mailboxRouter).deliverToSchool(any(RealtimeEvent.class), eq("school-1"));
    }

    @Test
    void announcementWithoutSchoolIsSkipped() {
        consumer.handleSchoolAnnouncement(SchoolAnnouncementEvent.builder().announcementId("n-2").build());

        verify(mailboxRouter, never()).deliverToSchool(any(), any());
    }
}
