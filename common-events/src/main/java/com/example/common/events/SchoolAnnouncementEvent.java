package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * School Announcement Event
 *
 * Published by: the communication service when a school admin posts an announcement
 * Consumed by:
 * - School Identity Service: broadcasts it to the school room
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchoolAnnouncementEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String announcementId;

    private String schoolId;

    private String title;

    private String message;

    private String publishedBy;

    private String eventId;

    private Instant eventTimestamp;
}
