package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Assignment Published Event
 *
 * Published by: the academics service when a teacher publishes an assignment
 * Consumed by:
 * - School Identity Service: pushes it to each learner's mailbox and to their guardians
 *
 * studentIds is the resolved audience; the consumer does not expand classes itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentPublishedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String assignmentId;

    private String schoolId;

    private String classId;

    private String title;

    private Instant dueDate;

    /**
     * Learners the assignment was published to
     */
    private List<String> studentIds;

    /**
     * Staff id of the publishing teacher
     */
    private String publishedBy;

    /**
     * Event ID (UUID) for deduplication
     */
    private String eventId;

    private Instant eventTimestamp;
}
