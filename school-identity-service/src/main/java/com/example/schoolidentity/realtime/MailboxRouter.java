package com.example.schoolidentity.realtime;

import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.repository.GuardianRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Addressing on the real-time bus.
 *
 * Each principal has a mailbox "user_&lt;id&gt;". School admins and parents also join
 * "school_&lt;schoolId&gt;"; students with a class join "class_&lt;classId&gt;".
 * Delivery is fire-and-forget: nothing is queued for principals that are offline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailboxRouter {

    private static final String USER_PREFIX = "user_";
    private static final String SCHOOL_PREFIX = "school_";
    private static final String CLASS_PREFIX = "class_";

    private final ConnectionRegistry connectionRegistry;
    private final GuardianRepository guardianRepository;
    private final ObjectMapper objectMapper;

    public static String addressOf(String principalId) {
        return USER_PREFIX + principalId;
    }

    public static String schoolAddress(String schoolId) {
        return SCHOOL_PREFIX + schoolId;
    }

    public static String classAddress(String classId) {
        return CLASS_PREFIX + classId;
    }

    /**
     * Addresses a new connection joins.
     */
    public List<String> subscriptionsFor(RealtimeIdentity identity) {
        List<String> addresses = new ArrayList<>();
        addresses.add(addressOf(identity.principalId()));

        boolean schoolScoped = identity.role() == Role.SCHOOL_ADMIN || identity.role() == Role.PARENT;
        if (schoolScoped && identity.tenantId() != null) {
            addresses.add(schoolAddress(identity.tenantId()));
        }
        if (identity.role() == Role.STUDENT && identity.classId() != null) {
            addresses.add(classAddress(identity.classId()));
        }
        return addresses;
    }

    /**
     * Deliver to each learner's mailbox and a guardian copy to every guardian linked
     * to that learner at this moment. A failed guardian lookup skips only that
     * learner's guardian copies.
     *
     * @return number of mailboxes addressed
     */
    public int deliver(RealtimeEvent event, Collection<String> learnerIds) {
        TextMessage learnerMessage = toMessage(event);
        int deliveries = 0;

        for (String learnerId : learnerIds) {
            connectionRegistry.send(addressOf(learnerId), learnerMessage);
            deliveries++;

            List<Guardian> guardians;
            try {
                guardians = guardianRepository.findAllLinkedTo(learnerId);
            } catch (DataAccessException e) {
                log.warn("Guardian lookup failed for learner {}, skipping guardian copies: {}", learnerId, e.getMessage());
                continue;
            }
            if (guardians.isEmpty()) {
                continue;
            }
            TextMessage guardianMessage = toMessage(event.forGuardian(learnerId));
            for (Guardian guardian : guardians) {
                connectionRegistry.send(addressOf(guardian.getId()), guardianMessage);
                deliveries++;
            }
        }

        log.debug("Event {} delivered to {} mailboxes for {} learners", event.type(), deliveries, learnerIds.size());
        return deliveries;
    }

    /**
     * @return number of sessions reached in the school room
     */
    public int deliverToSchool(RealtimeEvent event, String schoolId) {
        int reached = connectionRegistry.send(schoolAddress(schoolId), toMessage(event));
        log.debug("Event {} broadcast to school {} ({} sessions)", event.type(), schoolId, reached);
        return reached;
    }

    TextMessage toMessage(Object body) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Real-time message is not serializable", e);
        }
    }
}
