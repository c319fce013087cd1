package com.example.schoolidentity.config;

import com.example.common.events.AssignmentPublishedEvent;
import com.example.common.events.SchoolAnnouncementEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumers feeding the real-time bus.
 *
 * - assignment.published: learner mailboxes plus guardian copies
 * - school.announcement: school room broadcast
 *
 * Real-time delivery is best effort, so failed records are logged after a short retry
 * and skipped. Only enabled when spring.kafka.enabled=true.
 */
@Slf4j
@Configuration
@EnableKafka
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:school-identity-service}")
    private String groupId;

    @Bean
    public ConsumerFactory<String, AssignmentPublishedEvent> assignmentPublishedConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(AssignmentPublishedEvent.class));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, AssignmentPublishedEvent>
            assignmentPublishedListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, AssignmentPublishedEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(assignmentPublishedConsumerFactory());
        factory.setConcurrency(3);
        factory.getContainerProperties().setPollTimeout(3000);
        factory.setCommonErrorHandler(errorHandler());
        return factory;
    }

    @Bean
    public ConsumerFactory<String, SchoolAnnouncementEvent> schoolAnnouncementConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(SchoolAnnouncementEvent.class));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, SchoolAnnouncementEvent>
            schoolAnnouncementListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, SchoolAnnouncementEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(schoolAnnouncementConsumerFactory());
        factory.setConcurrency(1);
        factory.getContainerProperties().setPollTimeout(3000);
        factory.setCommonErrorHandler(errorHandler());
        return factory;
    }

    private Map<String, Object> consumerProps(Class<?> valueType) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        props.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class.getName());
        props.put(JsonDeserializer.VALUE_DEFAULT_TYPE, valueType.getName());
        props.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        props.put(JsonDeserializer.TRUSTED_PACKAGES, "com.example.common.events");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        // missed events are not replayed to clients that are online now
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 50);
        return props;
    }

    private DefaultErrorHandler errorHandler() {
        return new DefaultErrorHandler(
                (record, exception) -> log.error("Dropping record from {} after retries: key={}",
                        record.topic(), record.key(), exception),
                new FixedBackOff(1000L, 2L));
    }
}
