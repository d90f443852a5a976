package com.payment.threatintel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.threatintel.alerting.ThreatAlert;
import com.payment.threatintel.messaging.ScamReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring: consumer for confirmed scam reports ({@link ScamReport}) and producer for threat alerts
 * ({@link ThreatAlert}). JSON both ways, no type headers.
 */
@Slf4j
@Configuration
public class ThreatIntelKafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${threat-intel.kafka.consumer-group:scam-threat-intel}")
    private String consumerGroup;

    /** Not a bean: the web layer uses Spring Boot's auto-configured mapper. */
    static ObjectMapper kafkaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        mapper.disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        return mapper;
    }

    @Bean
    public ConsumerFactory<String, ScamReport> scamReportConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        JsonDeserializer<ScamReport> deserializer = new JsonDeserializer<>(ScamReport.class, kafkaObjectMapper());
        deserializer.setUseTypeHeaders(false);
        deserializer.addTrustedPackages("com.payment.threatintel");
        ErrorHandlingDeserializer<ScamReport> errorHandlingDeserializer = new ErrorHandlingDeserializer<>(deserializer);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), errorHandlingDeserializer);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ScamReport> scamReportListenerContainerFactory(
            ConsumerFactory<String, ScamReport> scamReportConsumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, ScamReport> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(scamReportConsumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.setCommonErrorHandler(new DefaultErrorHandler(new FixedBackOff(0L, 0L)) {
            @Override
            public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                    MessageListenerContainer container, boolean batchListener) {
                Throwable cause = thrownException.getCause();
                if (cause != null) {
                    log.error("Scam report listener error: {} - {}",
                            cause.getClass().getSimpleName(), cause.getMessage(), thrownException);
                } else {
                    log.error("Scam report listener error", thrownException);
                }
                super.handleOtherException(thrownException, consumer, container, batchListener);
            }
        });
        return factory;
    }

    @Bean
    public ProducerFactory<String, ThreatAlert> threatAlertProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        JsonSerializer<ThreatAlert> serializer = new JsonSerializer<>(kafkaObjectMapper());
        serializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, ThreatAlert> threatAlertKafkaTemplate(
            ProducerFactory<String, ThreatAlert> threatAlertProducerFactory) {
        return new KafkaTemplate<>(threatAlertProducerFactory);
    }
}
