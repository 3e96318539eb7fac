package io.github.hongjungwan.phiaudit.core.sink;

import io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig;
import io.github.hongjungwan.phiaudit.api.domain.LogRecord;
import io.github.hongjungwan.phiaudit.core.internal.LogRecordSerializer;
import io.github.hongjungwan.phiaudit.spi.LogSink;
import io.github.hongjungwan.phiaudit.spi.LogSinkException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 외부 로그 수집기(Kafka) 전송 sink. 키는 correlation ID, 값은 JSON UTF-8 바이트.
 *
 * send()는 비동기이며 브로커 측 실패는 콜백에서 집계. 동기적으로 던져지는 예외(버퍼 가득 참,
 * max.block.ms 초과 등)는 LogSinkException으로 감싸 상위 ResilientLogSink가 처리.
 */
@Slf4j
public class KafkaLogSink implements LogSink {

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final LogRecordSerializer serializer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sentCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    public KafkaLogSink(ComplianceLogConfig config, LogRecordSerializer serializer) {
        this(new KafkaProducer<>(producerProperties(config)), config.getKafkaTopic(), serializer);
        log.info("Kafka log sink initialized: bootstrap.servers={}, topic={}",
                config.getKafkaBootstrapServers(), config.getKafkaTopic());
    }

    public KafkaLogSink(Producer<String, byte[]> producer, String topic, LogRecordSerializer serializer) {
        this.producer = producer;
        this.topic = topic;
        this.serializer = serializer;
    }

    static Properties producerProperties(ComplianceLogConfig config) {
        Properties props = new Properties();

        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());

        props.put(ProducerConfig.ACKS_CONFIG, config.getKafkaAcks());
        props.put(ProducerConfig.RETRIES_CONFIG, config.getKafkaRetries());
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "all".equals(config.getKafkaAcks()));

        props.put(ProducerConfig.LINGER_MS_CONFIG, config.getKafkaLingerMs());
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, config.getKafkaMaxBlockMs());
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "zstd");

        return props;
    }

    @Override
    public void accept(LogRecord record) {
        if (closed.get()) {
            throw new LogSinkException("Kafka log sink is closed", null);
        }

        byte[] payload = serializer.toBytes(record);
        ProducerRecord<String, byte[]> producerRecord =
                new ProducerRecord<>(topic, record.getCorrelationId(), payload);

        try {
            producer.send(producerRecord, (metadata, exception) -> {
                if (exception != null) {
                    errorCount.incrementAndGet();
                    log.warn("Failed to deliver log record to topic '{}': {}", topic, exception.getMessage());
                } else {
                    sentCount.incrementAndGet();
                }
            });
        } catch (KafkaException e) {
            errorCount.incrementAndGet();
            throw new LogSinkException("Kafka send failed for topic " + topic, e);
        }
    }

    @Override
    public void flush() {
        if (!closed.get()) {
            producer.flush();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing Kafka log sink (sent={}, errors={})", sentCount.get(), errorCount.get());
            try {
                producer.flush();
                producer.close(Duration.ofSeconds(5));
            } catch (KafkaException e) {
                log.warn("Error closing Kafka producer: {}", e.getMessage());
            }
        }
    }

    public long getSentCount() {
        return sentCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    @Override
    public String getName() {
        return "kafka:" + topic;
    }
}
