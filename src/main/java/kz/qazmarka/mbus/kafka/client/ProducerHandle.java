package kz.qazmarka.mbus.kafka.client;

import java.time.Duration;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.config.ConfigResource;

import kz.qazmarka.mbus.ClientKind;

/**
 * Дескриптор продьюсера: соединение, companion admin для чтения/изменения конфигов темы,
 * {@link ConfigResource} привязанной темы и baseline retention, снятый при первой инициализации.
 */
public final class ProducerHandle extends ClientHandle {

    private final Producer<byte[], byte[]> producer;
    private final AdminHandle admin;
    private final ConfigResource topicResource;
    private final long baselineRetentionMs;

    ProducerHandle(String id,
                   Producer<byte[], byte[]> producer,
                   AdminHandle admin,
                   ConfigResource topicResource,
                   long baselineRetentionMs) {
        super(ClientKind.PRODUCER, id);
        this.producer = producer;
        this.admin = admin;
        this.topicResource = topicResource;
        this.baselineRetentionMs = baselineRetentionMs;
    }

    public Producer<byte[], byte[]> producer() {
        return producer;
    }

    public AdminHandle admin() {
        return admin;
    }

    public String messageType() {
        return topicResource.name();
    }

    public ConfigResource topicResource() {
        return topicResource;
    }

    public long baselineRetentionMs() {
        return baselineRetentionMs;
    }

    @Override
    void closeConnection(Duration timeout) {
        producer.close(timeout);
    }
}
