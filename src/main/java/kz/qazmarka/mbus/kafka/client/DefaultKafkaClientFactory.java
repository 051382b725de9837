package kz.qazmarka.mbus.kafka.client;

import java.util.Properties;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdminClient;

/**
 * Создаёт «настоящие» клиенты Kafka с сериализаторами {@code byte[]}.
 */
public final class DefaultKafkaClientFactory implements KafkaClientFactory {

    @Override
    public KafkaTopicAdmin createAdmin(Properties props) {
        return new KafkaTopicAdminClient(AdminClient.create(props));
    }

    @Override
    public Producer<byte[], byte[]> createProducer(Properties props) {
        return new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer());
    }

    @Override
    public Consumer<byte[], byte[]> createConsumer(Properties props) {
        return new KafkaConsumer<>(props, new ByteArrayDeserializer(), new ByteArrayDeserializer());
    }
}
