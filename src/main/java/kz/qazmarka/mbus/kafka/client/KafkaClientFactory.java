package kz.qazmarka.mbus.kafka.client;

import java.util.Properties;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;

import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;

/**
 * Точка создания соединений Kafka. Реестр клиентов открывает соединения только через неё,
 * что позволяет подменять брокер в тестах.
 */
public interface KafkaClientFactory {

    KafkaTopicAdmin createAdmin(Properties props);

    Producer<byte[], byte[]> createProducer(Properties props);

    Consumer<byte[], byte[]> createConsumer(Properties props);
}
