package kz.qazmarka.mbus.kafka.admin;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.ConfigEntry;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.config.ConfigResource;
import org.apache.kafka.common.config.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.support.BrokerHealthMonitor;

/**
 * Чтение живых метаданных тем. Ничего не кеширует: каждый вызов идёт в брокер.
 */
public final class TopicMetadataReader {

    private static final Logger LOG = LoggerFactory.getLogger(TopicMetadataReader.class);

    private final long adminTimeoutMs;
    private final BrokerHealthMonitor health;

    public TopicMetadataReader(long adminTimeoutMs, BrokerHealthMonitor health) {
        this.adminTimeoutMs = adminTimeoutMs;
        this.health = health;
    }

    /**
     * Имена всех тем кластера. Таймаут метаданных или разрыв соединения поднимает сигнал недоступности кластера.
     *
     * @throws MessageBusException {@link ErrorKind#OPERATION_FAILED}, если метаданные недоступны
     */
    public Set<String> topicNames(KafkaTopicAdmin admin) {
        try {
            Set<String> names = AdminCalls.await(admin.listTopics(), adminTimeoutMs,
                    "listTopics", "*", ErrorKind.OPERATION_FAILED);
            return (names == null) ? Collections.<String>emptySet() : names;
        } catch (MessageBusException e) {
            if (e.is(ErrorKind.INTERRUPTED)) {
                throw e;
            }
            health.reportMetadataFailure(e);
            LOG.error("listTopics() завершился ошибкой: {}. Проверьте, что сервис Kafka запущен", e.getMessage());
            throw new MessageBusException(ErrorKind.OPERATION_FAILED,
                    "listTopics() завершился ошибкой. Проверьте, что сервис Kafka запущен. {}", e.getMessage(), e);
        }
    }

    /**
     * Текущее число партиций темы.
     *
     * @throws MessageBusException {@link ErrorKind#NOT_FOUND}, если темы нет
     */
    public int partitionCount(KafkaTopicAdmin admin, String topic) {
        Map<String, KafkaFuture<TopicDescription>> futures = admin.describeTopics(Collections.singleton(topic));
        TopicDescription desc = AdminCalls.await(futures.get(topic), adminTimeoutMs,
                "describeTopics", topic, ErrorKind.OPERATION_FAILED);
        return desc.partitions().size();
    }

    /** Текущая конфигурация темы. */
    public Config topicConfig(KafkaTopicAdmin admin, ConfigResource resource) {
        Map<ConfigResource, KafkaFuture<Config>> futures = admin.describeConfigs(Collections.singleton(resource));
        return AdminCalls.await(futures.get(resource), adminTimeoutMs,
                "describeConfigs", resource.name(), ErrorKind.OPERATION_FAILED);
    }

    /**
     * Текущее значение {@code retention.ms} темы.
     *
     * @throws MessageBusException {@link ErrorKind#CONFIG_MISSING}, если брокер не вернул ключ
     */
    public long retentionMs(KafkaTopicAdmin admin, ConfigResource resource) {
        Config config = topicConfig(admin, resource);
        ConfigEntry entry = (config == null) ? null : config.get(TopicConfig.RETENTION_MS_CONFIG);
        if (entry == null || entry.value() == null) {
            LOG.error("У темы '{}' отсутствует обязательный конфиг {}", resource.name(), TopicConfig.RETENTION_MS_CONFIG);
            throw new MessageBusException(ErrorKind.CONFIG_MISSING,
                    "Отсутствует обязательный конфиг {} у темы '{}'", TopicConfig.RETENTION_MS_CONFIG, resource.name());
        }
        try {
            return Long.parseLong(entry.value().trim());
        } catch (NumberFormatException e) {
            throw new MessageBusException(ErrorKind.CONFIG_MISSING,
                    "Некорректное значение {}='{}' у темы '{}'",
                    TopicConfig.RETENTION_MS_CONFIG, entry.value(), resource.name(), e);
        }
    }
}
