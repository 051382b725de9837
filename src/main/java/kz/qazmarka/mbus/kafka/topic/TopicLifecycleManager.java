package kz.qazmarka.mbus.kafka.topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.kafka.clients.admin.NewPartitions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.admin.AdminCalls;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.admin.TopicMetadataReader;
import kz.qazmarka.mbus.kafka.client.ClientRegistry;
import kz.qazmarka.mbus.kafka.support.RetryPoller;

/**
 * Создание и удаление типов сообщений, наращивание числа партиций.
 *
 * Каждая мутация выполняется в два шага: дождаться результата задачи AdminClient, затем через
 * {@link RetryPoller} дождаться, пока живые метаданные отразят изменение.
 */
public final class TopicLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(TopicLifecycleManager.class);

    private final ClientRegistry registry;
    private final TopicMetadataReader metadata;
    private final RetryPoller poller;
    private final long adminTimeoutMs;
    private final short replication;
    private final int listRetryMax;

    public TopicLifecycleManager(ClientRegistry registry, BrokerConfig config, RetryPoller poller) {
        this.registry = registry;
        this.metadata = registry.metadata();
        this.poller = poller;
        this.adminTimeoutMs = config.adminTimeoutMs();
        this.replication = config.topicReplication();
        this.listRetryMax = config.listRetryMax();
    }

    /** Все типы сообщений кластера. */
    public Set<String> listMessageTypes(String adminId) {
        return metadata.topicNames(admin(adminId));
    }

    /**
     * Создаёт типы сообщений и ждёт их появления в метаданных.
     *
     * @throws MessageBusException {@link ErrorKind#OPERATION_FAILED} при ошибке задачи создания,
     *         {@link ErrorKind#TIMEOUT}, если тема так и не появилась в метаданных
     */
    public void register(String adminId, List<String> names, int partitions) {
        TopicNameValidator.requireValid(names);
        if (partitions < 1) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                    "Число партиций должно быть >= 1, получено {}", partitions);
        }
        KafkaTopicAdmin admin = admin(adminId);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Регистрация типов сообщений {} через admin '{}' (partitions={}, replication={})",
                    names, adminId, partitions, replication);
        }
        List<NewTopic> newTopics = new ArrayList<>(names.size());
        for (String name : names) {
            newTopics.add(new NewTopic(name, partitions, replication));
        }
        Map<String, KafkaFuture<Void>> futures = admin.createTopics(newTopics);
        AdminCalls.awaitAll(futures, adminTimeoutMs, "registerMessageType", ErrorKind.OPERATION_FAILED);

        for (String name : names) {
            poller.await("создание типа сообщений '" + name + "'",
                    () -> metadata.topicNames(admin).contains(name),
                    listRetryMax, ErrorKind.TIMEOUT);
        }
        LOG.info("Зарегистрированы типы сообщений {}: partitions={}, replication={}", names, partitions, replication);
    }

    /**
     * Удаляет типы сообщений и ждёт их исчезновения из метаданных.
     */
    public void deregister(String adminId, List<String> names) {
        TopicNameValidator.requireValid(names);
        KafkaTopicAdmin admin = admin(adminId);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Удаление типов сообщений {} через admin '{}'", names, adminId);
        }
        Map<String, KafkaFuture<Void>> futures = admin.deleteTopics(names);
        AdminCalls.awaitAll(futures, adminTimeoutMs, "deregisterMessageType", ErrorKind.OPERATION_FAILED);

        for (String name : names) {
            poller.await("удаление типа сообщений '" + name + "'",
                    () -> !metadata.topicNames(admin).contains(name),
                    listRetryMax, ErrorKind.TIMEOUT);
        }
        LOG.info("Удалены типы сообщений {}", names);
    }

    /**
     * Увеличивает число партиций темы до {@code count}. Уменьшение или то же значение Kafka отклоняет,
     * это всплывает как {@link ErrorKind#OPERATION_FAILED}.
     *
     * @throws MessageBusException {@link ErrorKind#LIMIT_EXCEEDED}, если число партиций не сошлось
     *         за бюджет повторов
     */
    public void addConcurrency(String adminId, String name, int count) {
        TopicNameValidator.requireValid(name);
        KafkaTopicAdmin admin = admin(adminId);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Увеличение числа партиций типа сообщений '{}' до {} через admin '{}'", name, count, adminId);
        }
        Map<String, KafkaFuture<Void>> futures =
                admin.createPartitions(Collections.singletonMap(name, NewPartitions.increaseTo(count)));
        AdminCalls.awaitAll(futures, adminTimeoutMs, "addConcurrency", ErrorKind.OPERATION_FAILED);

        poller.await("число партиций '" + name + "' = " + count,
                () -> metadata.partitionCount(admin, name),
                observed -> observed == count,
                listRetryMax, ErrorKind.LIMIT_EXCEEDED);
        LOG.info("Число партиций типа сообщений '{}' увеличено до {}", name, count);
    }

    /**
     * Текущее число партиций.
     *
     * @throws MessageBusException {@link ErrorKind#NOT_FOUND}, если темы нет
     */
    public int partitionCount(String adminId, String name) {
        return metadata.partitionCount(admin(adminId), name);
    }

    private KafkaTopicAdmin admin(String adminId) {
        return registry.admin(adminId).admin();
    }
}
