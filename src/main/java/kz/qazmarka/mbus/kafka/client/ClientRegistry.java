package kz.qazmarka.mbus.kafka.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.config.ConfigResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.ClientKind;
import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.admin.TopicMetadataReader;
import kz.qazmarka.mbus.kafka.support.BrokerHealthMonitor;

/**
 * Реестр соединений Kafka, ключ: пара (вид клиента, id).
 *
 * Повторная инициализация живого клиента не открывает второе соединение, а проверяет совместимость:
 * тема продьюсера должна существовать, у консьюмера должна существовать хотя бы одна из подписок.
 * Изменения реестра сериализованы замком; чтение дескрипторов ({@link #admin(String)} и т.п.) идёт без него.
 *
 * Продьюсер при первой инициализации снимает baseline {@code retention.ms} своей темы. Снятое значение
 * запоминается на тему один раз и служит эталоном восстановления после очистки.
 */
public final class ClientRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ClientRegistry.class);

    /** Значение retention, которое выставляет фаза очистки. */
    public static final long PURGE_RETENTION_MS = 1L;
    /** Retention по умолчанию (7 суток), подставляется вместо «застрявшего» значения очистки. */
    public static final long DEFAULT_RETENTION_MS = 604_800_000L;

    private final BrokerConfig config;
    private final KafkaClientFactory factory;
    private final ClientPropsFactory props;
    private final TopicMetadataReader metadata;
    private final ReentrantLock lock = new ReentrantLock();

    private final ConcurrentMap<String, AdminHandle> admins = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProducerHandle> producers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConsumerHandle> consumers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> baselines = new ConcurrentHashMap<>();

    public ClientRegistry(BrokerConfig config, KafkaClientFactory factory) {
        this(config, factory, new BrokerHealthMonitor());
    }

    /**
     * @param health сигнал недоступности кластера, который поднимают неудачные чтения метаданных
     */
    public ClientRegistry(BrokerConfig config, KafkaClientFactory factory, BrokerHealthMonitor health) {
        this.config = config;
        this.factory = factory;
        this.props = new ClientPropsFactory(config);
        this.metadata = new TopicMetadataReader(config.adminTimeoutMs(), health);
    }

    /**
     * Создаёт клиента либо проверяет совместимость уже созданного.
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} без описания клиента;
     *         {@link ErrorKind#NOT_FOUND} при отсутствии обязательной записи или темы;
     *         {@link ErrorKind#CONFIG_MISSING}, если у темы продьюсера нет {@code retention.ms}
     */
    public void init(ClientSpec spec) {
        if (spec == null) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Описание клиента не задано");
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Инициализация клиента: {}", spec);
        }
        requireEntry(spec.clientId(), ClientSpec.CLIENT_ID, spec.kind());
        lock.lock();
        try {
            switch (spec.kind()) {
                case ADMIN:
                    initAdmin(spec.clientId());
                    break;
                case PRODUCER:
                    initProducer(spec);
                    break;
                case CONSUMER:
                    initConsumer(spec);
                    break;
                default:
                    throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Неизвестный вид клиента '{}'", spec.kind());
            }
        } finally {
            lock.unlock();
        }
    }

    /** @throws MessageBusException {@link ErrorKind#SERVICE_NOT_INITIALIZED}, если admin не создан */
    public AdminHandle admin(String id) {
        return require(admins.get(id), ClientKind.ADMIN, id);
    }

    /** @throws MessageBusException {@link ErrorKind#SERVICE_NOT_INITIALIZED}, если продьюсер не создан */
    public ProducerHandle producer(String id) {
        return require(producers.get(id), ClientKind.PRODUCER, id);
    }

    /** @throws MessageBusException {@link ErrorKind#SERVICE_NOT_INITIALIZED}, если консьюмер не создан */
    public ConsumerHandle consumer(String id) {
        return require(consumers.get(id), ClientKind.CONSUMER, id);
    }

    /** Baseline retention темы, если его уже снял какой-либо продьюсер. */
    public OptionalLong baselineFor(String topic) {
        Long value = baselines.get(topic);
        return (value == null) ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * Запоминает baseline темы, если он ещё не снят; возвращает действующее значение.
     */
    public long rememberBaseline(String topic, long observedRetentionMs) {
        long normalized = normalizeBaseline(observedRetentionMs);
        Long prev = baselines.putIfAbsent(topic, normalized);
        return (prev == null) ? normalized : prev;
    }

    /** Метаданные, читаемые через соединения реестра. */
    public TopicMetadataReader metadata() {
        return metadata;
    }

    /** Закрывает все соединения; после закрытия реестр пуст. */
    @Override
    public void close() {
        Duration timeout = Duration.ofMillis(config.adminTimeoutMs());
        lock.lock();
        try {
            List<ClientHandle> all = new ArrayList<>(consumers.size() + producers.size() + admins.size());
            all.addAll(consumers.values());
            all.addAll(producers.values());
            all.addAll(admins.values());
            consumers.clear();
            producers.clear();
            admins.clear();
            for (ClientHandle handle : all) {
                closeQuietly(handle, timeout);
            }
            LOG.info("Закрыто соединений Kafka: {}", all.size());
        } finally {
            lock.unlock();
        }
    }

    private void initAdmin(String id) {
        AdminHandle existing = admins.get(id);
        if (existing != null && existing.isOpen()) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Admin '{}' уже инициализирован", id);
            }
            return;
        }
        openAdmin(id);
    }

    private AdminHandle openAdmin(String id) {
        KafkaTopicAdmin admin;
        try {
            admin = factory.createAdmin(props.admin(id));
        } catch (RuntimeException e) {
            throw connectFailed(ClientKind.ADMIN, id, e);
        }
        AdminHandle handle = new AdminHandle(id, admin);
        admins.put(id, handle);
        LOG.info("Создан admin-клиент Kafka '{}'", id);
        return handle;
    }

    private void initProducer(ClientSpec spec) {
        String id = spec.clientId();
        String topic = spec.messageType();
        requireEntry(topic, ClientSpec.MESSAGE_TYPE, ClientKind.PRODUCER);

        ProducerHandle existing = producers.get(id);
        if (existing != null && existing.isOpen()) {
            Set<String> available = metadata.topicNames(existing.admin().admin());
            if (!available.contains(topic)) {
                LOG.error("Тип сообщений '{}' не найден среди {} для продьюсера '{}'", topic, available, id);
                throw new MessageBusException(ErrorKind.NOT_FOUND,
                        "Неизвестная тема или партиция: тип сообщений '{}' не найден для продьюсера '{}'", topic, id);
            }
            return;
        }

        AdminHandle prevAdmin = admins.get(id);
        boolean adminCreated = prevAdmin == null || !prevAdmin.isOpen();
        AdminHandle admin = adminCreated ? openAdmin(id) : prevAdmin;
        Producer<byte[], byte[]> producer = null;
        try {
            producer = factory.createProducer(props.producer(id));
            ConfigResource resource = new ConfigResource(ConfigResource.Type.TOPIC, topic);
            long observed = metadata.retentionMs(admin.admin(), resource);
            long baseline = rememberBaseline(topic, observed);
            producers.put(id, new ProducerHandle(id, producer, admin, resource, baseline));
            LOG.info("Создан продьюсер Kafka '{}' для типа сообщений '{}' (baseline retention.ms={})", id, topic, baseline);
        } catch (RuntimeException e) {
            if (producer != null) {
                closeProducer(producer, id);
            }
            if (adminCreated) {
                admins.remove(id, admin);
                closeQuietly(admin, Duration.ofMillis(config.adminTimeoutMs()));
            }
            if (e instanceof MessageBusException) {
                throw e;
            }
            throw connectFailed(ClientKind.PRODUCER, id, e);
        }
    }

    private void initConsumer(ClientSpec spec) {
        String id = spec.clientId();
        Map<String, Object> required = new LinkedHashMap<>();
        required.put(ClientSpec.OFFSET, spec.offset());
        required.put(ClientSpec.CONSUMER_GROUP, spec.consumerGroup());
        required.put(ClientSpec.MESSAGE_TYPES, spec.messageTypes());
        required.put(ClientSpec.AUTO_ACK, spec.autoAck());
        for (Map.Entry<String, Object> entry : required.entrySet()) {
            requireEntry(entry.getValue(), entry.getKey(), ClientKind.CONSUMER);
        }
        if (spec.messageTypes().isEmpty()) {
            requireEntry(null, ClientSpec.MESSAGE_TYPES, ClientKind.CONSUMER);
        }

        ConsumerHandle existing = consumers.get(id);
        if (existing != null && existing.isOpen()) {
            checkConsumerSubscription(id, spec.messageTypes());
            return;
        }

        Consumer<byte[], byte[]> consumer;
        try {
            consumer = factory.createConsumer(props.consumer(spec));
        } catch (RuntimeException e) {
            throw connectFailed(ClientKind.CONSUMER, id, e);
        }
        ConsumerHandle handle = new ConsumerHandle(id, consumer, spec.messageTypes(), spec.autoAck());
        try {
            consumer.subscribe(spec.messageTypes(), handle);
        } catch (RuntimeException e) {
            consumer.close(Duration.ofMillis(config.adminTimeoutMs()));
            throw connectFailed(ClientKind.CONSUMER, id, e);
        }
        consumers.put(id, handle);
        LOG.info("Создан консьюмер Kafka '{}' (группа '{}', подписки {}, auto_ack={}, offset={})",
                id, spec.consumerGroup(), spec.messageTypes(), spec.autoAck(), spec.offset());
    }

    /**
     * Темы консьюмера сверяются через любое доступное admin-соединение; без admin проверка через сам
     * консьюмер ({@code listTopics}).
     */
    private void checkConsumerSubscription(String id, List<String> messageTypes) {
        Set<String> available;
        AdminHandle admin = admins.get(id);
        if (admin == null && !admins.isEmpty()) {
            admin = admins.values().iterator().next();
        }
        if (admin != null) {
            available = metadata.topicNames(admin.admin());
        } else {
            try {
                available = consumers.get(id).consumer()
                        .listTopics(Duration.ofMillis(config.adminTimeoutMs())).keySet();
            } catch (RuntimeException e) {
                throw KafkaErrorMapper.wrap("listTopics", id, e, ErrorKind.OPERATION_FAILED);
            }
        }
        for (String type : messageTypes) {
            if (available.contains(type)) {
                return;
            }
        }
        LOG.error("Ни один из типов сообщений {} не найден среди {} для консьюмера '{}'", messageTypes, available, id);
        throw new MessageBusException(ErrorKind.NOT_FOUND,
                "Неизвестная тема или партиция: типы сообщений {} не найдены для консьюмера '{}'", messageTypes, id);
    }

    private static long normalizeBaseline(long observed) {
        return (observed == PURGE_RETENTION_MS) ? DEFAULT_RETENTION_MS : observed;
    }

    private static void requireEntry(Object value, String entry, ClientKind kind) {
        if (value == null || (value instanceof String && ((String) value).trim().isEmpty())) {
            LOG.error("Не найдена запись '{}' в конфигурации клиента вида {}", entry, kind);
            throw new MessageBusException(ErrorKind.NOT_FOUND,
                    "Не найдена запись '{}' в конфигурации клиента вида {}", entry, kind);
        }
    }

    private static <H extends ClientHandle> H require(H handle, ClientKind kind, String id) {
        if (handle == null || !handle.isOpen()) {
            LOG.error("Клиент {} '{}' не инициализирован", kind, id);
            throw new MessageBusException(ErrorKind.SERVICE_NOT_INITIALIZED, "Клиент {} '{}' не инициализирован", kind, id);
        }
        return handle;
    }

    private static MessageBusException connectFailed(ClientKind kind, String id, RuntimeException e) {
        LOG.error("Не удалось создать клиента {} '{}': {}", kind, id, KafkaErrorMapper.describe(e));
        return new MessageBusException(ErrorKind.OPERATION_FAILED,
                "Не удалось создать клиента {} '{}': {}", kind, id, KafkaErrorMapper.describe(e), e);
    }

    private void closeProducer(Producer<byte[], byte[]> producer, String id) {
        try {
            producer.close(Duration.ofMillis(config.adminTimeoutMs()));
        } catch (RuntimeException closeError) {
            LOG.warn("Не удалось закрыть продьюсер '{}': {}", id, KafkaErrorMapper.describe(closeError));
        }
    }

    private static void closeQuietly(ClientHandle handle, Duration timeout) {
        try {
            handle.close(timeout);
        } catch (RuntimeException e) {
            LOG.warn("Не удалось закрыть {}: {}", handle, KafkaErrorMapper.describe(e));
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки закрытия {}", handle, e);
            }
        }
    }
}
