package kz.qazmarka.mbus.kafka;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.DeliveryReport;
import kz.qazmarka.mbus.MessageBroker;
import kz.qazmarka.mbus.ReceiveResult;
import kz.qazmarka.mbus.SendMode;
import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.kafka.client.ClientRegistry;
import kz.qazmarka.mbus.kafka.client.DefaultKafkaClientFactory;
import kz.qazmarka.mbus.kafka.client.KafkaClientFactory;
import kz.qazmarka.mbus.kafka.consumer.MessageReceiver;
import kz.qazmarka.mbus.kafka.producer.MessageSender;
import kz.qazmarka.mbus.kafka.retention.AlterConfigRetrier;
import kz.qazmarka.mbus.kafka.retention.RetentionController;
import kz.qazmarka.mbus.kafka.support.BackoffPolicy;
import kz.qazmarka.mbus.kafka.support.BrokerHealthMonitor;
import kz.qazmarka.mbus.kafka.support.RetryPoller;
import kz.qazmarka.mbus.kafka.support.Sleeper;
import kz.qazmarka.mbus.kafka.topic.TopicLifecycleManager;

/**
 * Реализация {@link MessageBroker} поверх Apache Kafka.
 *
 * Каждая публичная операция сначала проверяет сигнал недоступности кластера ({@link BrokerHealthMonitor}),
 * затем делегирует профильному компоненту. Сигнал поднимают только кластерные чтения метаданных
 * (таймаут или разрыв соединения в listTopics), явная проверка {@link #probeCluster(String)} и внешние
 * наблюдатели; ошибки доставки и commit отдельного клиента остаются ошибками своего вызова.
 */
public final class KafkaMessageBroker implements MessageBroker {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaMessageBroker.class);

    public static final String NAME = "kafka";

    private final BrokerConfig config;
    private final ClientRegistry registry;
    private final BrokerHealthMonitor health;
    private final TopicLifecycleManager topics;
    private final RetentionController retention;
    private final MessageSender sender;
    private final MessageReceiver receiver;

    public KafkaMessageBroker(BrokerConfig config) {
        this(config, new DefaultKafkaClientFactory(), Sleeper.SYSTEM);
    }

    public KafkaMessageBroker(BrokerConfig config, KafkaClientFactory factory, Sleeper sleeper) {
        this.config = config;
        this.health = new BrokerHealthMonitor();
        this.registry = new ClientRegistry(config, factory, health);
        RetryPoller poller = new RetryPoller(new BackoffPolicy(config.backoffStepMs()), sleeper, health::checkAvailable);
        this.topics = new TopicLifecycleManager(registry, config, poller);
        AlterConfigRetrier retrier = new AlterConfigRetrier(poller, config.configRetryMax(), config.adminTimeoutMs());
        this.retention = new RetentionController(registry, config, retrier, sleeper);
        this.sender = new MessageSender(registry, config.sendTimeoutMs());
        this.receiver = new MessageReceiver(registry, config.receiveTimeoutMs());
        if (LOG.isDebugEnabled()) {
            LOG.debug("KafkaMessageBroker инициализирован: {}", config);
        }
    }

    /** Адаптер с настройками из Hadoop {@link Configuration} (ключи {@code mbus.*}). */
    public static KafkaMessageBroker fromConfiguration(Configuration cfg) {
        return new KafkaMessageBroker(BrokerConfig.from(cfg));
    }

    @Override
    public String name() {
        return NAME;
    }

    public BrokerConfig config() {
        return config;
    }

    /** Сигнал недоступности кластера; может подниматься внешними наблюдателями. */
    public BrokerHealthMonitor healthMonitor() {
        return health;
    }

    @Override
    public void initClient(ClientSpec spec) {
        guard(() -> {
            registry.init(spec);
            return null;
        });
    }

    @Override
    public Set<String> listMessageTypes(String adminId) {
        return guard(() -> topics.listMessageTypes(adminId));
    }

    @Override
    public void registerMessageType(String adminId, List<String> messageTypes, int partitions) {
        guard(() -> {
            topics.register(adminId, messageTypes, partitions);
            return null;
        });
    }

    @Override
    public void deregisterMessageType(String adminId, List<String> messageTypes) {
        guard(() -> {
            topics.deregister(adminId, messageTypes);
            return null;
        });
    }

    @Override
    public void addConcurrency(String adminId, String messageType, int concurrencyCount) {
        guard(() -> {
            topics.addConcurrency(adminId, messageType, concurrencyCount);
            return null;
        });
    }

    /** Текущее число партиций типа сообщений. */
    public int partitionCount(String adminId, String messageType) {
        return guard(() -> topics.partitionCount(adminId, messageType));
    }

    @Override
    public DeliveryReport send(String producerId, String messageType, SendMode mode, List<String> messages,
                               long pollTimeoutMs) {
        return guard(() -> sender.send(producerId, messageType, mode, messages, pollTimeoutMs));
    }

    @Override
    public DeliveryReport send(String producerId, String messageType, SendMode mode, List<String> messages) {
        return guard(() -> sender.send(producerId, messageType, mode, messages));
    }

    @Override
    public ReceiveResult receive(String consumerId, Long timeoutMs) {
        return guard(() -> receiver.receive(consumerId, timeoutMs));
    }

    @Override
    public void ack(String consumerId) {
        guard(() -> {
            receiver.ack(consumerId);
            return null;
        });
    }

    /** Прерывает блокирующий receive консьюмера из другого потока. */
    public void wakeup(String consumerId) {
        receiver.wakeup(consumerId);
    }

    @Override
    public void delete(String adminId, String messageType) {
        guard(() -> {
            retention.purge(adminId, messageType);
            return null;
        });
    }

    /** Первая фаза очистки: минимальный retention. */
    public void applyMinimalRetention(String adminId, String messageType) {
        guard(() -> {
            retention.applyMinimalRetention(adminId, messageType);
            return null;
        });
    }

    /** Вторая фаза очистки: восстановление baseline retention. */
    public void restoreRetention(String adminId, String messageType) {
        guard(() -> {
            retention.restoreRetention(adminId, messageType);
            return null;
        });
    }

    /** Типы сообщений, очистка которых применена только наполовину. */
    public Set<String> halfAppliedPurges() {
        return retention.halfAppliedPurges();
    }

    /** Текущий {@code retention.ms} типа сообщений. */
    public long retention(String adminId, String messageType) {
        return guard(() -> retention.retention(adminId, messageType));
    }

    @Override
    public void configureMessageType(String adminId, String messageType, Map<String, ?> properties) {
        guard(() -> {
            retention.configure(adminId, messageType, properties);
            return null;
        });
    }

    @Override
    public void setMessageTypeExpiry(String adminId, String messageType, Map<String, ?> properties) {
        guard(() -> {
            retention.setExpiry(adminId, messageType, properties);
            return null;
        });
    }

    /**
     * Явная проверка кластера через admin-клиента.
     *
     * @return число доступных брокеров
     */
    public int probeCluster(String adminId) {
        return guard(() -> health.probe(registry.admin(adminId).admin(), config.adminTimeoutMs()));
    }

    @Override
    public void close() {
        registry.close();
    }

    private <T> T guard(Supplier<T> operation) {
        health.checkAvailable();
        return operation.get();
    }
}
