package kz.qazmarka.mbus.kafka;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

import org.apache.hadoop.conf.Configuration;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.DeliveryReport;
import kz.qazmarka.mbus.MessageBroker;
import kz.qazmarka.mbus.ReceiveResult;
import kz.qazmarka.mbus.SendMode;
import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

class KafkaMessageBrokerTest {

    private static final BrokerConfig CONFIG = BrokerConfig.builder("localhost:9092")
            .adminTimeoutMs(100L)
            .receiveTimeoutMs(10L)
            .sendTimeoutMs(500L)
            .purgeGraceMs(1000L)
            .build();

    private FakeKafkaAdmin cluster;
    private FakeClientFactory factory;
    private RecordingSleeper sleeper;
    private KafkaMessageBroker broker;

    @BeforeEach
    void setUp() {
        cluster = new FakeKafkaAdmin();
        factory = new FakeClientFactory(cluster);
        sleeper = new RecordingSleeper();
        broker = new KafkaMessageBroker(CONFIG, factory, sleeper);
        broker.initClient(ClientSpec.admin("admin1"));
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    @DisplayName("Имя адаптера: kafka")
    void name() {
        MessageBroker api = broker;
        assertEquals("kafka", api.name());
    }

    @Test
    @DisplayName("register → list: новый тип сообщений виден")
    void registerThenList() {
        broker.registerMessageType("admin1", Collections.singletonList("orders"), 3);

        assertTrue(broker.listMessageTypes("admin1").contains("orders"));
        assertEquals(3, broker.partitionCount("admin1", "orders"));
    }

    @Test
    @DisplayName("addConcurrency: 5 применяется, последующее 2 отклоняется")
    void addConcurrencyMonotonic() {
        broker.registerMessageType("admin1", Collections.singletonList("orders"), 3);

        broker.addConcurrency("admin1", "orders", 5);
        assertEquals(5, broker.partitionCount("admin1", "orders"));

        MessageBusException ex = assertThrows(MessageBusException.class,
                () -> broker.addConcurrency("admin1", "orders", 2));
        assertEquals(ErrorKind.OPERATION_FAILED, ex.kind());
        assertEquals(5, cluster.partitions("orders"));
    }

    @Test
    @DisplayName("sync send возвращается после подтверждения обоих сообщений")
    void syncSend() {
        cluster.withTopic("orders", 1);
        broker.initClient(ClientSpec.producer("producer1", "orders"));

        DeliveryReport report = broker.send("producer1", "orders", SendMode.SYNC, Arrays.asList("m1", "m2"));

        assertEquals(2, report.size());
        assertEquals(0, report.pendingCount());
        assertEquals(2, report.awaitAll(0L).size());
        assertEquals(2, factory.producers.get("producer1").history().size());
    }

    @Test
    @DisplayName("receive(timeout=0) ждёт сообщения и возвращает исходные байты")
    void blockingReceive() {
        cluster.withTopic("orders", 1);
        MockConsumer<byte[], byte[]> consumer = consumer("consumer1");
        byte[] payload = "m1".getBytes(StandardCharsets.UTF_8);
        consumer.schedulePollTask(() -> { });
        consumer.schedulePollTask(() -> consumer.addRecord(new ConsumerRecord<>("orders", 0, 0L, null, payload)));

        ReceiveResult result = broker.receive("consumer1", 0L);

        assertArrayEquals(payload, result.payload());
    }

    @Test
    @DisplayName("delete: retention восстанавливается, неблокирующий receive пуст")
    void deletePurgesAndRestores() {
        cluster.withTopic("orders", 1, "86400000");
        broker.initClient(ClientSpec.producer("producer1", "orders"));
        MockConsumer<byte[], byte[]> consumer = consumer("consumer1");
        consumer.addRecord(new ConsumerRecord<>("orders", 0, 0L, null, "m1".getBytes(StandardCharsets.UTF_8)));
        cluster.onPurge(topic -> consumer.rebalance(new ArrayList<>(consumer.assignment())));

        broker.delete("admin1", "orders");

        assertTrue(broker.receive("consumer1").isEmpty());
        assertEquals(86_400_000L, broker.retention("admin1", "orders"));
        assertEquals(Arrays.asList("1", "86400000"), cluster.retentionHistory);
        assertTrue(broker.halfAppliedPurges().isEmpty());
    }

    @Test
    @DisplayName("setMessageTypeExpiry для незарегистрированного типа: NOT_FOUND")
    void expiryOnUnknownTopic() {
        MessageBusException ex = assertThrows(MessageBusException.class,
                () -> broker.setMessageTypeExpiry("admin1", "ghost-topic", 1000L, 1_000_000L));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    }

    @Test
    @DisplayName("Повторный initClient с теми же параметрами не открывает второе соединение")
    void idempotentInit() {
        cluster.withTopic("orders", 1);
        Map<String, Object> conf = new HashMap<>();
        conf.put(ClientSpec.CLIENT_ID, "producer1");
        conf.put(ClientSpec.MESSAGE_TYPE, "orders");

        broker.initClient("producer", conf);
        broker.initClient("producer", conf);
        broker.initClient(ClientSpec.admin("admin1"));

        assertEquals(1, factory.producerProps.size());
        assertEquals(2, factory.adminProps.size());
    }

    @Test
    @DisplayName("Сигнал недоступности кластера срабатывает на следующем вызове один раз")
    void brokerDownSignal() {
        broker.healthMonitor().reportAllBrokersDown(new TimeoutException("metadata"));

        MessageBusException ex = assertThrows(MessageBusException.class, () -> broker.listMessageTypes("admin1"));
        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, ex.kind());

        assertFalse(broker.healthMonitor().isDownReported());
        assertTrue(broker.listMessageTypes("admin1").isEmpty());
    }

    @Test
    @DisplayName("Таймаут метаданных в операции поднимает сигнал для следующего вызова")
    void timeoutRaisesSignal() {
        cluster.failList(new TimeoutException("metadata"));

        assertEquals(ErrorKind.OPERATION_FAILED, assertThrows(MessageBusException.class,
                () -> broker.listMessageTypes("admin1")).kind());
        assertTrue(broker.healthMonitor().isDownReported());

        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, assertThrows(MessageBusException.class,
                () -> broker.listMessageTypes("admin1")).kind());
    }

    @Test
    @DisplayName("Таймаут доставки при sync send не считается недоступностью кластера")
    void deliveryTimeoutKeepsClusterAvailable() {
        cluster.withTopic("orders", 1);
        factory.withProducers(ExpiringProducer::new);
        broker.initClient(ClientSpec.producer("producer1", "orders"));

        assertEquals(ErrorKind.TIMEOUT, assertThrows(MessageBusException.class,
                () -> broker.send("producer1", "orders", SendMode.SYNC, Collections.singletonList("m1"))).kind());

        assertFalse(broker.healthMonitor().isDownReported());
        assertTrue(broker.listMessageTypes("admin1").contains("orders"));
    }

    @Test
    @DisplayName("probeCluster: пустой список узлов означает SERVICE_UNAVAILABLE")
    void probeCluster() {
        assertEquals(1, broker.probeCluster("admin1"));

        cluster.withNodes(Collections.emptyList());

        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, assertThrows(MessageBusException.class,
                () -> broker.probeCluster("admin1")).kind());
    }

    @Test
    @DisplayName("fromConfiguration(): настройки читаются из ключей mbus.*")
    void fromConfiguration() {
        Configuration cfg = new Configuration(false);
        cfg.set("mbus.kafka.bootstrap.servers", "k1:9092,k2:9092");

        try (KafkaMessageBroker fromCfg = KafkaMessageBroker.fromConfiguration(cfg)) {
            assertEquals("k1:9092,k2:9092", fromCfg.config().bootstrap());
        }
    }

    /** Продьюсер, у которого каждая запись истекает в очереди отправки. */
    private static final class ExpiringProducer extends MockProducer<byte[], byte[]> {

        ExpiringProducer() {
            super(true, new ByteArraySerializer(), new ByteArraySerializer());
        }

        @Override
        public synchronized Future<RecordMetadata> send(ProducerRecord<byte[], byte[]> record, Callback callback) {
            CompletableFuture<RecordMetadata> f = new CompletableFuture<>();
            f.completeExceptionally(new TimeoutException("Expiring 1 record(s) for " + record.topic() + "-0"));
            return f;
        }
    }

    private MockConsumer<byte[], byte[]> consumer(String id) {
        broker.initClient(ClientSpec.consumer(id, "g1", Collections.singletonList("orders"), true, "earliest"));
        MockConsumer<byte[], byte[]> consumer = factory.consumers.get(id);
        TopicPartition tp = new TopicPartition("orders", 0);
        consumer.rebalance(Collections.singletonList(tp));
        Map<TopicPartition, Long> beginning = new HashMap<>();
        beginning.put(tp, 0L);
        consumer.updateBeginningOffsets(beginning);
        return consumer;
    }
}
