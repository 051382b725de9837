package kz.qazmarka.mbus.kafka.client;

import java.util.Arrays;
import java.util.Collections;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import kz.qazmarka.mbus.ClientKind;
import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.FakeClientFactory;
import kz.qazmarka.mbus.kafka.FakeKafkaAdmin;

class ClientRegistryTest {

    private static final BrokerConfig CONFIG = BrokerConfig.builder("localhost:9092").adminTimeoutMs(100L).build();

    private final FakeKafkaAdmin broker = new FakeKafkaAdmin().withTopic("orders", 3, "86400000");
    private final FakeClientFactory factory = new FakeClientFactory(broker);
    private final ClientRegistry registry = new ClientRegistry(CONFIG, factory);

    @Nested
    @DisplayName("admin")
    class Admin {

        @Test
        @DisplayName("Повторная инициализация не открывает второе соединение")
        void idempotent() {
            registry.init(ClientSpec.admin("a1"));
            AdminHandle first = registry.admin("a1");
            registry.init(ClientSpec.admin("a1"));

            assertSame(first, registry.admin("a1"));
            assertEquals(1, factory.adminProps.size());
        }

        @Test
        @DisplayName("Обращение к неинициализированному клиенту: SERVICE_NOT_INITIALIZED")
        void missingHandle() {
            MessageBusException ex = assertThrows(MessageBusException.class, () -> registry.admin("ghost"));
            assertEquals(ErrorKind.SERVICE_NOT_INITIALIZED, ex.kind());
        }

        @Test
        @DisplayName("Без client_id: NOT_FOUND до открытия соединения")
        void missingClientId() {
            MessageBusException ex = assertThrows(MessageBusException.class,
                    () -> registry.init(ClientSpec.builder(ClientKind.ADMIN).build()));
            assertEquals(ErrorKind.NOT_FOUND, ex.kind());
            assertTrue(factory.adminProps.isEmpty());
        }
    }

    @Nested
    @DisplayName("producer")
    class ProducerKind {

        @Test
        @DisplayName("Создаёт admin с тем же id и снимает baseline retention")
        void capturesBaseline() {
            registry.init(ClientSpec.producer("p1", "orders"));

            ProducerHandle handle = registry.producer("p1");
            assertEquals(86_400_000L, handle.baselineRetentionMs());
            assertEquals("orders", handle.messageType());
            assertSame(handle.admin(), registry.admin("p1"));
            assertEquals(OptionalLong.of(86_400_000L), registry.baselineFor("orders"));
        }

        @Test
        @DisplayName("retention.ms = 1 при инициализации заменяется значением по умолчанию")
        void stuckPurgeBaselineReplaced() {
            broker.withTopic("alerts", 1, "1");

            registry.init(ClientSpec.producer("p1", "alerts"));

            assertEquals(ClientRegistry.DEFAULT_RETENTION_MS, registry.producer("p1").baselineRetentionMs());
        }

        @Test
        @DisplayName("Baseline снимается один раз на тему")
        void baselineCapturedOnce() {
            registry.init(ClientSpec.producer("p1", "orders"));
            broker.withTopic("orders", 3, "5000");
            registry.init(ClientSpec.producer("p2", "orders"));

            assertEquals(86_400_000L, registry.producer("p2").baselineRetentionMs());
        }

        @Test
        @DisplayName("Нет retention.ms у темы: CONFIG_MISSING, соединения закрываются")
        void missingRetention() {
            broker.withTopic("bare", 1, null);

            MessageBusException ex = assertThrows(MessageBusException.class,
                    () -> registry.init(ClientSpec.producer("p1", "bare")));

            assertEquals(ErrorKind.CONFIG_MISSING, ex.kind());
            assertTrue(factory.producers.get("p1").closed());
            assertEquals(1, broker.closeCalls);
            assertThrows(MessageBusException.class, () -> registry.admin("p1"));
        }

        @Test
        @DisplayName("Повторная инициализация проверяет существование темы")
        void compatibilityCheck() {
            registry.init(ClientSpec.producer("p1", "orders"));
            registry.init(ClientSpec.producer("p1", "orders"));
            assertEquals(1, factory.producerProps.size());

            MessageBusException ex = assertThrows(MessageBusException.class,
                    () -> registry.init(ClientSpec.producer("p1", "missing")));
            assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        }
    }

    @Nested
    @DisplayName("consumer")
    class ConsumerKind {

        @Test
        @DisplayName("Отсутствующая запись конфигурации: NOT_FOUND до открытия соединения")
        void missingEntry() {
            ClientSpec spec = ClientSpec.builder(ClientKind.CONSUMER)
                    .clientId("c1")
                    .consumerGroup("g1")
                    .messageTypes(Collections.singletonList("orders"))
                    .offset("earliest")
                    .build();

            MessageBusException ex = assertThrows(MessageBusException.class, () -> registry.init(spec));

            assertEquals(ErrorKind.NOT_FOUND, ex.kind());
            assertTrue(ex.getMessage().contains(ClientSpec.AUTO_ACK));
            assertTrue(factory.consumerProps.isEmpty());
        }

        @Test
        @DisplayName("Подписывается на типы сообщений и запоминает auto_ack")
        void subscribes() {
            registry.init(ClientSpec.consumer("c1", "g1", Arrays.asList("orders", "alerts"), false, "earliest"));

            ConsumerHandle handle = registry.consumer("c1");
            assertFalse(handle.autoAck());
            assertEquals(handle.subscription(), factory.consumers.get("c1").subscription());
        }

        @Test
        @DisplayName("Повторная инициализация: достаточно одной существующей темы из подписки")
        void compatibilityCheck() {
            registry.init(ClientSpec.admin("c1"));
            registry.init(ClientSpec.consumer("c1", "g1", Arrays.asList("orders", "ghost"), true, "latest"));
            registry.init(ClientSpec.consumer("c1", "g1", Arrays.asList("orders", "ghost"), true, "latest"));
            assertEquals(1, factory.consumerProps.size());

            MessageBusException ex = assertThrows(MessageBusException.class,
                    () -> registry.init(ClientSpec.consumer("c1", "g1", Arrays.asList("ghost"), true, "latest")));
            assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        }
    }

    @Test
    @DisplayName("close() закрывает все соединения и очищает реестр")
    void closeAll() {
        registry.init(ClientSpec.producer("p1", "orders"));
        registry.init(ClientSpec.consumer("c1", "g1", Collections.singletonList("orders"), true, "latest"));

        registry.close();

        assertTrue(factory.producers.get("p1").closed());
        assertTrue(factory.consumers.get("c1").closed());
        assertEquals(1, broker.closeCalls);
        assertThrows(MessageBusException.class, () -> registry.producer("p1"));
    }
}
