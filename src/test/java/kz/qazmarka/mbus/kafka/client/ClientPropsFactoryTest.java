package kz.qazmarka.mbus.kafka.client;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.config.BrokerConfig;

class ClientPropsFactoryTest {

    @Test
    @DisplayName("admin: socket timeout уходит в request.timeout.ms")
    void adminTimeouts() {
        BrokerConfig cfg = BrokerConfig.builder("k:9092").socketTimeoutMs(7000L).build();

        Properties p = new ClientPropsFactory(cfg).admin("a1");

        assertEquals("k:9092", p.get(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("a1", p.get(AdminClientConfig.CLIENT_ID_CONFIG));
        assertEquals("7000", p.get(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG));
    }

    @Test
    @DisplayName("producer: delivery.timeout = send timeout, request.timeout не больше него")
    void producerTimeouts() {
        BrokerConfig cfg = BrokerConfig.builder("k:9092").socketTimeoutMs(15000L).sendTimeoutMs(5000L).build();

        Properties p = new ClientPropsFactory(cfg).producer("p1");

        assertEquals("5000", p.get(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG));
        assertEquals("5000", p.get(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG));
        assertEquals("all", p.get(ProducerConfig.ACKS_CONFIG));
        assertEquals("true", p.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG));
    }

    @Test
    @DisplayName("producer: pass-through не ломает связку идемпотентности и отбрасывает неизвестные ключи")
    void producerPassThrough() {
        Map<String, String> overrides = new HashMap<>();
        overrides.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "10");
        overrides.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "lz4");
        overrides.put("no.such.key", "x");
        BrokerConfig cfg = BrokerConfig.builder("k:9092").producerOverrides(overrides).build();

        Properties p = new ClientPropsFactory(cfg).producer("p1");

        assertEquals("5", p.get(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION));
        assertEquals("lz4", p.get(ProducerConfig.COMPRESSION_TYPE_CONFIG));
        assertFalse(p.containsKey("no.such.key"));
    }

    @Test
    @DisplayName("consumer: группа, auto-commit, offset и выдача по одной записи")
    void consumerProps() {
        ClientSpec spec = ClientSpec.consumer("c1", "g1", Arrays.asList("orders"), false, "earliest");

        Properties p = new ClientPropsFactory(BrokerConfig.builder("k:9092").build()).consumer(spec);

        assertEquals("g1", p.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("false", p.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals("earliest", p.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
        assertEquals("1", p.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    }
}
