package kz.qazmarka.mbus.config;

import org.apache.hadoop.conf.Configuration;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BrokerConfigTest {

    private static Configuration base() {
        Configuration cfg = new Configuration(false);
        cfg.set(BrokerConfig.Keys.BOOTSTRAP, " kafka1:9092,kafka2:9092 ");
        return cfg;
    }

    @Test
    @DisplayName("Без явных ключей применяются значения по умолчанию")
    void defaults() {
        BrokerConfig c = BrokerConfig.from(base());

        assertEquals("kafka1:9092,kafka2:9092", c.bootstrap());
        assertEquals(500L, c.receiveTimeoutMs());
        assertEquals(15000L, c.socketTimeoutMs());
        assertEquals(30000L, c.sendTimeoutMs());
        assertEquals(60000L, c.adminTimeoutMs());
        assertEquals((short) 1, c.topicReplication());
        assertEquals(15, c.listRetryMax());
        assertEquals(3, c.configRetryMax());
        assertEquals(1000L, c.backoffStepMs());
        assertEquals(1000L, c.purgeGraceMs());
        assertTrue(c.producerOverrides().isEmpty());
    }

    @Test
    @DisplayName("Явные значения читаются, некорректные заменяются дефолтом или минимумом")
    void explicitAndInvalidValues() {
        Configuration cfg = base();
        cfg.set(BrokerConfig.Keys.RECEIVE_TIMEOUT_MS, "250");
        cfg.set(BrokerConfig.Keys.SEND_TIMEOUT_MS, "abc");
        cfg.set(BrokerConfig.Keys.CONFIG_RETRY_MAX, "0");
        cfg.set(BrokerConfig.Keys.TOPIC_REPLICATION, "3");

        BrokerConfig c = BrokerConfig.from(cfg);

        assertEquals(250L, c.receiveTimeoutMs());
        assertEquals(BrokerConfig.DEFAULT_SEND_TIMEOUT_MS, c.sendTimeoutMs());
        assertEquals(1, c.configRetryMax(), "ниже минимума: используется минимум");
        assertEquals((short) 3, c.topicReplication());
    }

    @Test
    @DisplayName("Pass-through ключи отделяются по префиксу клиента, служебные ключи не попадают")
    void passThroughByPrefix() {
        Configuration cfg = base();
        cfg.set("mbus.producer.compression.type", "lz4");
        cfg.set("mbus.consumer.session.timeout.ms", "45000");
        cfg.set("mbus.admin.retries", "7");
        cfg.set(BrokerConfig.Keys.ADMIN_TIMEOUT_MS, "1234");

        BrokerConfig c = BrokerConfig.from(cfg);

        assertEquals("lz4", c.producerOverrides().get("compression.type"));
        assertEquals("45000", c.consumerOverrides().get("session.timeout.ms"));
        assertEquals("7", c.adminOverrides().get("retries"));
        assertFalse(c.adminOverrides().containsKey("timeout.ms"));
        assertEquals(1234L, c.adminTimeoutMs());
    }

    @Test
    @DisplayName("Отсутствие bootstrap.servers: ошибка конфигурации")
    void bootstrapRequired() {
        Configuration cfg = new Configuration(false);
        assertThrows(IllegalArgumentException.class, () -> BrokerConfig.from(cfg));
    }
}
