package kz.qazmarka.mbus.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.config.BrokerConfig.Keys;

/**
 * Загружает {@link BrokerConfig} из Hadoop {@link Configuration}, инкапсулируя парсинг и нижние границы значений.
 */
final class BrokerConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(BrokerConfigLoader.class);

    BrokerConfig load(Configuration cfg) {
        BrokerConfig.Builder builder = BrokerConfig.builder(cfg.getTrimmed(Keys.BOOTSTRAP));
        builder.receiveTimeoutMs(readLong(cfg, Keys.RECEIVE_TIMEOUT_MS, BrokerConfig.DEFAULT_RECEIVE_TIMEOUT_MS, 1L))
               .socketTimeoutMs(readLong(cfg, Keys.SOCKET_TIMEOUT_MS, BrokerConfig.DEFAULT_SOCKET_TIMEOUT_MS, 1L))
               .sendTimeoutMs(readLong(cfg, Keys.SEND_TIMEOUT_MS, BrokerConfig.DEFAULT_SEND_TIMEOUT_MS, 1L))
               .adminTimeoutMs(readLong(cfg, Keys.ADMIN_TIMEOUT_MS, BrokerConfig.DEFAULT_ADMIN_TIMEOUT_MS, 1L))
               .topicReplication((short) readInt(cfg, Keys.TOPIC_REPLICATION, BrokerConfig.DEFAULT_TOPIC_REPLICATION, 1))
               .listRetryMax(readInt(cfg, Keys.LIST_RETRY_MAX, BrokerConfig.DEFAULT_LIST_RETRY_MAX, 0))
               .configRetryMax(readInt(cfg, Keys.CONFIG_RETRY_MAX, BrokerConfig.DEFAULT_CONFIG_RETRY_MAX, 1))
               .backoffStepMs(readLong(cfg, Keys.BACKOFF_STEP_MS, BrokerConfig.DEFAULT_BACKOFF_STEP_MS, 0L))
               .purgeGraceMs(readLong(cfg, Keys.PURGE_GRACE_MS, BrokerConfig.DEFAULT_PURGE_GRACE_MS, 0L))
               .adminOverrides(collectPrefixed(cfg, Keys.ADMIN_PREFIX))
               .producerOverrides(collectPrefixed(cfg, Keys.PRODUCER_PREFIX))
               .consumerOverrides(collectPrefixed(cfg, Keys.CONSUMER_PREFIX));
        BrokerConfig result = builder.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Загружена конфигурация message bus: {}", result);
        }
        return result;
    }

    private static long readLong(Configuration cfg, String key, long defVal, long minVal) {
        String raw = cfg.getTrimmed(key);
        if (raw == null || raw.isEmpty()) {
            return defVal;
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            LOG.warn("Некорректное значение {}='{}': использую значение по умолчанию {}", key, raw, defVal);
            return defVal;
        }
        if (value < minVal) {
            LOG.warn("Значение {}={} меньше минимума {}: использую минимум", key, value, minVal);
            return minVal;
        }
        return value;
    }

    private static int readInt(Configuration cfg, String key, int defVal, int minVal) {
        long value = readLong(cfg, key, defVal, minVal);
        return (value > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) value;
    }

    /**
     * Собирает ключи с префиксом в «родные» имена свойств клиента Kafka (префикс отрезается).
     * Служебные ключи адаптера, попадающие под тот же префикс, сюда не входят.
     */
    private static Map<String, String> collectPrefixed(Configuration cfg, String prefix) {
        Map<String, String> out = new LinkedHashMap<>();
        int prefixLen = prefix.length();
        for (Map.Entry<String, String> entry : cfg) {
            String key = entry.getKey();
            if (key.startsWith(prefix) && !Keys.ADMIN_TIMEOUT_MS.equals(key) && key.length() > prefixLen) {
                out.put(key.substring(prefixLen), entry.getValue());
            }
        }
        return out;
    }
}
