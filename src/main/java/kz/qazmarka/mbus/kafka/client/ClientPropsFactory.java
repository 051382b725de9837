package kz.qazmarka.mbus.kafka.client;

import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;

import kz.qazmarka.mbus.ClientSpec;
import kz.qazmarka.mbus.config.BrokerConfig;

/**
 * Построитель настроек клиентов Kafka. Для каждого вида клиента формирует {@link Properties}:
 *  - базовые обязательные параметры (bootstrap, client.id);
 *  - таймауты из {@link BrokerConfig} (socket → request.timeout.ms, send → delivery.timeout.ms);
 *  - безопасные дефолты продьюсера (acks=all, идемпотентность, max.in.flight &lt;= 5);
 *  - pass-through: только валидные ключи соответствующего клиента из {@code mbus.<вид>.*}, если не заданы выше.
 */
final class ClientPropsFactory {

    private final BrokerConfig config;

    ClientPropsFactory(BrokerConfig config) {
        this.config = config;
    }

    Properties admin(String clientId) {
        Properties props = base(clientId);
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutString(config.socketTimeoutMs()));
        applyPassThrough(props, config.adminOverrides(), AdminClientConfig.configNames());
        return props;
    }

    Properties producer(String clientId) {
        Properties props = base(clientId);
        long sendTimeout = config.sendTimeoutMs();
        // delivery.timeout.ms обязан быть >= linger.ms + request.timeout.ms, иначе KafkaProducer не стартует
        long requestTimeout = Math.min(config.socketTimeoutMs(), sendTimeout);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutString(requestTimeout));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, timeoutString(sendTimeout));
        props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        applyPassThrough(props, config.producerOverrides(), ProducerConfig.configNames());
        enforceIdempotentOrdering(props);
        return props;
    }

    Properties consumer(ClientSpec spec) {
        Properties props = base(spec.clientId());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, spec.consumerGroup());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, String.valueOf(Boolean.TRUE.equals(spec.autoAck())));
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, spec.offset());
        // receive() выдаёт по одному сообщению за вызов
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
        applyPassThrough(props, config.consumerOverrides(), ConsumerConfig.configNames());
        return props;
    }

    private Properties base(String clientId) {
        Properties props = new Properties();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, config.bootstrap());
        props.put(CommonClientConfigs.CLIENT_ID_CONFIG, clientId);
        return props;
    }

    private static void applyPassThrough(Properties props, Map<String, String> overrides, Set<String> knownKeys) {
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            String key = entry.getKey();
            if (knownKeys.contains(key)) {
                props.putIfAbsent(key, entry.getValue());
            }
        }
    }

    /**
     * Жестко фиксирует связку идемпотентности и порядка: acks=all, бесконечные retry и max.in.flight&lt;=5.
     */
    private static void enforceIdempotentOrdering(Properties props) {
        String idempotence = String.valueOf(props.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG));
        if ("false".equalsIgnoreCase(idempotence)) {
            return;
        }
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, String.valueOf(Integer.MAX_VALUE));
        int maxInFlight = parseIntOrDefault(
                props.getProperty(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION), 5);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, String.valueOf(Math.min(5, maxInFlight)));
    }

    private static int parseIntOrDefault(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignore) {
            return defaultValue;
        }
    }

    private static String timeoutString(long ms) {
        return String.valueOf(Math.min(ms, Integer.MAX_VALUE));
    }
}
