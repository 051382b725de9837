package kz.qazmarka.mbus.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;

/**
 * Иммутабельная конфигурация адаптера, прочитанная один раз из Hadoop {@link Configuration}.
 *
 * Содержит:
 *  - адреса брокеров и таймауты клиентов (socket/send/receive/admin);
 *  - бюджеты подтверждающих циклов и шаг линейного backoff;
 *  - паузу между фазами purge;
 *  - pass-through свойства для AdminClient/Producer/Consumer ({@code mbus.admin.*}, {@code mbus.producer.*},
 *    {@code mbus.consumer.*}).
 */
public final class BrokerConfig {

    /** Ожидание одного poll при receive по умолчанию, мс. */
    static final long DEFAULT_RECEIVE_TIMEOUT_MS = 500L;
    /** Таймаут сокета admin/producer по умолчанию, мс. */
    static final long DEFAULT_SOCKET_TIMEOUT_MS = 15000L;
    /** Таймаут доставки одного сообщения по умолчанию, мс. */
    static final long DEFAULT_SEND_TIMEOUT_MS = 30000L;
    /** Таймаут ожидания результата задачи AdminClient по умолчанию, мс. */
    static final long DEFAULT_ADMIN_TIMEOUT_MS = 60000L;
    /** Фактор репликации создаваемых тем по умолчанию. */
    static final short DEFAULT_TOPIC_REPLICATION = 1;
    /** Повторов подтверждения метаданных по умолчанию (итого 16 проверок). */
    static final int DEFAULT_LIST_RETRY_MAX = 15;
    /** Попыток alter-config по умолчанию. */
    static final int DEFAULT_CONFIG_RETRY_MAX = 3;
    /** Шаг линейного backoff по умолчанию, мс. */
    static final long DEFAULT_BACKOFF_STEP_MS = 1000L;
    /** Пауза между фазами purge по умолчанию, мс. */
    static final long DEFAULT_PURGE_GRACE_MS = 1000L;

    /** Публичные ключи {@code mbus.*}. */
    public static final class Keys {
        public static final String BOOTSTRAP = "mbus.kafka.bootstrap.servers";
        public static final String RECEIVE_TIMEOUT_MS = "mbus.receive.timeout.ms";
        public static final String SOCKET_TIMEOUT_MS = "mbus.socket.timeout.ms";
        public static final String SEND_TIMEOUT_MS = "mbus.send.timeout.ms";
        public static final String ADMIN_TIMEOUT_MS = "mbus.admin.timeout.ms";
        public static final String TOPIC_REPLICATION = "mbus.topic.replication";
        public static final String LIST_RETRY_MAX = "mbus.retry.list.max";
        public static final String CONFIG_RETRY_MAX = "mbus.retry.config.max";
        public static final String BACKOFF_STEP_MS = "mbus.retry.backoff.step.ms";
        public static final String PURGE_GRACE_MS = "mbus.purge.grace.ms";
        public static final String ADMIN_PREFIX = "mbus.admin.";
        public static final String PRODUCER_PREFIX = "mbus.producer.";
        public static final String CONSUMER_PREFIX = "mbus.consumer.";

        private Keys() {
        }
    }

    private final String bootstrap;
    private final long receiveTimeoutMs;
    private final long socketTimeoutMs;
    private final long sendTimeoutMs;
    private final long adminTimeoutMs;
    private final short topicReplication;
    private final int listRetryMax;
    private final int configRetryMax;
    private final long backoffStepMs;
    private final long purgeGraceMs;
    private final Map<String, String> adminOverrides;
    private final Map<String, String> producerOverrides;
    private final Map<String, String> consumerOverrides;

    private BrokerConfig(Builder b) {
        this.bootstrap = b.bootstrap;
        this.receiveTimeoutMs = b.receiveTimeoutMs;
        this.socketTimeoutMs = b.socketTimeoutMs;
        this.sendTimeoutMs = b.sendTimeoutMs;
        this.adminTimeoutMs = b.adminTimeoutMs;
        this.topicReplication = b.topicReplication;
        this.listRetryMax = b.listRetryMax;
        this.configRetryMax = b.configRetryMax;
        this.backoffStepMs = b.backoffStepMs;
        this.purgeGraceMs = b.purgeGraceMs;
        this.adminOverrides = freeze(b.adminOverrides);
        this.producerOverrides = freeze(b.producerOverrides);
        this.consumerOverrides = freeze(b.consumerOverrides);
    }

    /**
     * Читает конфигурацию {@code mbus.*}.
     *
     * @throws IllegalArgumentException если не задан {@value Keys#BOOTSTRAP}
     */
    public static BrokerConfig from(Configuration cfg) {
        return new BrokerConfigLoader().load(cfg);
    }

    public static Builder builder(String bootstrap) {
        return new Builder(bootstrap);
    }

    public String bootstrap() { return bootstrap; }

    public long receiveTimeoutMs() { return receiveTimeoutMs; }

    public long socketTimeoutMs() { return socketTimeoutMs; }

    public long sendTimeoutMs() { return sendTimeoutMs; }

    public long adminTimeoutMs() { return adminTimeoutMs; }

    public short topicReplication() { return topicReplication; }

    public int listRetryMax() { return listRetryMax; }

    public int configRetryMax() { return configRetryMax; }

    public long backoffStepMs() { return backoffStepMs; }

    public long purgeGraceMs() { return purgeGraceMs; }

    public Map<String, String> adminOverrides() { return adminOverrides; }

    public Map<String, String> producerOverrides() { return producerOverrides; }

    public Map<String, String> consumerOverrides() { return consumerOverrides; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(192);
        sb.append("BrokerConfig{")
          .append("bootstrap=").append(bootstrap)
          .append(", receiveTimeoutMs=").append(receiveTimeoutMs)
          .append(", socketTimeoutMs=").append(socketTimeoutMs)
          .append(", sendTimeoutMs=").append(sendTimeoutMs)
          .append(", adminTimeoutMs=").append(adminTimeoutMs)
          .append(", listRetryMax=").append(listRetryMax)
          .append(", configRetryMax=").append(configRetryMax)
          .append(", backoffStepMs=").append(backoffStepMs)
          .append(", purgeGraceMs=").append(purgeGraceMs)
          .append('}');
        return sb.toString();
    }

    private static Map<String, String> freeze(Map<String, String> src) {
        if (src == null || src.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(src));
    }

    /**
     * Пошаговая сборка конфигурации; значения по умолчанию совпадают с дефолтами ключей {@code mbus.*}.
     */
    public static final class Builder {
        private final String bootstrap;
        private long receiveTimeoutMs = DEFAULT_RECEIVE_TIMEOUT_MS;
        private long socketTimeoutMs = DEFAULT_SOCKET_TIMEOUT_MS;
        private long sendTimeoutMs = DEFAULT_SEND_TIMEOUT_MS;
        private long adminTimeoutMs = DEFAULT_ADMIN_TIMEOUT_MS;
        private short topicReplication = DEFAULT_TOPIC_REPLICATION;
        private int listRetryMax = DEFAULT_LIST_RETRY_MAX;
        private int configRetryMax = DEFAULT_CONFIG_RETRY_MAX;
        private long backoffStepMs = DEFAULT_BACKOFF_STEP_MS;
        private long purgeGraceMs = DEFAULT_PURGE_GRACE_MS;
        private Map<String, String> adminOverrides = Collections.emptyMap();
        private Map<String, String> producerOverrides = Collections.emptyMap();
        private Map<String, String> consumerOverrides = Collections.emptyMap();

        private Builder(String bootstrap) {
            if (bootstrap == null || bootstrap.trim().isEmpty()) {
                throw new IllegalArgumentException("Отсутствует обязательный параметр bootstrap.servers: "
                        + Keys.BOOTSTRAP + " пустой или не задан");
            }
            this.bootstrap = bootstrap.trim();
        }

        public Builder receiveTimeoutMs(long v) { this.receiveTimeoutMs = v; return this; }
        public Builder socketTimeoutMs(long v) { this.socketTimeoutMs = v; return this; }
        public Builder sendTimeoutMs(long v) { this.sendTimeoutMs = v; return this; }
        public Builder adminTimeoutMs(long v) { this.adminTimeoutMs = v; return this; }
        public Builder topicReplication(short v) { this.topicReplication = v; return this; }
        public Builder listRetryMax(int v) { this.listRetryMax = v; return this; }
        public Builder configRetryMax(int v) { this.configRetryMax = v; return this; }
        public Builder backoffStepMs(long v) { this.backoffStepMs = v; return this; }
        public Builder purgeGraceMs(long v) { this.purgeGraceMs = v; return this; }
        public Builder adminOverrides(Map<String, String> v) { this.adminOverrides = v; return this; }
        public Builder producerOverrides(Map<String, String> v) { this.producerOverrides = v; return this; }
        public Builder consumerOverrides(Map<String, String> v) { this.consumerOverrides = v; return this; }

        public BrokerConfig build() {
            if (configRetryMax < 1) {
                throw new IllegalArgumentException("configRetryMax должен быть >= 1");
            }
            if (listRetryMax < 0) {
                throw new IllegalArgumentException("listRetryMax должен быть >= 0");
            }
            return new BrokerConfig(this);
        }
    }
}
