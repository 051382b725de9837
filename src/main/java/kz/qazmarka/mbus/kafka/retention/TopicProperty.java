package kz.qazmarka.mbus.kafka.retention;

import org.apache.kafka.common.config.TopicConfig;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Допустимые свойства типа сообщений и соответствующие им ключи конфигурации Kafka-темы.
 */
public enum TopicProperty {
    EXPIRE_TIME_MS("expire_time_ms", TopicConfig.RETENTION_MS_CONFIG),
    DATA_LIMIT_BYTES("data_limit_bytes", TopicConfig.SEGMENT_BYTES_CONFIG),
    FILE_DELETE_MS("file_delete_ms", TopicConfig.FILE_DELETE_DELAY_MS_CONFIG);

    private final String key;
    private final String kafkaKey;

    TopicProperty(String key, String kafkaKey) {
        this.key = key;
        this.kafkaKey = kafkaKey;
    }

    /** Имя свойства в API message bus. */
    public String key() {
        return key;
    }

    /** Ключ конфигурации темы Kafka. */
    public String kafkaKey() {
        return kafkaKey;
    }

    /**
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT} для ключа вне списка
     */
    public static TopicProperty fromKey(String key, String messageType) {
        for (TopicProperty p : values()) {
            if (p.key.equals(key)) {
                return p;
            }
        }
        throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                "Недопустимое свойство '{}' для типа сообщений '{}'", key, messageType);
    }
}
