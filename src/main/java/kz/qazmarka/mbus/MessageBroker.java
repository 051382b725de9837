package kz.qazmarka.mbus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Контракт message bus, не зависящий от конкретного брокера: регистрация типов сообщений,
 * отправка, получение, подтверждение, настройка и очистка.
 *
 * Все операции блокируют вызывающий поток до результата. Ошибки сообщаются через
 * {@link MessageBusException} с видом из {@link kz.qazmarka.mbus.error.ErrorKind}.
 * Один id клиента не должен использоваться из двух потоков одновременно.
 */
public interface MessageBroker extends AutoCloseable {

    /** Короткое имя реализации брокера. */
    String name();

    /** Создаёт клиента либо проверяет совместимость уже созданного. */
    void initClient(ClientSpec spec);

    /** То же для строкового вида клиента и плоской карты параметров. */
    default void initClient(String kind, Map<String, ?> conf) {
        initClient(ClientSpec.fromMap(kind, conf));
    }

    Set<String> listMessageTypes(String adminId);

    void registerMessageType(String adminId, List<String> messageTypes, int partitions);

    void deregisterMessageType(String adminId, List<String> messageTypes);

    /** Увеличивает число партиций; уменьшение недопустимо. */
    void addConcurrency(String adminId, String messageType, int concurrencyCount);

    /**
     * Отправляет сообщения (UTF-8) в порядке списка.
     *
     * @param pollTimeoutMs ограничение ожидания подтверждения в асинхронном режиме
     */
    DeliveryReport send(String producerId, String messageType, SendMode mode, List<String> messages, long pollTimeoutMs);

    DeliveryReport send(String producerId, String messageType, SendMode mode, List<String> messages);

    /**
     * Получает одно сообщение.
     *
     * @param timeoutMs {@code null}: таймаут из конфигурации; {@code 0}: ждать до появления сообщения;
     *                  положительное значение: один опрос не дольше указанного времени
     */
    ReceiveResult receive(String consumerId, Long timeoutMs);

    default ReceiveResult receive(String consumerId) {
        return receive(consumerId, null);
    }

    /** Синхронно фиксирует смещения консьюмера. */
    void ack(String consumerId);

    /** Удаляет все сообщения типа, сохраняя сам тип и его retention. */
    void delete(String adminId, String messageType);

    void configureMessageType(String adminId, String messageType, Map<String, ?> properties);

    /** Свойства {@code expire_time_ms} и {@code data_limit_bytes} обязательны оба. */
    void setMessageTypeExpiry(String adminId, String messageType, Map<String, ?> properties);

    default void setMessageTypeExpiry(String adminId, String messageType, long expireTimeMs, long dataLimitBytes) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("expire_time_ms", expireTimeMs);
        props.put("data_limit_bytes", dataLimitBytes);
        setMessageTypeExpiry(adminId, messageType, props);
    }

    /** Закрывает все соединения брокера. */
    @Override
    void close();
}
