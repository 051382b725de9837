package kz.qazmarka.mbus.kafka.consumer;

import java.time.Duration;
import java.util.Map;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.ReceiveResult;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.client.ClientRegistry;
import kz.qazmarka.mbus.kafka.client.ConsumerHandle;

/**
 * Получение сообщений по одному и ручное подтверждение смещений.
 *
 * Режимы таймаута receive:
 * <ul>
 *   <li>{@code null}: один опрос с таймаутом из конфигурации;</li>
 *   <li>{@code 0}: блокирующий режим: опросы с таймаутом из конфигурации, пока не придёт сообщение;
 *   пустой результат в этом режиме не возвращается;</li>
 *   <li>положительное значение: один опрос не дольше указанного времени.</li>
 * </ul>
 * Прерывание потока или {@link #wakeup(String)} из другого потока превращаются в {@link ErrorKind#INTERRUPTED}.
 */
public final class MessageReceiver {

    private static final Logger LOG = LoggerFactory.getLogger(MessageReceiver.class);

    private final ClientRegistry registry;
    private final long receiveTimeoutMs;

    public MessageReceiver(ClientRegistry registry, long receiveTimeoutMs) {
        this.registry = registry;
        this.receiveTimeoutMs = receiveTimeoutMs;
    }

    /**
     * @throws MessageBusException {@link ErrorKind#SERVICE_NOT_INITIALIZED} без консьюмера,
     *         {@link ErrorKind#OPERATION_FAILED} при ошибке опроса, {@link ErrorKind#INTERRUPTED} при прерывании
     */
    public ReceiveResult receive(String consumerId, Long timeoutMs) {
        ConsumerHandle handle = registry.consumer(consumerId);
        if (timeoutMs != null && timeoutMs < 0L) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                    "Таймаут receive не может быть отрицательным: {}", timeoutMs);
        }
        boolean blocking = timeoutMs != null && timeoutMs == 0L;
        long pollMs = (timeoutMs == null || blocking) ? receiveTimeoutMs : timeoutMs;
        if (LOG.isDebugEnabled()) {
            LOG.debug("Консьюмер '{}' получает сообщение (timeout={}, blocking={})", consumerId, timeoutMs, blocking);
        }
        Consumer<byte[], byte[]> consumer = handle.consumer();
        try {
            while (true) {
                if (Thread.currentThread().isInterrupted()) {
                    throw interrupted(consumerId, null);
                }
                ConsumerRecord<byte[], byte[]> record = handle.buffered().pollFirst();
                if (record == null) {
                    ConsumerRecords<byte[], byte[]> polled = consumer.poll(Duration.ofMillis(pollMs));
                    for (ConsumerRecord<byte[], byte[]> r : polled) {
                        handle.buffered().addLast(r);
                    }
                    record = handle.buffered().pollFirst();
                }
                if (record != null) {
                    handle.markDelivered(record);
                    return ReceiveResult.data(record.value(), record.topic(), record.partition(), record.offset());
                }
                if (!blocking) {
                    return ReceiveResult.empty();
                }
            }
        } catch (WakeupException | InterruptException e) {
            throw interrupted(consumerId, e);
        } catch (KafkaException e) {
            LOG.error("poll({}) консьюмера '{}' не смог получить сообщение: {}",
                    pollMs, consumerId, KafkaErrorMapper.describe(e));
            throw new MessageBusException(ErrorKind.OPERATION_FAILED,
                    "poll({}) консьюмера '{}' не смог получить сообщение: {}",
                    pollMs, consumerId, KafkaErrorMapper.describe(e), e);
        }
    }

    /**
     * Синхронно фиксирует смещения выданных сообщений.
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT}, если у консьюмера включён auto-ack
     */
    public void ack(String consumerId) {
        ConsumerHandle handle = registry.consumer(consumerId);
        if (handle.autoAck()) {
            LOG.error("Консьюмер '{}' работает с auto_ack=true, ручное подтверждение недоступно", consumerId);
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                    "Консьюмер '{}' работает с auto_ack=true, ручное подтверждение недоступно", consumerId);
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = handle.deliveredOffsets();
        try {
            if (offsets.isEmpty()) {
                handle.consumer().commitSync();
            } else {
                handle.consumer().commitSync(offsets);
            }
        } catch (WakeupException | InterruptException e) {
            throw interrupted(consumerId, e);
        } catch (RuntimeException e) {
            LOG.error("commitSync() консьюмера '{}' завершился ошибкой: {}", consumerId, KafkaErrorMapper.describe(e));
            throw KafkaErrorMapper.wrap("commitSync", consumerId, e, ErrorKind.OPERATION_FAILED);
        }
        handle.acknowledged(offsets);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Консьюмер '{}' подтвердил смещения {}", consumerId, offsets);
        }
    }

    /** Прерывает блокирующий receive этого консьюмера из другого потока. */
    public void wakeup(String consumerId) {
        registry.consumer(consumerId).consumer().wakeup();
    }

    private static MessageBusException interrupted(String consumerId, RuntimeException cause) {
        LOG.error("Получено прерывание во время получения сообщения консьюмером '{}'", consumerId);
        if (cause instanceof InterruptException) {
            Thread.currentThread().interrupt();
        }
        if (cause == null) {
            return new MessageBusException(ErrorKind.INTERRUPTED,
                    "Получено прерывание во время получения сообщения консьюмером '{}'", consumerId);
        }
        return new MessageBusException(ErrorKind.INTERRUPTED,
                "Получено прерывание во время получения сообщения консьюмером '{}'", consumerId, cause);
    }
}
