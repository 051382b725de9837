package kz.qazmarka.mbus.kafka.producer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.DeliveryReport;
import kz.qazmarka.mbus.SendMode;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.client.ClientRegistry;
import kz.qazmarka.mbus.kafka.client.ProducerHandle;
import kz.qazmarka.mbus.kafka.topic.TopicNameValidator;

/**
 * Отправка пачки сообщений через продьюсер из реестра.
 *
 * <ul>
 *   <li>{@link SendMode#SYNC}: после каждого сообщения {@code flush()} и ожидание подтверждения
 *   (не дольше send timeout); следующее сообщение уходит только после успеха предыдущего;</li>
 *   <li>{@link SendMode#ASYNC}: после каждого сообщения короткое ожидание подтверждения ({@code pollTimeoutMs});
 *   не успевшее подтверждение не ошибка, уже известная ошибка доставки прерывает пачку.</li>
 * </ul>
 * Ошибка доставки сообщается как {@link ErrorKind#TIMEOUT}.
 */
public final class MessageSender {

    private static final Logger LOG = LoggerFactory.getLogger(MessageSender.class);

    /** Ожидание подтверждения в асинхронном режиме по умолчанию. */
    public static final long DEFAULT_POLL_TIMEOUT_MS = 100L;

    private final ClientRegistry registry;
    private final long sendTimeoutMs;

    public MessageSender(ClientRegistry registry, long sendTimeoutMs) {
        this.registry = registry;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    public DeliveryReport send(String producerId, String messageType, SendMode mode, List<String> messages) {
        return send(producerId, messageType, mode, messages, DEFAULT_POLL_TIMEOUT_MS);
    }

    /**
     * @throws MessageBusException {@link ErrorKind#SERVICE_NOT_INITIALIZED} без продьюсера,
     *         {@link ErrorKind#TIMEOUT} при ошибке доставки
     */
    public DeliveryReport send(String producerId,
                               String messageType,
                               SendMode mode,
                               List<String> messages,
                               long pollTimeoutMs) {
        ProducerHandle handle = registry.producer(producerId);
        TopicNameValidator.requireValid(messageType);
        SendMode effective = (mode == null) ? SendMode.ASYNC : mode;
        List<String> batch = (messages == null) ? Collections.<String>emptyList() : messages;
        if (LOG.isDebugEnabled()) {
            LOG.debug("Продьюсер '{}' отправляет {} сообщ. типа '{}' в режиме {}",
                    producerId, batch.size(), messageType, effective);
        }
        Producer<byte[], byte[]> producer = handle.producer();
        List<Future<RecordMetadata>> sent = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            String message = batch.get(i);
            if (message == null) {
                throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                        "Сообщение #{} для типа '{}' равно null", i, messageType);
            }
            Future<RecordMetadata> f = submit(producer, messageType, message, i);
            sent.add(f);
            if (effective == SendMode.SYNC) {
                flush(producer, messageType);
                awaitDelivery(f, sendTimeoutMs, messageType, i, true);
            } else {
                awaitDelivery(f, pollTimeoutMs, messageType, i, false);
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Продьюсер '{}' передал {} сообщ. типа '{}'", producerId, sent.size(), messageType);
        }
        return new DeliveryReport(messageType, effective, sent);
    }

    private static Future<RecordMetadata> submit(Producer<byte[], byte[]> producer,
                                                 String messageType,
                                                 String message,
                                                 int index) {
        try {
            return producer.send(new ProducerRecord<>(messageType, message.getBytes(StandardCharsets.UTF_8)));
        } catch (RuntimeException e) {
            throw deliveryFailed(messageType, index, e);
        }
    }

    private static void flush(Producer<byte[], byte[]> producer, String messageType) {
        try {
            producer.flush();
        } catch (RuntimeException e) {
            throw deliveryFailed(messageType, -1, e);
        }
    }

    /**
     * @param strict в строгом режиме неподтверждённое за {@code timeoutMs} сообщение считается ошибкой
     */
    private static void awaitDelivery(Future<RecordMetadata> f,
                                      long timeoutMs,
                                      String messageType,
                                      int index,
                                      boolean strict) {
        try {
            f.get(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            if (strict) {
                throw deliveryFailed(messageType, index, te);
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Подтверждение сообщения #{} типа '{}' ещё не получено", index, messageType);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MessageBusException(ErrorKind.INTERRUPTED,
                    "Ожидание подтверждения сообщения #{} типа '{}' прервано", index, messageType, ie);
        } catch (ExecutionException ee) {
            throw deliveryFailed(messageType, index, ee);
        }
    }

    private static MessageBusException deliveryFailed(String messageType, int index, Throwable error) {
        Throwable cause = KafkaErrorMapper.unwrap(error);
        ErrorKind kind = KafkaErrorMapper.kindOf(cause, ErrorKind.TIMEOUT);
        if (kind != ErrorKind.INTERRUPTED) {
            kind = ErrorKind.TIMEOUT;
        }
        LOG.error("Доставка сообщения #{} типа '{}' не удалась: {}", index, messageType, KafkaErrorMapper.describe(cause));
        return new MessageBusException(kind, "Доставка сообщения #{} типа '{}' не удалась: {}",
                index, messageType, KafkaErrorMapper.describe(cause), cause);
    }
}
