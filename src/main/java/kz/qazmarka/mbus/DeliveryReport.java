package kz.qazmarka.mbus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.RecordMetadata;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Результат вызова send: по одному future подтверждения на сообщение, в порядке отправки.
 *
 * В синхронном режиме к моменту возврата все future уже завершены успешно. В асинхронном часть из них
 * может быть ещё в полёте; {@link #awaitAll(long)} дожидается их с общим дедлайном.
 */
public final class DeliveryReport {

    private static final String TIMEOUT_MSG = "Таймаут ожидания подтверждений от Kafka";

    private final String messageType;
    private final SendMode mode;
    private final List<Future<RecordMetadata>> deliveries;

    public DeliveryReport(String messageType, SendMode mode, List<Future<RecordMetadata>> deliveries) {
        this.messageType = messageType;
        this.mode = mode;
        this.deliveries = Collections.unmodifiableList(new ArrayList<>(deliveries));
    }

    public String messageType() {
        return messageType;
    }

    public SendMode mode() {
        return mode;
    }

    public List<Future<RecordMetadata>> deliveries() {
        return deliveries;
    }

    public int size() {
        return deliveries.size();
    }

    /** Число сообщений, подтверждение которых ещё не получено. */
    public int pendingCount() {
        int n = 0;
        for (Future<RecordMetadata> f : deliveries) {
            if (!f.isDone()) {
                n++;
            }
        }
        return n;
    }

    /**
     * Дожидается подтверждения всех сообщений, общий дедлайн {@code timeoutMs}.
     *
     * @return метаданные записей в порядке отправки
     * @throws MessageBusException {@link ErrorKind#TIMEOUT} при ошибке доставки или истечении дедлайна,
     *         {@link ErrorKind#INTERRUPTED} при прерывании потока
     */
    public List<RecordMetadata> awaitAll(long timeoutMs) {
        final long deadlineNs = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<RecordMetadata> out = new ArrayList<>(deliveries.size());
        for (int i = 0, n = deliveries.size(); i < n; i++) {
            out.add(awaitOne(deliveries.get(i), deadlineNs, i));
        }
        return out;
    }

    private RecordMetadata awaitOne(Future<RecordMetadata> f, long deadlineNs, int index) {
        try {
            if (f.isDone()) {
                return f.get();
            }
            long leftNs = deadlineNs - System.nanoTime();
            if (leftNs <= 0L) {
                throw new TimeoutException(TIMEOUT_MSG);
            }
            return f.get(leftNs, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MessageBusException(ErrorKind.INTERRUPTED,
                    "Ожидание подтверждения сообщения #{} типа '{}' прервано", index, messageType, ie);
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = KafkaErrorMapper.unwrap(e);
            throw new MessageBusException(ErrorKind.TIMEOUT,
                    "Доставка сообщения #{} типа '{}' не подтверждена: {}",
                    index, messageType, KafkaErrorMapper.describe(cause), cause);
        }
    }

    @Override
    public String toString() {
        return "DeliveryReport{messageType=" + messageType + ", mode=" + mode
                + ", size=" + deliveries.size() + ", pending=" + pendingCount() + '}';
    }
}
