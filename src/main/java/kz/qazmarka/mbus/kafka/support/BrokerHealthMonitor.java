package kz.qazmarka.mbus.kafka.support;

import java.util.Collection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.kafka.common.Node;
import org.apache.kafka.common.errors.DisconnectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;

/**
 * Асинхронный сигнал «все брокеры недоступны».
 *
 * Сигнал может быть поднят из любого потока ({@link #reportAllBrokersDown(Throwable)}), например
 * наблюдателем метрик клиента или операционным инструментом, а также чтением метаданных кластера
 * ({@link #reportMetadataFailure(Throwable)}). Ошибки доставки отдельных записей и commit сигнал не поднимают. Любая публичная операция адаптера и каждый шаг
 * подтверждающего цикла вызывают {@link #checkAvailable()}: первый вызов после сигнала бросает
 * {@link ErrorKind#SERVICE_UNAVAILABLE} и сбрасывает сигнал.
 */
public final class BrokerHealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(BrokerHealthMonitor.class);

    private final AtomicReference<Throwable> downSignal = new AtomicReference<>();

    /** Поднимает сигнал недоступности; повторные вызовы до срабатывания сохраняют первую причину. */
    public void reportAllBrokersDown(Throwable cause) {
        Throwable signal = (cause == null) ? new IllegalStateException("все брокеры недоступны") : cause;
        if (downSignal.compareAndSet(null, signal)) {
            LOG.warn("Получен сигнал недоступности кластера Kafka: {}", KafkaErrorMapper.describe(signal));
        }
    }

    /**
     * Поднимает сигнал, если чтение метаданных кластера упало из-за таймаута метаданных или разрыва
     * соединения. Вызывается только для кластерных запросов (listTopics), не для доставки и commit.
     *
     * @return {@code true}, если ошибка признана недоступностью кластера
     */
    public boolean reportMetadataFailure(Throwable error) {
        Throwable unreachable = clusterUnreachableCause(error);
        if (unreachable == null) {
            return false;
        }
        reportAllBrokersDown(unreachable);
        return true;
    }

    public boolean isDownReported() {
        return downSignal.get() != null;
    }

    /**
     * Бросает {@link ErrorKind#SERVICE_UNAVAILABLE}, если с прошлой проверки был поднят сигнал.
     */
    public void checkAvailable() {
        Throwable cause = downSignal.getAndSet(null);
        if (cause != null) {
            throw unavailable(cause);
        }
    }

    /**
     * Явная проверка кластера через describeCluster: ошибка или пустой список узлов сразу приводят
     * к {@link ErrorKind#SERVICE_UNAVAILABLE}. Отложенный сигнал при этом не трогается.
     *
     * @return число доступных узлов
     */
    public int probe(KafkaTopicAdmin admin, long timeoutMs) {
        Collection<Node> nodes;
        try {
            nodes = admin.describeClusterNodes().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MessageBusException(ErrorKind.INTERRUPTED, "Проверка кластера Kafka прервана", ie);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            throw unavailable(KafkaErrorMapper.unwrap(e));
        }
        if (nodes == null || nodes.isEmpty()) {
            throw unavailable(new IllegalStateException("describeCluster вернул пустой список узлов"));
        }
        return nodes.size();
    }

    static Throwable clusterUnreachableCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof org.apache.kafka.common.errors.TimeoutException || t instanceof DisconnectException) {
                return t;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static MessageBusException unavailable(Throwable cause) {
        LOG.error("Сервис(ы) Kafka недоступны: {}", KafkaErrorMapper.describe(cause));
        return new MessageBusException(ErrorKind.SERVICE_UNAVAILABLE,
                "Сервис(ы) Kafka недоступны: {}", KafkaErrorMapper.describe(cause), cause);
    }
}
