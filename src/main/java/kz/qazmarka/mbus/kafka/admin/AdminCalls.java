package kz.qazmarka.mbus.kafka.admin;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.common.KafkaFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;

/**
 * Синхронное разрешение асинхронных задач AdminClient с единым переводом ошибок.
 */
public final class AdminCalls {

    private static final Logger LOG = LoggerFactory.getLogger(AdminCalls.class);

    private AdminCalls() {
    }

    /**
     * Дожидается результата задачи не дольше {@code timeoutMs}.
     *
     * @param operation имя операции для контекста ошибки
     * @param resource  имя ресурса (тема, конфиг) для контекста ошибки
     * @param fallback  вид ошибки для нераспознанных сбоев
     */
    public static <T> T await(KafkaFuture<T> future,
                              long timeoutMs,
                              String operation,
                              String resource,
                              ErrorKind fallback) {
        if (future == null) {
            throw new MessageBusException(fallback, "{} для '{}': AdminClient не вернул future", operation, resource);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw KafkaErrorMapper.wrap(operation, resource, ie, fallback);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            MessageBusException wrapped = KafkaErrorMapper.wrap(operation, resource, e, fallback);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Задача AdminClient {} для '{}' завершилась ошибкой", operation, resource, e);
            }
            throw wrapped;
        }
    }

    /**
     * Дожидается всех задач batch-операции; первая ошибка прерывает ожидание.
     * Любая ошибка задачи переводится в {@code kind} без учёта её класса.
     */
    public static <K> void awaitAll(Map<K, KafkaFuture<Void>> futures,
                                    long timeoutMs,
                                    String operation,
                                    ErrorKind kind) {
        for (Map.Entry<K, KafkaFuture<Void>> e : futures.entrySet()) {
            String resource = String.valueOf(e.getKey());
            try {
                await(e.getValue(), timeoutMs, operation, resource, kind);
            } catch (MessageBusException ex) {
                LOG.error("Операция AdminClient {} не выполнена для '{}': {}", operation, resource, ex.getMessage());
                if (ex.is(ErrorKind.INTERRUPTED) || ex.is(kind)) {
                    throw ex;
                }
                throw new MessageBusException(kind, "Операция AdminClient {} не выполнена для '{}'. {}",
                        operation, resource, ex.getMessage(), ex);
            }
        }
    }
}
