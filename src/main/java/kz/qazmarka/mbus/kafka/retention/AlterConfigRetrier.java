package kz.qazmarka.mbus.kafka.retention;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.kafka.clients.admin.AlterConfigOp;
import org.apache.kafka.clients.admin.ConfigEntry;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.config.ConfigResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.KafkaErrorMapper;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.admin.AdminCalls;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.support.RetryPoller;

/**
 * Изменение конфигурации темы с ограниченным числом попыток.
 *
 * Ошибка результата alter-config не бросается сразу: попытка повторяется, пока не исчерпан бюджет
 * {@code maxAttempts}, и только последняя неудача превращается в исключение заданного вида.
 * Прерывание потока не повторяется.
 */
public final class AlterConfigRetrier {

    private static final Logger LOG = LoggerFactory.getLogger(AlterConfigRetrier.class);

    private final RetryPoller poller;
    private final int maxAttempts;
    private final long adminTimeoutMs;

    public AlterConfigRetrier(RetryPoller poller, int maxAttempts, long adminTimeoutMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts должен быть >= 1: " + maxAttempts);
        }
        this.poller = Objects.requireNonNull(poller, "poller");
        this.maxAttempts = maxAttempts;
        this.adminTimeoutMs = adminTimeoutMs;
    }

    /**
     * Выставляет {@code entries} у темы одним вызовом incrementalAlterConfigs.
     *
     * @param what        описание изменения для логов
     * @param failureKind вид ошибки после исчерпания попыток
     */
    public void apply(KafkaTopicAdmin admin,
                      ConfigResource resource,
                      Map<String, String> entries,
                      String what,
                      ErrorKind failureKind) {
        List<AlterConfigOp> ops = new ArrayList<>(entries.size());
        for (Map.Entry<String, String> e : entries.entrySet()) {
            ops.add(new AlterConfigOp(new ConfigEntry(e.getKey(), e.getValue()), AlterConfigOp.OpType.SET));
        }
        Map<ConfigResource, Collection<AlterConfigOp>> request = Collections.singletonMap(resource, ops);
        String label = what + " для '" + resource.name() + "' " + entries;
        poller.await(label,
                () -> attempt(admin, request, resource, label),
                Objects::isNull,
                maxAttempts - 1,
                failureKind);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: применено", label);
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** @return {@code null} при успехе, иначе ошибка попытки */
    private Throwable attempt(KafkaTopicAdmin admin,
                              Map<ConfigResource, Collection<AlterConfigOp>> request,
                              ConfigResource resource,
                              String label) {
        try {
            Map<ConfigResource, KafkaFuture<Void>> futures = admin.incrementalAlterConfigs(request);
            AdminCalls.await(futures.get(resource), adminTimeoutMs,
                    "incrementalAlterConfigs", resource.name(), ErrorKind.OPERATION_FAILED);
            return null;
        } catch (MessageBusException e) {
            if (e.is(ErrorKind.INTERRUPTED)) {
                throw e;
            }
            LOG.warn("{}: попытка не удалась: {}", label, e.getMessage());
            return e.getCause() == null ? e : e.getCause();
        } catch (RuntimeException e) {
            LOG.warn("{}: попытка не удалась: {}", label, KafkaErrorMapper.describe(e));
            return e;
        }
    }
}
