package kz.qazmarka.mbus.kafka.retention;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.kafka.common.config.ConfigResource;
import org.apache.kafka.common.config.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.config.BrokerConfig;
import kz.qazmarka.mbus.error.ErrorKind;
import kz.qazmarka.mbus.error.MessageBusException;
import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.admin.TopicMetadataReader;
import kz.qazmarka.mbus.kafka.client.ClientRegistry;
import kz.qazmarka.mbus.kafka.support.Sleeper;
import kz.qazmarka.mbus.kafka.topic.TopicNameValidator;

/**
 * Управление retention и размерами сегментов типа сообщений, очистка темы переключением retention.
 *
 * <p>Очистка ({@link #purge(String, String)}) состоит из двух независимых шагов:
 * {@link #applyMinimalRetention(String, String)} и {@link #restoreRetention(String, String)}, между которыми
 * выдерживается пауза на проход очистки брокера. Атомарности между шагами нет: если восстановление не удалось
 * или процесс упал между ними, тема остаётся с {@code retention.ms=1}. Такие темы видны в
 * {@link #halfAppliedPurges()} (в пределах процесса), и инструмент восстановления может повторить
 * {@link #restoreRetention(String, String)} позже.</p>
 *
 * <p>Baseline для восстановления берётся из реестра клиентов (снимается продьюсером темы); если продьюсер
 * не инициализирован, текущий retention снимается перед первой фазой.</p>
 */
public final class RetentionController {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionController.class);

    private final ClientRegistry registry;
    private final TopicMetadataReader metadata;
    private final AlterConfigRetrier retrier;
    private final Sleeper sleeper;
    private final long purgeGraceMs;
    private final Set<String> halfApplied = ConcurrentHashMap.newKeySet();

    public RetentionController(ClientRegistry registry,
                               BrokerConfig config,
                               AlterConfigRetrier retrier,
                               Sleeper sleeper) {
        this.registry = registry;
        this.metadata = registry.metadata();
        this.retrier = retrier;
        this.sleeper = sleeper;
        this.purgeGraceMs = config.purgeGraceMs();
    }

    /**
     * Удаляет все сообщения типа: минимальный retention, пауза, восстановление baseline.
     *
     * @throws MessageBusException {@link ErrorKind#OPERATION_FAILED}, если минимальный retention не применился;
     *         {@link ErrorKind#CONFIG_ERROR}, если не удалось восстановить baseline
     */
    public void purge(String adminId, String name) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Очистка всех сообщений типа '{}' через admin '{}'", name, adminId);
        }
        applyMinimalRetention(adminId, name);
        graceWait(name);
        restoreRetention(adminId, name);
        LOG.info("Удалены все сообщения типа '{}'", name);
    }

    /**
     * Первая фаза очистки. После успеха тема попадает в {@link #halfAppliedPurges()}.
     */
    public void applyMinimalRetention(String adminId, String name) {
        TopicNameValidator.requireValid(name);
        KafkaTopicAdmin admin = admin(adminId);
        ConfigResource resource = topicResource(name);
        long baseline = captureBaseline(admin, resource);
        retrier.apply(admin, resource,
                retentionEntry(ClientRegistry.PURGE_RETENTION_MS),
                PurgePhase.MINIMAL_RETENTION.description(),
                PurgePhase.MINIMAL_RETENTION.failureKind());
        halfApplied.add(name);
        LOG.warn("Тип сообщений '{}' переведён на retention.ms={} (baseline {} будет восстановлен)",
                name, ClientRegistry.PURGE_RETENTION_MS, baseline);
    }

    /**
     * Вторая фаза очистки: возвращает retention к baseline.
     *
     * @throws MessageBusException {@link ErrorKind#CONFIG_ERROR}, если baseline неизвестен или попытки исчерпаны
     */
    public void restoreRetention(String adminId, String name) {
        TopicNameValidator.requireValid(name);
        KafkaTopicAdmin admin = admin(adminId);
        OptionalLong baseline = registry.baselineFor(name);
        if (!baseline.isPresent()) {
            LOG.error("Неизвестная конфигурация для типа сообщений '{}': baseline retention не снят", name);
            throw new MessageBusException(ErrorKind.CONFIG_ERROR,
                    "Неизвестная конфигурация для типа сообщений '{}': baseline retention не снят", name);
        }
        try {
            retrier.apply(admin, topicResource(name),
                    retentionEntry(baseline.getAsLong()),
                    PurgePhase.RESTORE_RETENTION.description(),
                    PurgePhase.RESTORE_RETENTION.failureKind());
        } catch (MessageBusException e) {
            LOG.error("Неизвестная конфигурация для типа сообщений '{}': retention не восстановлен ({})",
                    name, e.getMessage());
            if (e.is(PurgePhase.RESTORE_RETENTION.failureKind())) {
                throw new MessageBusException(ErrorKind.CONFIG_ERROR,
                        "Неизвестная конфигурация для типа сообщений '{}'", name, e);
            }
            throw e;
        }
        halfApplied.remove(name);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Retention типа сообщений '{}' восстановлен: {}", name, baseline.getAsLong());
        }
    }

    /** Темы, у которых минимальный retention применён, а восстановление ещё не выполнено. */
    public Set<String> halfAppliedPurges() {
        return Collections.unmodifiableSet(new TreeSet<>(halfApplied));
    }

    /**
     * Применяет свойства из списка {@link TopicProperty} одним изменением конфигурации.
     *
     * @throws MessageBusException {@link ErrorKind#NOT_FOUND} для неизвестного типа,
     *         {@link ErrorKind#INVALID_ARGUMENT} для ключа вне списка,
     *         {@link ErrorKind#OPERATION_FAILED}, если изменение не применилось
     */
    public void configure(String adminId, String name, Map<String, ?> properties) {
        KafkaTopicAdmin admin = admin(adminId);
        Set<String> existing = metadata.topicNames(admin);
        if (!existing.contains(name)) {
            LOG.error("Неизвестный тип сообщений '{}': нет среди {}", name, existing);
            throw new MessageBusException(ErrorKind.NOT_FOUND,
                    "Неизвестный тип сообщений '{}': нет среди {}", name, existing);
        }
        if (properties == null || properties.isEmpty()) {
            throw new MessageBusException(ErrorKind.INVALID_ARGUMENT, "Не задано ни одного свойства для '{}'", name);
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            TopicProperty property = TopicProperty.fromKey(e.getKey(), name);
            if (e.getValue() == null) {
                throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                        "Пустое значение свойства '{}' для типа сообщений '{}'", e.getKey(), name);
            }
            entries.put(property.kafkaKey(), String.valueOf(e.getValue()).trim());
        }
        retrier.apply(admin, topicResource(name), entries,
                "обновление конфигурации типа сообщений", ErrorKind.OPERATION_FAILED);
        LOG.info("Обновлена конфигурация типа сообщений '{}': {}", name, entries);
    }

    /**
     * Срок хранения и предел размера задаются только вместе; {@code file_delete_ms} принудительно равен 1.
     *
     * @throws MessageBusException {@link ErrorKind#INVALID_ARGUMENT}, если одного из свойств нет
     */
    public void setExpiry(String adminId, String name, Map<String, ?> properties) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (properties != null) {
            props.putAll(properties);
        }
        for (TopicProperty required : new TopicProperty[]{TopicProperty.EXPIRE_TIME_MS, TopicProperty.DATA_LIMIT_BYTES}) {
            if (props.get(required.key()) == null) {
                LOG.error("Не задано обязательное свойство срока хранения '{}' для '{}'", required.key(), name);
                throw new MessageBusException(ErrorKind.INVALID_ARGUMENT,
                        "Недопустимый ключ срока хранения типа сообщений: нет '{}'", required.key());
            }
        }
        props.put(TopicProperty.FILE_DELETE_MS.key(), 1L);
        configure(adminId, name, props);
    }

    /** Текущий {@code retention.ms} типа сообщений. */
    public long retention(String adminId, String name) {
        return metadata.retentionMs(admin(adminId), topicResource(name));
    }

    private long captureBaseline(KafkaTopicAdmin admin, ConfigResource resource) {
        OptionalLong known = registry.baselineFor(resource.name());
        if (known.isPresent()) {
            return known.getAsLong();
        }
        long observed = metadata.retentionMs(admin, resource);
        long baseline = registry.rememberBaseline(resource.name(), observed);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Снят baseline retention.ms={} для '{}' (наблюдалось {})", baseline, resource.name(), observed);
        }
        return baseline;
    }

    private void graceWait(String name) {
        if (purgeGraceMs <= 0L) {
            return;
        }
        try {
            sleeper.sleep(purgeGraceMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Очистка '{}' прервана между фазами; retention остаётся минимальным", name);
            throw new MessageBusException(ErrorKind.INTERRUPTED,
                    "Очистка '{}' прервана между фазами", name, ie);
        }
    }

    private KafkaTopicAdmin admin(String adminId) {
        return registry.admin(adminId).admin();
    }

    private static ConfigResource topicResource(String name) {
        return new ConfigResource(ConfigResource.Type.TOPIC, name);
    }

    private static Map<String, String> retentionEntry(long value) {
        return Collections.singletonMap(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(value));
    }
}
