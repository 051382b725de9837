package kz.qazmarka.mbus.kafka.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mbus.ClientKind;

/**
 * Дескриптор консьюмера: соединение, набор подписок, флаг auto-ack, локальный буфер записей,
 * полученных одним poll сверх первой, и смещения выданных записей для ручного подтверждения.
 * Дескриптор же слушает ребалансировку группы: по отозванным партициям буфер и неподтверждённые
 * смещения сбрасываются, записи будут доставлены новому владельцу партиции.
 */
public final class ConsumerHandle extends ClientHandle implements ConsumerRebalanceListener {

    private static final Logger LOG = LoggerFactory.getLogger(ConsumerHandle.class);

    private final Consumer<byte[], byte[]> consumer;
    private final Set<String> subscription;
    private final boolean autoAck;
    private final Deque<ConsumerRecord<byte[], byte[]>> buffered = new ArrayDeque<>();
    private final Map<TopicPartition, OffsetAndMetadata> delivered = new HashMap<>();

    ConsumerHandle(String id, Consumer<byte[], byte[]> consumer, List<String> subscription, boolean autoAck) {
        super(ClientKind.CONSUMER, id);
        this.consumer = consumer;
        this.subscription = Collections.unmodifiableSet(new LinkedHashSet<>(subscription));
        this.autoAck = autoAck;
    }

    public Consumer<byte[], byte[]> consumer() {
        return consumer;
    }

    public Set<String> subscription() {
        return subscription;
    }

    public boolean autoAck() {
        return autoAck;
    }

    /** Буфер записей, уже прочитанных из Kafka, но ещё не выданных вызывающему коду. */
    public Deque<ConsumerRecord<byte[], byte[]>> buffered() {
        return buffered;
    }

    /** Запоминает выданную запись: подтверждение фиксирует смещение, следующее за ней. */
    public void markDelivered(ConsumerRecord<byte[], byte[]> record) {
        delivered.put(new TopicPartition(record.topic(), record.partition()),
                new OffsetAndMetadata(record.offset() + 1));
    }

    /** Смещения выданных, но ещё не подтверждённых записей. */
    public Map<TopicPartition, OffsetAndMetadata> deliveredOffsets() {
        return new HashMap<>(delivered);
    }

    /** Сбрасывает смещения, зафиксированные успешным commit. */
    public void acknowledged(Map<TopicPartition, OffsetAndMetadata> committed) {
        for (Map.Entry<TopicPartition, OffsetAndMetadata> e : committed.entrySet()) {
            delivered.remove(e.getKey(), e.getValue());
        }
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) {
            return;
        }
        int dropped = 0;
        for (Iterator<ConsumerRecord<byte[], byte[]>> it = buffered.iterator(); it.hasNext(); ) {
            ConsumerRecord<byte[], byte[]> r = it.next();
            if (partitions.contains(new TopicPartition(r.topic(), r.partition()))) {
                it.remove();
                dropped++;
            }
        }
        int unacked = 0;
        for (TopicPartition tp : partitions) {
            if (delivered.remove(tp) != null) {
                unacked++;
            }
        }
        if (dropped > 0 || unacked > 0) {
            LOG.warn("Консьюмер '{}': партиции {} отозваны, сброшено записей из буфера: {}, неподтверждённых смещений: {}",
                    id(), partitions, dropped, unacked);
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("Консьюмер '{}': партиции {} отозваны", id(), partitions);
        }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Консьюмер '{}': назначены партиции {}", id(), partitions);
        }
    }

    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
        onPartitionsRevoked(partitions);
    }

    @Override
    void closeConnection(Duration timeout) {
        buffered.clear();
        delivered.clear();
        consumer.close(timeout);
    }
}
