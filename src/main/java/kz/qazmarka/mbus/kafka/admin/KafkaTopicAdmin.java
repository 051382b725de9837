package kz.qazmarka.mbus.kafka.admin;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

import org.apache.kafka.clients.admin.AlterConfigOp;
import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.NewPartitions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.config.ConfigResource;

/**
 * Минимальный контракт для работы с Kafka AdminClient в адаптере.
 *
 * Интерфейс преднамеренно лишён зависимостей от конкретной реализации AdminClient, что упрощает unit-тесты.
 * Все мутирующие вызовы асинхронны: возвращают future'ы по именам, которые вызывающий код обязан дождаться.
 */
public interface KafkaTopicAdmin {

    /** Запрашивает имена всех (не внутренних) тем кластера. */
    KafkaFuture<Set<String>> listTopics();

    /** Запрашивает описания тем и возвращает map future'ов по именам. */
    Map<String, KafkaFuture<TopicDescription>> describeTopics(Collection<String> names);

    /** Инициирует batch create и возвращает future'ы по именам. */
    Map<String, KafkaFuture<Void>> createTopics(Collection<NewTopic> newTopics);

    /** Инициирует batch delete и возвращает future'ы по именам. */
    Map<String, KafkaFuture<Void>> deleteTopics(Collection<String> names);

    /** Инициирует увеличение числа партиций; future'ы по именам тем. */
    Map<String, KafkaFuture<Void>> createPartitions(Map<String, NewPartitions> increases);

    /** Возвращает текущие конфиги указанных ресурсов. */
    Map<ConfigResource, KafkaFuture<Config>> describeConfigs(Collection<ConfigResource> resources);

    /** Применяет конфиги (incremental alter); future'ы по ресурсам. */
    Map<ConfigResource, KafkaFuture<Void>> incrementalAlterConfigs(Map<ConfigResource, Collection<AlterConfigOp>> ops);

    /** Узлы кластера, известные контроллеру. */
    KafkaFuture<Collection<Node>> describeClusterNodes();

    void close(Duration timeout);
}
