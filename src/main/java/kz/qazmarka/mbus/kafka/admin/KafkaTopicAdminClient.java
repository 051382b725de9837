package kz.qazmarka.mbus.kafka.admin;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AlterConfigOp;
import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.NewPartitions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.config.ConfigResource;

/**
 * Обёртка над {@link Admin}, реализующая {@link KafkaTopicAdmin} без дополнительной логики.
 */
public final class KafkaTopicAdminClient implements KafkaTopicAdmin {

    private final Admin delegate;

    public KafkaTopicAdminClient(Admin delegate) {
        this.delegate = delegate;
    }

    @Override
    public KafkaFuture<Set<String>> listTopics() {
        return delegate.listTopics().names();
    }

    @Override
    public Map<String, KafkaFuture<TopicDescription>> describeTopics(Collection<String> names) {
        return delegate.describeTopics(names).topicNameValues();
    }

    @Override
    public Map<String, KafkaFuture<Void>> createTopics(Collection<NewTopic> newTopics) {
        return delegate.createTopics(newTopics).values();
    }

    @Override
    public Map<String, KafkaFuture<Void>> deleteTopics(Collection<String> names) {
        return delegate.deleteTopics(names).topicNameValues();
    }

    @Override
    public Map<String, KafkaFuture<Void>> createPartitions(Map<String, NewPartitions> increases) {
        return delegate.createPartitions(increases).values();
    }

    @Override
    public Map<ConfigResource, KafkaFuture<Config>> describeConfigs(Collection<ConfigResource> resources) {
        return delegate.describeConfigs(resources).values();
    }

    @Override
    public Map<ConfigResource, KafkaFuture<Void>> incrementalAlterConfigs(
            Map<ConfigResource, Collection<AlterConfigOp>> ops) {
        return delegate.incrementalAlterConfigs(ops).values();
    }

    @Override
    public KafkaFuture<Collection<Node>> describeClusterNodes() {
        return delegate.describeCluster().nodes();
    }

    @Override
    public void close(Duration timeout) {
        delegate.close(timeout);
    }
}
