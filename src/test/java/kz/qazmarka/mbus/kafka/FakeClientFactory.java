package kz.qazmarka.mbus.kafka;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import kz.qazmarka.mbus.kafka.admin.KafkaTopicAdmin;
import kz.qazmarka.mbus.kafka.client.KafkaClientFactory;

/**
 * Фабрика клиентов для тестов: все admin-соединения смотрят в один {@link FakeKafkaAdmin},
 * продьюсеры и консьюмеры: {@link MockProducer}/{@link MockConsumer} из kafka-clients.
 */
public final class FakeClientFactory implements KafkaClientFactory {

    private final FakeKafkaAdmin admin;
    private Supplier<MockProducer<byte[], byte[]>> producerSupplier =
            () -> new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());

    public final List<Properties> adminProps = new ArrayList<>();
    public final List<Properties> producerProps = new ArrayList<>();
    public final List<Properties> consumerProps = new ArrayList<>();
    public final Map<String, MockProducer<byte[], byte[]>> producers = new HashMap<>();
    public final Map<String, MockConsumer<byte[], byte[]>> consumers = new HashMap<>();

    public FakeClientFactory(FakeKafkaAdmin admin) {
        this.admin = admin;
    }

    public FakeClientFactory withProducers(Supplier<MockProducer<byte[], byte[]>> supplier) {
        this.producerSupplier = supplier;
        return this;
    }

    @Override
    public KafkaTopicAdmin createAdmin(Properties props) {
        adminProps.add(props);
        return admin;
    }

    @Override
    public Producer<byte[], byte[]> createProducer(Properties props) {
        producerProps.add(props);
        MockProducer<byte[], byte[]> producer = producerSupplier.get();
        producers.put(props.getProperty(CommonClientConfigs.CLIENT_ID_CONFIG), producer);
        return producer;
    }

    @Override
    public Consumer<byte[], byte[]> createConsumer(Properties props) {
        consumerProps.add(props);
        MockConsumer<byte[], byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumers.put(props.getProperty(CommonClientConfigs.CLIENT_ID_CONFIG), consumer);
        return consumer;
    }
}
