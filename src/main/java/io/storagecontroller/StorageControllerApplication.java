package io.storagecontroller;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.etcd.jetcd.Client;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.storagecontroller.config.StorageControllerConfig;
import io.storagecontroller.metrics.MetricsProvider;
import io.storagecontroller.metrics.ReplicaStatsReporter;
import io.storagecontroller.node.Node;
import io.storagecontroller.node.NodeFactory;
import io.storagecontroller.node.NodeOptions;
import io.storagecontroller.pool.PoolOperator;
import io.storagecontroller.registry.Registry;
import io.storagecontroller.rpc.JsonRpcClient;
import io.storagecontroller.rpc.RpcClientFactory;
import io.storagecontroller.volume.VolumeManager;
import io.storagecontroller.watcher.EtcdSpecWatcher;
import io.storagecontroller.watcher.NodeSpec;
import io.storagecontroller.watcher.PoolSpec;
import io.storagecontroller.watcher.VolumeSpecRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main Spring Boot application class for the storage controller.
 * <p>
 * The controller watches storage nodes and volumes declared in etcd, keeps an
 * in-memory view of the pools, replicas and nexus found on the nodes and
 * reconciles every volume towards its specification.
 */
@Slf4j
@SpringBootApplication
public class StorageControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Storage Controller Application");

        try {
            SpringApplication.run(StorageControllerApplication.class, args);
            log.info("Storage Controller started successfully");
        } catch (Exception e) {
            log.error("Failed to start Storage Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public StorageControllerConfig config() {
        StorageControllerConfig config = new StorageControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "close")
    public Client etcdClient(StorageControllerConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public RpcClientFactory rpcClientFactory(ObjectMapper objectMapper) {
        return JsonRpcClient.factory(objectMapper);
    }

    /**
     * Scheduler running node sync timers, volume reconciliation passes and
     * restarts of failed etcd watches.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService controllerScheduler(StorageControllerConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "storage-controller-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Initializing scheduler with {} threads", config.getSchedulerThreads());
        return Executors.newScheduledThreadPool(config.getSchedulerThreads(), threadFactory);
    }

    @Bean
    public NodeFactory nodeFactory(StorageControllerConfig config, RpcClientFactory rpcClientFactory,
                                   ScheduledExecutorService controllerScheduler) {
        NodeOptions options = config.toNodeOptions();
        log.info("Storage nodes use {}", options);
        return name -> new Node(name, options, rpcClientFactory, controllerScheduler);
    }

    @Bean
    public Registry registry(NodeFactory nodeFactory, MetricsProvider metricsProvider) {
        log.info("Initializing Registry");
        return new Registry(nodeFactory, metricsProvider);
    }

    @Bean
    public VolumeManager volumeManager(Registry registry, MetricsProvider metricsProvider,
                                       ScheduledExecutorService controllerScheduler,
                                       StorageControllerConfig config) {
        log.info("Initializing VolumeManager");
        return new VolumeManager(registry, metricsProvider, controllerScheduler, config.getReconcileInterval());
    }

    @Bean
    public PoolOperator poolOperator(Registry registry, MetricsProvider metricsProvider) {
        log.info("Initializing PoolOperator");
        return new PoolOperator(registry, metricsProvider);
    }

    @Bean
    public ReplicaStatsReporter replicaStatsReporter(Registry registry, MetricsProvider metricsProvider,
                                                     ScheduledExecutorService controllerScheduler,
                                                     StorageControllerConfig config) {
        return new ReplicaStatsReporter(registry, metricsProvider, controllerScheduler, config.getStatsInterval());
    }

    @Bean
    @Qualifier("nodeWatcher")
    public EtcdSpecWatcher<NodeSpec> nodeWatcher(Client etcdClient, StorageControllerConfig config,
                                                 ObjectMapper objectMapper,
                                                 ScheduledExecutorService controllerScheduler) {
        log.info("Initializing node watcher on {}", config.getNodePrefix());
        return new EtcdSpecWatcher<>(etcdClient, config.getNodePrefix(), NodeSpec.class,
                NodeSpec::setName, objectMapper, controllerScheduler);
    }

    @Bean
    @Qualifier("volumeWatcher")
    public EtcdSpecWatcher<VolumeSpecRecord> volumeWatcher(Client etcdClient, StorageControllerConfig config,
                                                           ObjectMapper objectMapper,
                                                           ScheduledExecutorService controllerScheduler) {
        log.info("Initializing volume watcher on {}", config.getVolumePrefix());
        return new EtcdSpecWatcher<>(etcdClient, config.getVolumePrefix(), VolumeSpecRecord.class,
                VolumeSpecRecord::setUuid, objectMapper, controllerScheduler);
    }

    @Bean
    @Qualifier("poolWatcher")
    public EtcdSpecWatcher<PoolSpec> poolWatcher(Client etcdClient, StorageControllerConfig config,
                                                 ObjectMapper objectMapper,
                                                 ScheduledExecutorService controllerScheduler) {
        log.info("Initializing pool watcher on {}", config.getPoolPrefix());
        return new EtcdSpecWatcher<>(etcdClient, config.getPoolPrefix(), PoolSpec.class,
                PoolSpec::setName, objectMapper, controllerScheduler);
    }
}
