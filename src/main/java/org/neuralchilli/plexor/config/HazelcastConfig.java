package org.neuralchilli.plexor.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.JoinConfig;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.serializer.ExecutorAssignmentSerializer;
import org.neuralchilli.plexor.serializer.TaskInstanceSerializer;
import org.neuralchilli.plexor.serializer.WorkflowRunSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Configures and produces the embedded Hazelcast member shared by every
 * scheduler process of the cluster.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "plexor.cluster.name", defaultValue = "plexor-dev")
    String clusterName;

    @ConfigProperty(name = "plexor.cluster.members")
    Optional<List<String>> members;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        List<String> memberList = members.orElse(List.of());
        log.info("Initializing Hazelcast with cluster name: {}, members: {}", clusterName, memberList);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(embeddedConfig(clusterName, memberList));

        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        log.info("Shutting down Hazelcast instance");
        instance.shutdown();
    }

    /**
     * Build the member configuration. With no members the instance runs
     * standalone; otherwise it joins the listed members over TCP/IP.
     */
    public static Config embeddedConfig(String clusterName, List<String> members) {
        Config config = new Config();
        config.setClusterName(clusterName);
        config.setClassLoader(HazelcastConfig.class.getClassLoader());
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.setProperty("hazelcast.logging.type", "slf4j");

        JoinConfig join = config.getNetworkConfig().getJoin();
        join.getMulticastConfig().setEnabled(false);
        join.getAutoDetectionConfig().setEnabled(false);
        if (members.isEmpty()) {
            join.getTcpIpConfig().setEnabled(false);
        } else {
            join.getTcpIpConfig().setEnabled(true).setMembers(members);
        }

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);
        registerCustomSerializers(serializationConfig);

        return config;
    }

    /**
     * Register the stream serializers for values rewritten on every transition.
     */
    private static void registerCustomSerializers(SerializationConfig serializationConfig) {
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(TaskInstance.class)
                .setImplementation(new TaskInstanceSerializer()));
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(WorkflowRun.class)
                .setImplementation(new WorkflowRunSerializer()));
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(ExecutorAssignment.class)
                .setImplementation(new ExecutorAssignmentSerializer()));

        log.debug("Custom serializers registered: TaskInstance, WorkflowRun, ExecutorAssignment");
    }
}
