package com.finops.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike connection for the anomaly event history. Only created when the Aerospike event
 * sink is enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "anomaly.event-sink.aerospike", name = "enabled", havingValue = "true")
public class AerospikeConfig {

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient(AnomalyProperties properties) {
        AnomalyProperties.Aerospike aerospike = properties.getEventSink().getAerospike();

        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, aerospike.getHost(), aerospike.getPort());
    }

    @Bean
    public WritePolicy anomalyEventWritePolicy(AnomalyProperties properties) {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.expiration = properties.getEventSink().getAerospike().getTtlSeconds();
        return policy;
    }
}
