package dev.newsroom.config;

import dev.newsroom.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Node id comes from {@code app.snowflake.node-id} when set, otherwise from
 * a hash of the host name.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake id generator with node id {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return Math.abs(hostname.hashCode()) & SnowflakeId.MAX_NODE_ID;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve host name, using node id 0: {}", e.getMessage());
            return 0;
        }
    }
}
