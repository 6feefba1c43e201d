package com.phillippitts.sessioncore.config;

import com.phillippitts.sessioncore.service.queue.InMemoryQueueStore;
import com.phillippitts.sessioncore.service.queue.QueueStore;
import com.phillippitts.sessioncore.service.upload.DisconnectedUploadTransport;
import com.phillippitts.sessioncore.service.upload.UploadTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators for the coordination core. An application that embeds the core supplies
 * its own {@link UploadTransport} and {@link QueueStore} beans; these stand in otherwise.
 */
@Configuration
public class CoordinationConfig {

    private static final Logger LOG = LogManager.getLogger(CoordinationConfig.class);

    @Bean
    @ConditionalOnMissingBean(UploadTransport.class)
    public UploadTransport uploadTransport() {
        LOG.warn("No UploadTransport bean provided; uploads will be rejected as not connected");
        return new DisconnectedUploadTransport();
    }

    @Bean
    @ConditionalOnMissingBean(QueueStore.class)
    public QueueStore queueStore() {
        LOG.info("No QueueStore bean provided; queue order is kept in memory only");
        return new InMemoryQueueStore();
    }
}
