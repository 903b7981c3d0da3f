package com.cellbroker.config;

import com.cellbroker.event.EventCodec;
import com.cellbroker.handler.pool.FanoutSyncPool;
import com.cellbroker.handler.pool.HandlerOptions;
import com.cellbroker.handler.pool.RetrySyncPool;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueueClient;
import com.cellbroker.queue.QueuePublisher;
import com.cellbroker.service.DecoupleRouter;
import com.cellbroker.service.EventDeliveryClient;
import com.cellbroker.service.EventFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the delivery side of the data plane.
 *
 *   deliveryRestTemplate → HTTP client for targets and reply forwarding, bounded by deliver-timeout
 *   fanoutSyncPool       → decouple queue consumers (cellbroker.fanout.enabled)
 *   retrySyncPool        → retry queue consumers (cellbroker.retry.enabled)
 *   decoupleRouter       → ingress side, publishing to decouple queues
 */
@Configuration
public class DataPlaneConfig {

    @Bean
    public RestTemplate deliveryRestTemplate(HandlerOptions handlerOptions) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(handlerOptions.getDeliverTimeout())
                .build();
        // The JDK client aborts the exchange when the calling thread is interrupted,
        // so a timed-out event does not keep its delivery running.
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(handlerOptions.getDeliverTimeout());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public EventDeliveryClient eventDeliveryClient(RestTemplate deliveryRestTemplate) {
        return new EventDeliveryClient(deliveryRestTemplate);
    }

    @Bean
    public HandlerOptions handlerOptions(BrokerProperties properties) {
        return HandlerOptions.from(properties.getHandler());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanoutExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "fanout-target-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "cellbroker.fanout", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FanoutSyncPool fanoutSyncPool(TargetsCache targetsCache,
                                         QueueClient queueClient,
                                         EventCodec eventCodec,
                                         EventFilter eventFilter,
                                         EventDeliveryClient eventDeliveryClient,
                                         QueuePublisher queuePublisher,
                                         ExecutorService fanoutExecutor,
                                         HandlerOptions handlerOptions) {
        return new FanoutSyncPool(targetsCache, queueClient, eventCodec, eventFilter, eventDeliveryClient,
                queuePublisher, PublishSettings.DEFAULT, fanoutExecutor, handlerOptions);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "cellbroker.retry", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RetrySyncPool retrySyncPool(TargetsCache targetsCache,
                                       QueueClient queueClient,
                                       EventCodec eventCodec,
                                       EventDeliveryClient eventDeliveryClient,
                                       QueuePublisher queuePublisher,
                                       HandlerOptions handlerOptions) {
        return new RetrySyncPool(targetsCache, queueClient, eventCodec, eventDeliveryClient,
                queuePublisher, handlerOptions);
    }

    @Bean
    public DecoupleRouter decoupleRouter(TargetsCache targetsCache,
                                         QueuePublisher queuePublisher,
                                         EventFilter eventFilter,
                                         BrokerProperties properties) {
        return new DecoupleRouter(targetsCache, queuePublisher, eventFilter,
                PublishSettings.from(properties.getIngress().getPublish()),
                properties.getIngress().isFilteringEnabled());
    }
}
