package io.tacoq.worker.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.tacoq.broker.BrokerClientFactory;
import io.tacoq.broker.BrokerConfig;
import io.tacoq.worker.sdk.api.TaskHandler;
import io.tacoq.worker.sdk.config.TacoqWorkerProperties;
import io.tacoq.worker.sdk.coordinator.CoordinatorClient;
import io.tacoq.worker.sdk.coordinator.HttpCoordinatorClient;
import io.tacoq.worker.sdk.runtime.WorkerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Wires a {@link WorkerEngine} from {@code tacoq.worker.*} and every {@link TacoqTask @TacoqTask} handler
 * bean, and runs it with the application context.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "tacoq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TacoqWorkerProperties.class)
public class TacoqWorkerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TacoqWorkerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    CoordinatorClient tacoqCoordinatorClient(TacoqWorkerProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        TacoqWorkerProperties.Coordinator coordinator = properties.getCoordinator();
        return new HttpCoordinatorClient(
            coordinator.getUrl(),
            coordinator.getConnectTimeout(),
            coordinator.getRequestTimeout(),
            objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerEngine tacoqWorkerEngine(
        TacoqWorkerProperties properties,
        CoordinatorClient coordinatorClient,
        ListableBeanFactory beanFactory,
        Environment environment,
        ObjectProvider<MeterRegistry> meterRegistry,
        ObjectProvider<BrokerClientFactory> brokerClientFactory
    ) {
        TacoqWorkerProperties.Broker broker = properties.getBroker();
        WorkerEngine.Builder builder = WorkerEngine.builder()
            .name(resolveName(properties, environment))
            .coordinator(coordinatorClient)
            .pollInterval(properties.getPollInterval())
            .reportRunningStatus(properties.isReportRunningStatus())
            .meterRegistry(meterRegistry.getIfAvailable());
        BrokerClientFactory customFactory = brokerClientFactory.getIfAvailable();
        if (customFactory != null) {
            builder.brokerClientFactory(customFactory);
        } else {
            builder.broker(new BrokerConfig(broker.getUrl(), broker.getNamespace(), broker.getExchange(),
                broker.getConnectTimeout()));
        }
        WorkerEngine engine = builder.build();
        registerHandlers(engine, beanFactory);
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerEngineLifecycle tacoqWorkerEngineLifecycle(WorkerEngine engine, TacoqWorkerProperties properties) {
        return new WorkerEngineLifecycle(engine, properties.getShutdownTimeout());
    }

    private static void registerHandlers(WorkerEngine engine, ListableBeanFactory beanFactory) {
        String[] beanNames = beanFactory.getBeanNamesForAnnotation(TacoqTask.class);
        if (beanNames.length == 0) {
            throw new IllegalStateException("No @TacoqTask handler beans were discovered in this service");
        }
        for (String beanName : beanNames) {
            TacoqTask annotation = beanFactory.findAnnotationOnBean(beanName, TacoqTask.class);
            if (annotation == null) {
                continue;
            }
            Object bean = beanFactory.getBean(beanName);
            if (!(bean instanceof TaskHandler handler)) {
                throw new IllegalStateException(
                    "@TacoqTask bean '%s' must implement %s".formatted(beanName, TaskHandler.class.getName()));
            }
            engine.registerHandler(annotation.value(), handler);
            log.info("Registered @TacoqTask bean {} for task kind {}", beanName, annotation.value());
        }
    }

    private static String resolveName(TacoqWorkerProperties properties, Environment environment) {
        String name = properties.getName();
        if (name != null && !name.isBlank()) {
            return name;
        }
        String applicationName = environment.getProperty("spring.application.name");
        if (applicationName != null && !applicationName.isBlank()) {
            return applicationName;
        }
        throw new IllegalStateException("tacoq.worker.name (or spring.application.name) must be set");
    }
}
