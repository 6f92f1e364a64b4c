package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.worker.InOrderContextRanker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

/**
 * Wires the engine on top of a @DataJpaTest slice: real services and
 * repositories on H2, a scripted worker gateway, and short timeouts so
 * hung workers fail fast.
 */
@TestConfiguration
@Import({
        EventLog.class,
        FeedbackCodec.class,
        TaskGroupStateMachine.class,
        WorkerDispatcher.class,
        ContextAssembler.class,
        ReviewLedger.class,
        EscalationPolicy.class,
        ReviewFeedbackLoop.class,
        MergeCoordinator.class,
        ValidatorGate.class,
        SessionManager.class,
        TaskGroupRunner.class,
        InOrderContextRanker.class
})
class EngineTestConfig {

    @Bean
    EngineProperties engineProperties() {
        return new EngineProperties(
                2,
                new EngineProperties.Dispatch(Duration.ofMillis(200), Duration.ofMillis(200)),
                null,
                new EngineProperties.Merge(3, Duration.ZERO),
                null,
                List.of("security", "auth"));
    }

    @Bean
    ScriptedWorkerGateway workerGateway() {
        return new ScriptedWorkerGateway();
    }

    @Bean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }
}
