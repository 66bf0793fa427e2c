package com.autosem.digital.process.optimizer.domain.port.service;

import com.autosem.digital.process.optimizer.domain.DTO.AutoOptimizeResult;
import com.autosem.digital.process.optimizer.domain.DTO.CreateABTestRequest;
import com.autosem.digital.process.optimizer.domain.DTO.TestResult;
import com.autosem.digital.process.optimizer.domain.model.ABTest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ABTestService {

    /**
     * Evalúa las pruebas en curso, o sólo la indicada cuando {@code testId} no es nulo.
     */
    Flux<TestResult> evaluateABTests(String testId);

    Mono<AutoOptimizeResult> autoOptimizeABTests();

    Mono<ABTest> createTest(CreateABTestRequest request);
}
