package tech.yump.rotator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tech.yump.rotator.rotation.RotationException;
import tech.yump.rotator.rotation.RotationOrchestrator;
import tech.yump.rotator.rotation.RotationResult;
import tech.yump.rotator.template.OperationName;
import tech.yump.rotator.template.ProviderTemplate;
import tech.yump.rotator.template.TemplateRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class RotationServiceImpl implements RotationService {

    private final RotationOrchestrator orchestrator;
    private final TemplateRegistry templateRegistry;
    private final Clock clock;

    @Autowired
    public RotationServiceImpl(RotationOrchestrator orchestrator, TemplateRegistry templateRegistry) {
        this(orchestrator, templateRegistry, Clock.systemUTC());
    }

    RotationServiceImpl(RotationOrchestrator orchestrator, TemplateRegistry templateRegistry, Clock clock) {
        this.orchestrator = orchestrator;
        this.templateRegistry = templateRegistry;
        this.clock = clock;
    }

    @Override
    public RotationResult runOperation(String templateName, OperationName operation,
                                       Map<String, Object> inputs, Map<String, Object> priorInternal) {
        log.info("Service layer: Running '{}' on template '{}'", operation.value(), templateName);
        RotationResult result = orchestrator.rotate(templateName, operation, inputs, priorInternal);
        log.info("Service layer: '{}' on template '{}' committed", operation.value(), templateName);
        return result;
    }

    @Override
    public RotationCycleOutcome rotate(String templateName, Map<String, Object> inputs, List<CredentialGeneration> generations) {
        ProviderTemplate template = templateRegistry.get(templateName);
        List<CredentialGeneration> history = generations == null ? List.of() : generations;
        Map<String, Object> priorInternal = history.isEmpty() ? Map.of() : history.get(0).internal();

        log.info("Service layer: Rotating template '{}' with {} prior generation(s)", templateName, history.size());
        RotationResult result = orchestrator.rotate(templateName, OperationName.SET, inputs, priorInternal);
        CredentialGeneration fresh = new CredentialGeneration(result.outputs(), result.internal(), Instant.now(clock));

        List<CredentialGeneration> next = new ArrayList<>(history.size() + 1);
        next.add(fresh);
        next.addAll(history);
        if (next.size() <= MAX_GENERATIONS) {
            return new RotationCycleOutcome(next, RetirementStatus.NONE, null);
        }

        List<CredentialGeneration> kept = next.subList(0, MAX_GENERATIONS);
        List<CredentialGeneration> retired = next.subList(MAX_GENERATIONS, next.size());
        if (!template.supports(OperationName.REMOVE)) {
            log.info("Service layer: Template '{}' has no remove operation; dropping {} retired generation(s) locally",
                    templateName, retired.size());
            return new RotationCycleOutcome(kept, RetirementStatus.SKIPPED, null);
        }

        for (int i = 0; i < retired.size(); i++) {
            try {
                orchestrator.rotate(templateName, OperationName.REMOVE, inputs, retired.get(i).internal());
            } catch (RotationException e) {
                // The new credential stays live. Generations not yet removed stay in the history,
                // so the next cycle retries them.
                List<CredentialGeneration> unretired = new ArrayList<>(kept);
                unretired.addAll(retired.subList(i, retired.size()));
                log.error("Service layer: Retiring a generation of template '{}' failed, {} generation(s) still pending: [{}] {}",
                        templateName, retired.size() - i, e.kind(), e.getMessage());
                return new RotationCycleOutcome(unretired, RetirementStatus.FAILED, e.getMessage());
            }
        }
        log.info("Service layer: Retired {} generation(s) of template '{}'", retired.size(), templateName);
        return new RotationCycleOutcome(kept, RetirementStatus.REMOVED, null);
    }
}
