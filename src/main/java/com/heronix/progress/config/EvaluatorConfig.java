package com.heronix.progress.config;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.service.batch.EntityEvaluator;

/**
 * Configuration for per-student evaluators.
 *
 * Registers all available EntityEvaluator implementations and provides
 * them as a Map indexed by CalculationKind for easy lookup.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class EvaluatorConfig {

    /**
     * Create a map of evaluators indexed by calculation kind.
     *
     * @param evaluators all available EntityEvaluator beans
     * @return map of CalculationKind -> EntityEvaluator
     */
    @Bean
    public Map<CalculationKind, EntityEvaluator> entityEvaluators(List<EntityEvaluator> evaluators) {
        Map<CalculationKind, EntityEvaluator> evaluatorMap = new EnumMap<>(CalculationKind.class);

        for (EntityEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getKind(), evaluator);
        }

        return evaluatorMap;
    }
}
