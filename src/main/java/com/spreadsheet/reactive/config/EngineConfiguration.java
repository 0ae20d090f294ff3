package com.spreadsheet.reactive.config;

import com.spreadsheet.reactive.engine.FormulaEvaluator;
import com.spreadsheet.reactive.engine.PropagationEngine;
import com.spreadsheet.reactive.formula.FormulaParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the framework-free engine classes as beans.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public FormulaParser formulaParser() {
        return new FormulaParser();
    }

    @Bean
    public FormulaEvaluator formulaEvaluator() {
        return new FormulaEvaluator();
    }

    @Bean
    public PropagationEngine propagationEngine(FormulaParser formulaParser, FormulaEvaluator formulaEvaluator) {
        return new PropagationEngine(formulaParser, formulaEvaluator);
    }
}
