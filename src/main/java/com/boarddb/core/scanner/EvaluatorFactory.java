package com.boarddb.core.scanner;

/**
 * Creates a fresh evaluator for each scan worker.
 */
@FunctionalInterface
public interface EvaluatorFactory {
    FragmentEvaluator create(EvaluatorContext context);
}
