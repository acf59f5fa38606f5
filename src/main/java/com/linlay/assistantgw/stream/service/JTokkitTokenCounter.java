package com.linlay.assistantgw.stream.service;

import org.springframework.ai.tokenizer.JTokkitTokenCountEstimator;
import org.springframework.ai.tokenizer.TokenCountEstimator;

/**
 * Approximate tokenizer backed by the cl100k_base encoding.
 */
public class JTokkitTokenCounter implements TokenCounter {

    private final TokenCountEstimator estimator;

    public JTokkitTokenCounter() {
        this(new JTokkitTokenCountEstimator());
    }

    public JTokkitTokenCounter(TokenCountEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimator.estimate(text);
    }
}
