package com.github.revdownloader.service.retry;

/**
 * A single fallible operation run by {@link RetryExecutor}.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * @param attempt Zero-based attempt number
     * @return Operation result
     * @throws Exception Any failure; its message is used for classification
     */
    T attempt(int attempt) throws Exception;
}
