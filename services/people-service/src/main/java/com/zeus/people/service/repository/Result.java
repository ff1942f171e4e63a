package com.zeus.people.service.repository;

import com.zeus.people.domain.rules.BusinessRule;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a write-side call. Storage and decode failures are not represented here; they
 * propagate as exceptions.
 *
 * @param <T> value carried on success
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static Result<Void> done() {
        return new Success<>(null);
    }

    static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message, null);
    }

    static <T> Result<T> ruleViolation(BusinessRule rule, String message) {
        return new Failure<>(ErrorKind.BUSINESS_RULE, message, rule);
    }

    boolean isSuccess();

    /**
     * @throws IllegalStateException if this is a failure
     */
    T value();

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> next);

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
            return next.apply(value);
        }
    }

    /**
     * @param rule the violated rule when {@code kind} is {@link ErrorKind#BUSINESS_RULE}, else null
     */
    record Failure<T>(ErrorKind kind, String message, BusinessRule rule) implements Result<T> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException(kind + ": " + message);
        }

        public Optional<BusinessRule> violatedRule() {
            return Optional.ofNullable(rule);
        }

        /** The same failure, retyped for a caller returning a different value. */
        public <U> Failure<U> retype() {
            return new Failure<>(kind, message, rule);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
            return retype();
        }
    }
}
