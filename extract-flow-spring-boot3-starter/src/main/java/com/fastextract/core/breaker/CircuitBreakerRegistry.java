package com.fastextract.core.breaker;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按依赖名持有熔断器, 每个名字唯一实例
 */
public class CircuitBreakerRegistry {

    private final CircuitBreakerConfig defaults;

    private final Map<String, CircuitBreakerConfig> perDependency;

    private final Clock clock;

    private final CircuitStateListener listener;

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaults) {
        this(defaults, Map.of(), Clock.systemUTC(), CircuitStateListener.NO_OP);
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaults, Map<String, CircuitBreakerConfig> perDependency,
                                  Clock clock, CircuitStateListener listener) {
        this.defaults = defaults;
        this.perDependency = perDependency == null ? Map.of() : new HashMap<>(perDependency);
        this.clock = clock;
        this.listener = listener;
    }

    public CircuitBreaker get(String dependency) {
        return breakers.computeIfAbsent(dependency,
                k -> new CircuitBreaker(k, perDependency.getOrDefault(k, defaults), clock, listener));
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    /** 全部复位 */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
