package com.tts.resilience.health;

import com.tts.resilience.breaker.CircuitBreakerRegistry;
import com.tts.resilience.breaker.CircuitBreakerSnapshot;
import com.tts.resilience.breaker.CircuitState;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports breaker states. A non-closed breaker makes the check DEGRADED; a non-closed
 * breaker guarding a critical operation kind makes it DOWN.
 */
public class CircuitBreakerHealthCheck implements HealthCheck {

    private final CircuitBreakerRegistry breakers;
    private final Set<String> criticalKinds;

    public CircuitBreakerHealthCheck(CircuitBreakerRegistry breakers) {
        this(breakers, Set.of());
    }

    public CircuitBreakerHealthCheck(CircuitBreakerRegistry breakers, Set<String> criticalKinds) {
        this.breakers = breakers;
        this.criticalKinds = Set.copyOf(criticalKinds);
    }

    @Override
    public String getName() {
        return "circuitBreakers";
    }

    @Override
    public HealthStatus check() {
        List<CircuitBreakerSnapshot> snapshots = breakers.snapshots();
        List<String> tripped = new ArrayList<>();
        boolean criticalTripped = false;
        for (CircuitBreakerSnapshot snapshot : snapshots) {
            if (snapshot.state() != CircuitState.CLOSED) {
                tripped.add(snapshot.name());
                criticalTripped |= criticalKinds.contains(snapshot.name());
            }
        }
        HealthStatus status;
        if (criticalTripped) {
            status = HealthStatus.down("Critical circuit not closed: " + String.join(", ", tripped));
        } else if (!tripped.isEmpty()) {
            status = HealthStatus.degraded("Circuit not closed: " + String.join(", ", tripped));
        } else {
            status = HealthStatus.up();
        }
        for (CircuitBreakerSnapshot snapshot : snapshots) {
            status = status.withDetail(snapshot.name(), snapshot.state().name());
        }
        return status;
    }
}
