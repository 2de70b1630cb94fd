package net.spookly.httpgate.health;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs one line per circuit transition.
 */
@Slf4j
public final class CircuitLogListener implements CircuitStateListener {
    public static final CircuitLogListener INSTANCE = new CircuitLogListener();

    private CircuitLogListener() {
    }

    @Override
    public void onTransition(CircuitTransition transition) {
        if (transition.to() == CircuitState.OPEN) {
            log.warn("circuit_transition target={} from={} to={} reason={} cooldownMs={}",
                    transition.targetKey(), transition.from(), transition.to(), transition.reason(),
                    transition.cooldown().toMillis());
            return;
        }
        log.info("circuit_transition target={} from={} to={} reason={}",
                transition.targetKey(), transition.from(), transition.to(), transition.reason());
    }
}
