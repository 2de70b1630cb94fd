package net.spookly.httpgate.routing;

/**
 * Chooses which routable target a request tries first.
 */
public enum SelectionPolicy {
    /**
     * First routable target in declaration order.
     */
    ORDERED("ordered"),
    ROUND_ROBIN("round_robin"),
    WEIGHTED("weighted");

    private final String configValue;

    SelectionPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static SelectionPolicy fromConfig(String value, SelectionPolicy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        for (SelectionPolicy policy : values()) {
            if (policy.configValue.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        return fallback;
    }
}
