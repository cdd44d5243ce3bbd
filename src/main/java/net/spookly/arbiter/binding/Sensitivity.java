package net.spookly.arbiter.binding;

/**
 * Informational sensitivity label carried by a binding.
 */
public enum Sensitivity {
    SENSITIVE("sensitive"),
    NON_SENSITIVE("non-sensitive");

    private final String configValue;

    Sensitivity(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static Sensitivity fromConfig(String value) {
        if (value == null) {
            return NON_SENSITIVE;
        }
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.configValue.equalsIgnoreCase(value.trim())) {
                return sensitivity;
            }
        }
        return NON_SENSITIVE;
    }
}
