package com.leakgate.config;

/**
 * A policy file that is missing or malformed. The message always names the absolute file path
 * and, when known, the offending section, so the CLI can print it as a single line.
 */
public class PolicyConfigException extends RuntimeException {
    private final String configPath;
    private final String section;

    public PolicyConfigException(String message, String configPath, String section) {
        super(message);
        this.configPath = configPath;
        this.section = section;
    }

    public PolicyConfigException(String message, String configPath, String section, Throwable cause) {
        super(message, cause);
        this.configPath = configPath;
        this.section = section;
    }

    public String getConfigPath() {
        return configPath;
    }

    public String getSection() {
        return section;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (configPath != null) sb.append(" (config: ").append(configPath).append(')');
        if (section != null) sb.append(" (section: ").append(section).append(')');
        return sb.toString();
    }
}
