package com.ryuqq.relay.core.spi;

/**
 * Thrown by {@link SingletonRegistry} when a component factory fails.
 *
 * <p>Nothing is registered under {@link #getComponentName()} when this is thrown.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ComponentCreationException extends RuntimeException {

    private final String componentName;

    public ComponentCreationException(String componentName, String message) {
        super("Failed to create component '" + componentName + "': " + message);
        this.componentName = componentName;
    }

    public ComponentCreationException(String componentName, Throwable cause) {
        super("Failed to create component '" + componentName + "': " + cause.getMessage(), cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
