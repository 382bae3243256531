package io.identityallocator.util;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {
    
    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }
    
    /**
     * Get required environment variable - throws exception if not set
     * 
     * @param name the environment variable name
     * @return the trimmed environment variable value
     * @throws IllegalStateException if the environment variable is not set or is empty
     */
    public static String getRequiredEnv(String name) {
        String value = System.getenv(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException("Required environment variable '" + name + "' is not set or is empty");
        }
        return value.trim();
    }
    
    /**
     * Get environment variable with default value. Blank values count as unset.
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }
    
    /**
     * Resolve the name this node registers its slave keys under: NODE_NAME if set,
     * otherwise the local host name.
     */
    public static String getNodeName(String envName) {
        String fromEnv = getEnv(envName, null);
        if (fromEnv != null) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Environment variable '" + envName
                + "' is not set and the local host name cannot be resolved", e);
        }
    }
}
