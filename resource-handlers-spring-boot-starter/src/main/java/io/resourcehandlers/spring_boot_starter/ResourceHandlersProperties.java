package io.resourcehandlers.spring_boot_starter;

import io.resourcehandlers.core.ResourceHandlers;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for resource handlers.
 *
 * <p>Configure via application properties:
 * <pre>
 * resource-handlers.enabled=true
 * resource-handlers.read-limit=104857600
 * resource-handlers.file.enabled=true
 * resource-handlers.data.enabled=true
 * resource-handlers.discover=false
 * </pre>
 */
@ConfigurationProperties("resource-handlers")
public class ResourceHandlersProperties {

    /**
     * Whether any resource may be read. When disabled every URL is unsupported.
     */
    private boolean enabled = true;

    /**
     * Maximum size in bytes of a single resource.
     */
    private long readLimit = ResourceHandlers.DEFAULT_READ_LIMIT;

    /**
     * Also register handlers published through ServiceLoader.
     */
    private boolean discover = false;

    private final Toggle file = new Toggle();
    private final Toggle data = new Toggle();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getReadLimit() {
        return readLimit;
    }

    public void setReadLimit(long readLimit) {
        this.readLimit = readLimit;
    }

    public boolean isDiscover() {
        return discover;
    }

    public void setDiscover(boolean discover) {
        this.discover = discover;
    }

    public Toggle getFile() {
        return file;
    }

    public Toggle getData() {
        return data;
    }

    public static class Toggle {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
