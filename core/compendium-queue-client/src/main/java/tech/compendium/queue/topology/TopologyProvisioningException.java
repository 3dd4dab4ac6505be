package tech.compendium.queue.topology;

/**
 * Provisioning could not complete. Fatal at startup.
 */
public class TopologyProvisioningException extends RuntimeException {

    private final String resource;

    public TopologyProvisioningException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    /**
     * The exchange, queue or binding that failed, e.g. {@code queue:pdf.processing}.
     */
    public String getResource() {
        return resource;
    }
}
