package io.surfworks.sparklaunch.monitor;

/**
 * Thrown when monitoring ends with a timeout or an abnormal step.
 */
public class MonitorException extends Exception {

    private final transient MonitorResult result;

    public MonitorException(MonitorResult result) {
        super(result.message() + " (cluster " + result.clusterId() + ")");
        this.result = result;
    }

    /**
     * Returns the result that caused this exception.
     */
    public MonitorResult result() {
        return result;
    }
}
