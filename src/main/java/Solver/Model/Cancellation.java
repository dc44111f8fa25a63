package Solver.Model;

/**
 * Stops a running powerset construction, either on request or once the output exceeds a state threshold.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private boolean exceeded;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(int stateThreshold) {
        this(false, stateThreshold);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("stateThreshold must be positive: " + stateThreshold);
        }
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isExceeded() {
        return exceeded;
    }

    public boolean isAboveThreshold(int states) {
        this.exceeded |= states > stateThreshold;
        return this.exceeded;
    }

    public boolean isCancelled() {
        return isInterrupted() || isExceeded();
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "interrupted" : "state threshold " + stateThreshold + " exceeded";
    }
}
