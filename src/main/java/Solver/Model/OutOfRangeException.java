package Solver.Model;

/**
 * Thrown when a state count or the start state lies outside of its permitted range.
 */
public class OutOfRangeException extends IllegalArgumentException {

    private final int value;

    public OutOfRangeException(String name, int value, String message) {
        super(name + " = " + value + ": " + message);
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
