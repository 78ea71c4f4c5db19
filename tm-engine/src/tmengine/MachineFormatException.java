package tmengine;

/** Thrown by {@link MachineParser} when a machine file is structurally invalid. */
public class MachineFormatException extends IllegalArgumentException {

    private final int row;

    public MachineFormatException(String message) {
        super(message);
        this.row = -1;
    }

    public MachineFormatException(int row, String message) {
        super("Row " + row + ": " + message);
        this.row = row;
    }

    public MachineFormatException(String message, Throwable cause) {
        super(message, cause);
        this.row = -1;
    }

    /** 1-based CSV row, or -1 when the problem is not tied to one row. */
    public int row() { return row; }
}
