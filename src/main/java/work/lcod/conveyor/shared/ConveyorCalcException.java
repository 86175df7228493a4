package work.lcod.conveyor.shared;

/**
 * Exception carrying an error code, message and optional data for boundary failures.
 */
public final class ConveyorCalcException extends RuntimeException {
    private final String code;
    private final Object data;

    public ConveyorCalcException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public ConveyorCalcException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = null;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
