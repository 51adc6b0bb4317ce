package net.cronkeeper.core.schedule;

public class ScheduleParseException extends ScheduleException {
    private final String expression;

    public ScheduleParseException(String expression, String message) {
        super("Unparseable schedule \"" + expression + "\": " + message);
        this.expression = expression;
    }

    public ScheduleParseException(String expression, Throwable cause) {
        super("Unparseable schedule \"" + expression + "\": " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String expression() { return expression; }
}
