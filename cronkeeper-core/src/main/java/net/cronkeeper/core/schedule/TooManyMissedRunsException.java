package net.cronkeeper.core.schedule;

public class TooManyMissedRunsException extends ScheduleException {
    public TooManyMissedRunsException(int limit) {
        super("Too many missed start times (> " + limit + "). "
                + "Set or decrease startingDeadlineSeconds or check clock skew.");
    }
}
