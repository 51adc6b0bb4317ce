package net.cronkeeper.core.schedule;

/** 스펙을 고치기 전에는 스스로 풀리지 않는 스케줄 오류 */
public abstract class ScheduleException extends Exception {
    protected ScheduleException(String message) { super(message); }
    protected ScheduleException(String message, Throwable cause) { super(message, cause); }
}
