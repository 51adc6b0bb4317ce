package net.cronkeeper.core.model;

/** 외부 실행기가 Job 에 기록하는 상태 조건 */
public record JobCondition(Type type, boolean status, String reason) {
    public enum Type {
        COMPLETE, FAILED, SUSPENDED, UNKNOWN;

        public static Type from(String s) {
            if (s == null) return UNKNOWN;
            try { return Type.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
    }

    public static JobCondition complete() { return new JobCondition(Type.COMPLETE, true, null); }
    public static JobCondition failed(String reason) { return new JobCondition(Type.FAILED, true, reason); }
}
