package net.cronkeeper.core.model;

public enum ConcurrencyPolicy {
    ALLOW, FORBID, REPLACE;

    public static ConcurrencyPolicy from(String s) {
        if (s == null || s.isBlank()) return ALLOW;
        try { return ConcurrencyPolicy.valueOf(s.trim().toUpperCase()); }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown concurrency policy: " + s, e);
        }
    }

    public String code() { return name(); }
}
