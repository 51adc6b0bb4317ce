package net.cronkeeper.core.spi;

/** 삭제 시 종속 객체 처리 방식 */
public enum DeletePropagation {
    /** 소유자 먼저 지우고 종속 객체는 뒤에서 정리 */
    BACKGROUND,
    /** 종속 객체를 먼저 지운 뒤 소유자 삭제 */
    FOREGROUND,
    /** 종속 객체는 남겨둔다 */
    ORPHAN
}
