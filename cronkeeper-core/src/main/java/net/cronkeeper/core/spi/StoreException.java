package net.cronkeeper.core.spi;

/** 선언형 스토어 호출 실패. 하위 타입으로 결과 종류를 구분한다 */
public class StoreException extends Exception {
    public StoreException(String message) { super(message); }
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
