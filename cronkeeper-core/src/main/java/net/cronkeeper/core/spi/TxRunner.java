package net.cronkeeper.core.spi;

import java.util.concurrent.Callable;

/** 스토어 호출을 트랜잭션 하나로 묶는다. 이미 진행 중이면 거기에 참여한다 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
}
