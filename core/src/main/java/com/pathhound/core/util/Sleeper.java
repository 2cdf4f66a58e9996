package com.pathhound.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 실제 sleep 제거용) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
