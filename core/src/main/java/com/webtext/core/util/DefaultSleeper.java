package com.webtext.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** 실제로 스레드를 재우는 Sleeper. 0 이하나 null 지연은 바로 반환. */
public final class DefaultSleeper implements Sleeper {

    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    private DefaultSleeper() {}

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        TimeUnit.MILLISECONDS.sleep(delay.toMillis());
    }
}
