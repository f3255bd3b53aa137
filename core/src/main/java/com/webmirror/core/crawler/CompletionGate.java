package com.webmirror.core.crawler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 크롤 단위 조인 배리어.
 * 작업을 띄우기 전에 enter(), 작업이 끝나면(실패 포함) leave().
 * 부모는 자식을 모두 띄운 뒤에 leave() 하므로 카운트가 0이 되는 건 전체가 끝났을 때뿐이다.
 */
public final class CompletionGate {

    private final AtomicLong pending = new AtomicLong(0);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile boolean aborted = false;

    public void enter() {
        pending.incrementAndGet();
    }

    public void leave() {
        long left = pending.decrementAndGet();
        if (left == 0) {
            done.countDown();
        } else if (left < 0) {
            throw new IllegalStateException("leave() without matching enter()");
        }
    }

    /** 모든 작업이 끝나거나 abort() 될 때까지 대기 */
    public void await() throws InterruptedException {
        done.await();
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    /** 남은 작업과 무관하게 대기자를 즉시 풀어준다(취소용). */
    public void abort() {
        aborted = true;
        done.countDown();
    }

    boolean isAborted() {
        return aborted;
    }

    long pending() {
        return pending.get();
    }
}
