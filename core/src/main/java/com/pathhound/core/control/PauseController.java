package com.pathhound.core.control;

/**
 * 협조적 일시정지 플래그. 워커와 승인 루프가 요청 경계마다 {@link #awaitIfPaused()} 를 호출한다.
 * 진행 중인 요청은 끝까지 수행된다.
 */
public final class PauseController {
    private boolean paused;

    public synchronized void pause() {
        paused = true;
    }

    public synchronized void resume() {
        paused = false;
        notifyAll();
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /** 일시정지 중이면 해제될 때까지 블록 */
    public void awaitIfPaused() throws InterruptedException {
        synchronized (this) {
            while (paused) {
                wait(250);
            }
        }
    }
}
