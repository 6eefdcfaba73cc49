package io.launchmanager;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link Process} whose exit is driven by the test.
 */
public final class FakeProcess extends Process {
    private final long pid;
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile int exitCode;

    public FakeProcess(long pid) {
        this.pid = pid;
    }

    public void exit(int code) {
        if (exited.getCount() > 0) {
            exitCode = code;
            exited.countDown();
        }
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return new ByteArrayInputStream(new byte[0]);
    }

    @Override
    public InputStream getErrorStream() {
        return new ByteArrayInputStream(new byte[0]);
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (isAlive()) {
            throw new IllegalThreadStateException("process " + pid + " has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        exit(143);
    }

    @Override
    public Process destroyForcibly() {
        exit(137);
        return this;
    }
}
