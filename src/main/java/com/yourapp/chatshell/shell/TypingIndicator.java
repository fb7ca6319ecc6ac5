package com.yourapp.chatshell.shell;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * "Assistant is typing" animation on a daemon thread. It only writes to the terminal and holds no
 * conversation state.
 */
public class TypingIndicator {

    private static final Duration FRAME_INTERVAL = Duration.ofMillis(500);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(1);

    private final PrintStream out;
    private final ShellTheme theme;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private Thread worker;

    public TypingIndicator(PrintStream out, ShellTheme theme) {
        this.out = out;
        this.theme = theme;
    }

    public void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }
        worker = new Thread(this::animate, "typing-indicator");
        worker.setDaemon(true);
        worker.start();
    }

    public void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        Thread running = worker;
        worker = null;
        if (running != null) {
            running.interrupt();
            try {
                running.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        out.print("\r" + " ".repeat(30) + "\r");
        out.flush();
    }

    public boolean isActive() {
        return active.get();
    }

    private void animate() {
        int dots = 0;
        while (active.get()) {
            String dotString = ".".repeat(dots % 4);
            out.print("\r" + theme.dim() + "Assistant is typing" + dotString
                    + " ".repeat(3 - dotString.length()) + theme.reset());
            out.flush();
            dots++;
            try {
                Thread.sleep(FRAME_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                return;
            }
        }
    }
}
