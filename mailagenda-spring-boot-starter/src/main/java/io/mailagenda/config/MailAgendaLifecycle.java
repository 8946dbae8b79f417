package io.mailagenda.config;

import io.mailagenda.MailAgenda;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the dispatch loop once the context is refreshed and stops it first on shutdown.
 *
 * <p>A failed {@link MailAgenda#start()} (store unreachable during recovery) propagates and leaves
 * the lifecycle stopped, so a later {@link #start()} retries.
 */
public class MailAgendaLifecycle implements SmartLifecycle {

    /** Last to start, first to stop. */
    public static final int PHASE = Integer.MAX_VALUE;

    private final MailAgenda mailAgenda;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MailAgendaLifecycle(MailAgenda mailAgenda) {
        this.mailAgenda = mailAgenda;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            mailAgenda.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            mailAgenda.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
