package com.sproutsocial.rmq;

import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One-shot cooperative stop flag. Callbacks registered with {@link #onCancel(Runnable)} run exactly once,
 * on the thread that cancels (or right away on the registering thread if already cancelled).
 */
@ThreadSafe
public class CancellationSignal {

    private final String name;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<Runnable>();

    private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

    public CancellationSignal(String name) {
        this.name = name;
    }

    /**
     * A signal that fires as soon as any of the sources fires.
     */
    public static CancellationSignal anyOf(String name, CancellationSignal... sources) {
        final CancellationSignal combined = new CancellationSignal(name);
        for (CancellationSignal source : sources) {
            source.onCancel(new Runnable() {
                public void run() {
                    combined.cancel();
                }
            });
        }
        return combined;
    }

    /**
     * @return true if this call did the cancelling
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        logger.debug("cancelled:{}", name);
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable callback) {
        checkNotNull(callback);
        callbacks.add(callback);
        //cancel() may have swept the list before the add, whoever removes it runs it
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        }
        catch (Throwable t) {
            logger.error("cancellation callback error. signal:{}", name, t);
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "CancellationSignal{" + name + " cancelled=" + cancelled.get() + '}';
    }

}
