package express.mvp.hostcore.lifecycle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Releases acquired resources in reverse order unless the enclosing operation commits.
 *
 * <p>Each step of a multi-step operation registers how to undo itself right after it succeeds.
 * If the operation leaves the try block without calling {@link #commit()}, every registered
 * release runs, newest first. Release failures are logged and never mask the original error.
 *
 * <pre>{@code
 * try (UnwindScope scope = new UnwindScope("host3: publish")) {
 *     TagPool pool = allocator.allocate(depth);
 *     scope.onFailure("tag pool", pool::close);
 *
 *     DeviceHandle dev = model.register(name, parent);
 *     scope.onFailure("device", () -> model.unregister(dev));
 *
 *     scope.commit();
 * }
 * }</pre>
 *
 * <p>Not thread-safe; a scope belongs to the thread running the operation.
 */
public final class UnwindScope implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(UnwindScope.class.getName());

    private final String operation;

    private final Deque<Step> steps = new ArrayDeque<>();

    private boolean committed;

    private Throwable failure;

    /**
     * Creates a scope for the named operation.
     *
     * @param operation label used when logging release failures
     */
    public UnwindScope(String operation) {
        this.operation = operation;
    }

    /**
     * Registers the release action for a resource that was just acquired.
     *
     * @param resource label of the resource
     * @param release action undoing the acquisition
     */
    public void onFailure(String resource, Runnable release) {
        if (committed) {
            throw new IllegalStateException(operation + ": scope already committed");
        }
        steps.push(new Step(resource, release));
    }

    /**
     * Records the failure that is unwinding this scope.
     *
     * <p>Release failures are attached to it as suppressed exceptions.
     *
     * @param cause the originating failure
     * @param <T> the failure type
     * @return {@code cause}, for rethrowing
     */
    public <T extends Throwable> T fail(T cause) {
        this.failure = cause;
        return cause;
    }

    /** Marks the operation successful; nothing is released on close. */
    public void commit() {
        committed = true;
        steps.clear();
    }

    /**
     * Returns the number of release actions still registered.
     *
     * @return pending step count
     */
    public int pending() {
        return steps.size();
    }

    @Override
    public void close() {
        if (committed) {
            return;
        }
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.release.run();
            } catch (RuntimeException e) {
                LOGGER.log(
                        Level.WARNING,
                        operation + ": failed to release " + step.resource + " while unwinding",
                        e);
                if (failure != null) {
                    failure.addSuppressed(e);
                }
            }
        }
    }

    private static final class Step {
        private final String resource;
        private final Runnable release;

        Step(String resource, Runnable release) {
            this.resource = resource;
            this.release = release;
        }
    }
}
