package com.phillippitts.livescribe.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks immediately on the calling thread.
 *
 * <p>Use for the lifecycle executor only. Fragment pumps block on their stream and need a real
 * thread.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
