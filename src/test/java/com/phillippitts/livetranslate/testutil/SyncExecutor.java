package com.phillippitts.livetranslate.testutil;

import java.util.concurrent.Executor;

/**
 * Runs fan-out tasks on the calling thread so translation and delivery order is deterministic
 * in tests.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
