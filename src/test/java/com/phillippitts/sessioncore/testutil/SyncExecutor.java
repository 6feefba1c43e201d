package com.phillippitts.sessioncore.testutil;

import java.util.concurrent.Executor;

/**
 * Runs upload tasks on the calling thread so progress transitions are observable without waiting.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
