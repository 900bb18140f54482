// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.cli;

import java.io.PrintStream;
import strictml.util.Trace;
import strictml.util.condition.Condition;
import strictml.util.condition.ConditionContext;
import strictml.util.condition.HandlerProcedure;
import strictml.util.condition.Restart;

/**
 * The outermost handler of the command line front end.
 * <p>
 * Reports every condition, along with the operation trace active when it was signaled, then unwinds to the newest
 * restart, so that one bad file does not stop the others from being processed.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final PrintStream err) {
        this.err = err;
    }

    @Override
    public void handle(final Condition condition) {
        showCondition(condition);
        newestRestart().unwindTo();
    }

    private void showCondition(final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart newestRestart() {
        final var iterator = ConditionContext.restarts().iterator();
        if (!iterator.hasNext()) {
            throw new IllegalStateException("No restarts available");
        }
        return iterator.next();
    }

    private final PrintStream err;
}
