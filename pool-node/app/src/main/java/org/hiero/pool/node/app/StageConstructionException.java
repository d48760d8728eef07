// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.pool.node.app.ModuleOrchestrator.Stage;

/**
 * Thrown when a module of the node could not be constructed. Modules of earlier stages have already been stopped when
 * this is thrown.
 */
public final class StageConstructionException extends Exception {
    private final Stage stage;

    /**
     * @param stage the stage whose module failed
     * @param cause the module's error
     */
    public StageConstructionException(@NonNull final Stage stage, @NonNull final Throwable cause) {
        super("failed to construct " + stage + " stage: " + cause.getMessage(), cause);
        this.stage = Objects.requireNonNull(stage);
    }

    /**
     * @return the stage whose module failed
     */
    @NonNull
    public Stage stage() {
        return stage;
    }
}
