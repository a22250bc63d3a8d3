package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.routing.DispatchRoutine;

/**
 * Outcome of a router compilation: the routine that is now current and
 * whether anything had to be executed to make it so.
 */
public class RoutineInstallResult {

    private final DispatchRoutine routine;
    private final boolean replaced;
    private final boolean hookInstalled;

    private RoutineInstallResult(DispatchRoutine routine, boolean replaced, boolean hookInstalled) {
        this.routine = routine;
        this.replaced = replaced;
        this.hookInstalled = hookInstalled;
    }

    static RoutineInstallResult unchanged(DispatchRoutine routine) {
        return new RoutineInstallResult(routine, false, false);
    }

    static RoutineInstallResult replaced(DispatchRoutine routine, boolean hookInstalled) {
        return new RoutineInstallResult(routine, true, hookInstalled);
    }

    public DispatchRoutine getRoutine() {
        return routine;
    }

    /**
     * False when the installed routine already had the same content hash.
     */
    public boolean isReplaced() {
        return replaced;
    }

    public boolean isHookInstalled() {
        return hookInstalled;
    }
}
