package com.curvemarket.state;

/**
 * Implemented by anything whose state must be restored when an engine call aborts.
 *
 * <p>{@link #checkpoint()} captures the current state and returns the action that puts it
 * back. The engine takes a checkpoint of every participant before running an operation and
 * runs the restorers, newest first, if the operation throws.
 */
public interface RollbackSupport {

    Runnable checkpoint();
}
