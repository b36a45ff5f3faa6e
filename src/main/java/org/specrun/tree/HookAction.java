package org.specrun.tree;

/**
 * Setup or teardown action attached to a group.
 */
@FunctionalInterface
public interface HookAction {
    void run() throws Exception;
}
