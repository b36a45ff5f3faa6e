package org.specrun.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hooks declared on one group, each list in declaration order.
 */
public final class Hooks {
    public static final Hooks NONE = new Hooks(List.of(), List.of(), List.of(), List.of(), List.of());

    private final List<HookAction> beforeAll;
    private final List<HookAction> afterAll;
    private final List<HookAction> beforeEach;
    private final List<HookAction> afterEach;
    private final List<AroundHook> around;

    private Hooks(
        List<HookAction> beforeAll,
        List<HookAction> afterAll,
        List<HookAction> beforeEach,
        List<HookAction> afterEach,
        List<AroundHook> around
    ) {
        this.beforeAll = List.copyOf(beforeAll);
        this.afterAll = List.copyOf(afterAll);
        this.beforeEach = List.copyOf(beforeEach);
        this.afterEach = List.copyOf(afterEach);
        this.around = List.copyOf(around);
    }

    public List<HookAction> beforeAll() {
        return beforeAll;
    }

    public List<HookAction> afterAll() {
        return afterAll;
    }

    public List<HookAction> beforeEach() {
        return beforeEach;
    }

    public List<HookAction> afterEach() {
        return afterEach;
    }

    public List<AroundHook> around() {
        return around;
    }

    public boolean hasGroupScope() {
        return !beforeAll.isEmpty() || !afterAll.isEmpty();
    }

    public boolean isEmpty() {
        return !hasGroupScope() && beforeEach.isEmpty() && afterEach.isEmpty() && around.isEmpty();
    }

    public Hooks withBeforeAll(HookAction action) {
        return new Hooks(append(beforeAll, action), afterAll, beforeEach, afterEach, around);
    }

    public Hooks withAfterAll(HookAction action) {
        return new Hooks(beforeAll, append(afterAll, action), beforeEach, afterEach, around);
    }

    public Hooks withBeforeEach(HookAction action) {
        return new Hooks(beforeAll, afterAll, append(beforeEach, action), afterEach, around);
    }

    public Hooks withAfterEach(HookAction action) {
        return new Hooks(beforeAll, afterAll, beforeEach, append(afterEach, action), around);
    }

    public Hooks withAround(AroundHook hook) {
        return new Hooks(beforeAll, afterAll, beforeEach, afterEach, append(around, hook));
    }

    private static <T> List<T> append(List<T> source, T item) {
        List<T> copy = new ArrayList<>(source);
        copy.add(Objects.requireNonNull(item, "hook"));
        return copy;
    }
}
