package io.cdlengine.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * What the caller is expected to do with a failing atomic constraint. The verdict is the same for
 * every action; the evaluator only uses it to choose the log level of the failure.
 */
public enum Action {
    REJECT("reject"),
    WARN("warn"),
    LOG("log");

    private final String wireName;

    Action(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Action> fromWireName(String name) {
        return Arrays.stream(values()).filter(a -> a.wireName.equals(name)).findFirst();
    }
}
