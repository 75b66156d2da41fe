package com.herzen.metrics.error;

import java.util.Set;

public class UnknownItemException extends MetricEngineException {
    private final Set<String> itemIds;

    public UnknownItemException(Set<String> itemIds, String level) {
        super(ErrorKind.UNKNOWN_ITEM, "Coverage references items that do not exist at level " + level + ": " + itemIds);
        this.itemIds = Set.copyOf(itemIds);
    }

    public UnknownItemException(String message, Set<String> itemIds) {
        super(ErrorKind.UNKNOWN_ITEM, message);
        this.itemIds = Set.copyOf(itemIds);
    }

    public Set<String> itemIds() {
        return itemIds;
    }
}
