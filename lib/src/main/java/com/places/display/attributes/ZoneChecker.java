package com.places.display.attributes;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Answers whether the tracked subject is currently inside a zone. */
@FunctionalInterface
public interface ZoneChecker {

    CompletionStage<Boolean> inZone();

    static ZoneChecker fixed(boolean inZone) {
        return () -> CompletableFuture.completedFuture(inZone);
    }
}
