package com.privacygraph.storage.index;

/** Результат поиска в индексе */
public record IndexHit(String entityId, double distance) {
}
