package com.privacygraph.storage.index;

public record VersionedVector(long version, float[] vector) {
}
