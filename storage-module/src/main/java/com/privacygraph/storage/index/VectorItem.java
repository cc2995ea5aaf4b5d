package com.privacygraph.storage.index;

import com.github.jelmerk.hnswlib.core.Item;

/** Обёртка вектора сущности для hnswlib */
public class VectorItem implements Item<String, float[]> {
    private static final long serialVersionUID = 1L;

    private final String id;
    private final float[] vector;
    private final long version;

    VectorItem(String id, float[] vector, long version) {
        this.id = id;
        this.vector = vector;
        this.version = version;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public float[] vector() {
        return vector;
    }

    @Override
    public int dimensions() {
        return vector.length;
    }

    /** Версия сущности: hnswlib не даёт старой версии вытеснить новую */
    @Override
    public long version() {
        return version;
    }
}
