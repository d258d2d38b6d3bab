package com.ospicorp.tumorgrowth.batch;

import java.util.List;

@FunctionalInterface
public interface ChunkTask<T, R> {

  List<R> apply(int chunkIndex, int totalChunks, List<T> chunk);
}
