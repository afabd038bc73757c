package com.gentoro.gae.engine;

/** A graph held in engine memory. Counts are {@code -1} when the engine did not report them. */
public record GraphInfo(String id, long vertexCount, long edgeCount) {}
