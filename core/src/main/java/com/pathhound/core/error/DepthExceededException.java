package com.pathhound.core.error;

/** 등록하려는 스캔 깊이가 maxDepth 를 넘음 */
public class DepthExceededException extends RuntimeException {
    private final int depth;
    private final int maxDepth;

    public DepthExceededException(int depth, int maxDepth) {
        super("depth " + depth + " exceeds maxDepth " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() { return depth; }
    public int getMaxDepth() { return maxDepth; }
}
