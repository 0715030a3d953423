package com.example.tactics.grid;

/**
 * Search scratch for {@link Pathfinder}. Lives only for the duration of one search.
 */
final class PathNode implements Comparable<PathNode> {

    final GridPosition position;
    /** 1 when an odd number of diagonals has been taken so far; always 0 for Chebyshev. */
    final int diagonalParity;
    final int g;
    final int h;
    final PathNode parent;
    /** Insertion order, the last tie-breaker, so searches are deterministic. */
    final long sequence;

    PathNode(GridPosition position, int diagonalParity, int g, int h, PathNode parent, long sequence) {
        this.position = position;
        this.diagonalParity = diagonalParity;
        this.g = g;
        this.h = h;
        this.parent = parent;
        this.sequence = sequence;
    }

    int f() {
        return g + h;
    }

    /** Key identifying the search state this node represents. */
    long stateKey() {
        return stateKey(position, diagonalParity);
    }

    static long stateKey(GridPosition pos, int parity) {
        return (((long) pos.x()) << 33) | (((long) pos.y()) << 1) | parity;
    }

    @Override
    public int compareTo(PathNode other) {
        int c = Integer.compare(f(), other.f());
        if (c != 0) return c;
        c = Integer.compare(h, other.h);
        if (c != 0) return c;
        return Long.compare(sequence, other.sequence);
    }
}
