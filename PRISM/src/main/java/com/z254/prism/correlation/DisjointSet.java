package com.z254.prism.correlation;

/**
 * Union-find over the indices {@code 0..size-1} with path compression and union by rank.
 */
public class DisjointSet {

    private final int[] parent;
    private final int[] rank;

    public DisjointSet(int size) {
        this.parent = new int[size];
        this.rank = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int find(int element) {
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[element] != root) {
            int next = parent[element];
            parent[element] = root;
            element = next;
        }
        return root;
    }

    /**
     * @return false if both elements were already connected
     */
    public boolean union(int left, int right) {
        int leftRoot = find(left);
        int rightRoot = find(right);
        if (leftRoot == rightRoot) {
            return false;
        }
        if (rank[leftRoot] < rank[rightRoot]) {
            parent[leftRoot] = rightRoot;
        } else if (rank[leftRoot] > rank[rightRoot]) {
            parent[rightRoot] = leftRoot;
        } else {
            parent[rightRoot] = leftRoot;
            rank[leftRoot]++;
        }
        return true;
    }

    public boolean connected(int left, int right) {
        return find(left) == find(right);
    }

    public int size() {
        return parent.length;
    }
}
