package typesafeschwalbe.algolc.compiler;

import java.util.ArrayList;
import java.util.List;

public class UnionFind<T> {

    private static class Entry<T> {
        private T value;
        private int parent;

        private Entry(T value) {
            this.value = value;
            this.parent = -1;
        }
    }

    private final List<Entry<T>> values;
    private int roots;

    public UnionFind() {
        this.values = new ArrayList<>();
        this.roots = 0;
    }

    public int find(int idx) {
        int root = idx;
        while(this.values.get(root).parent != -1) {
            root = this.values.get(root).parent;
        }
        int current = idx;
        while(current != root) {
            Entry<T> entry = this.values.get(current);
            current = entry.parent;
            entry.parent = root;
        }
        return root;
    }

    public int add(T value) {
        int idx = this.values.size();
        this.values.add(new Entry<T>(value));
        this.roots += 1;
        return idx;
    }

    public T get(int idx) {
        return this.values.get(this.find(idx)).value;
    }

    public T getExact(int idx) {
        return this.values.get(idx).value;
    }

    public void set(int idx, T value) {
        this.values.get(this.find(idx)).value = value;
    }

    public boolean union(int idxA, int idxB) {
        int rootA = this.find(idxA);
        int rootB = this.find(idxB);
        if(rootA == rootB) { return false; }
        if(rootA < rootB) {
            this.values.get(rootB).parent = rootA;
        } else {
            this.values.get(rootA).parent = rootB;
        }
        this.roots -= 1;
        return true;
    }

    public boolean isRoot(int idx) {
        return this.values.get(idx).parent == -1;
    }

    public int size() {
        return this.values.size();
    }

    public int roots() {
        return this.roots;
    }

}
