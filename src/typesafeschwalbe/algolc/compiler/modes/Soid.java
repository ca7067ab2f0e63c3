package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayDeque;
import java.util.Deque;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class Soid {

    public Sort sort;
    public int mode;
    public boolean cast;
    public Node producer;

    private Soid() {}

    @Override
    public String toString() {
        return this.sort + " " + this.mode;
    }

    public static class Pool {

        private final Deque<Soid> free;
        private int created;

        public Pool() {
            this.free = new ArrayDeque<>();
            this.created = 0;
        }

        public Soid obtain(Sort sort, int mode, Node producer) {
            Soid soid = this.free.poll();
            if(soid == null) {
                soid = new Soid();
                this.created += 1;
            }
            soid.sort = sort;
            soid.mode = mode;
            soid.cast = false;
            soid.producer = producer;
            return soid;
        }

        public void release(Soid soid) {
            soid.producer = null;
            this.free.push(soid);
        }

        public int created() {
            return this.created;
        }

    }

}
