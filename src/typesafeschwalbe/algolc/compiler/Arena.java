package typesafeschwalbe.algolc.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

public class Arena<T> {

    private final List<T> entries;

    public Arena() {
        this.entries = new ArrayList<>();
    }

    public int add(IntFunction<T> create) {
        int handle = this.entries.size();
        this.entries.add(create.apply(handle));
        return handle;
    }

    public T get(int handle) {
        if(handle < 0 || handle >= this.entries.size()) {
            throw new IllegalArgumentException(
                "Arena handle " + handle + " is out of range!"
            );
        }
        return this.entries.get(handle);
    }

    public int size() {
        return this.entries.size();
    }

    public List<T> entries() {
        return Collections.unmodifiableList(this.entries);
    }

}
