package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.algolc.compiler.Arena;
import typesafeschwalbe.algolc.compiler.UnionFind;
import typesafeschwalbe.algolc.compiler.frontend.Node;

// The interned list of every mode of a compilation. Entries never change
// once added, except for the definition of an indicant; modes proven
// equivalent share a set in classes.
public class ModeTable {

    public static final String[] LENGTHS = { "", "LONG ", "LONG LONG " };

    private final Arena<Mode> entries;
    private final UnionFind<Integer> classes;
    private final Map<String, Integer> interned;
    private final Map<String, Integer> standard;
    private final Map<Integer, String> aliases;
    private Equivalencer equivalencer;
    private int simplout = Node.NONE;
    private int simplin = Node.NONE;

    public final int VOID;
    public final int HIP;
    public final int ERROR;
    public final int VACUUM;
    public final int ROWS;
    public final int INT;
    public final int REAL;
    public final int BOOL;
    public final int CHAR;
    public final int BITS;
    public final int BYTES;
    public final int FORMAT;
    public final int FILE;
    public final int SEMA;
    public final int COMPL;
    public final int ROW_CHAR;
    public final int ROW_BOOL;
    public final int STRING;

    public ModeTable() {
        this.entries = new Arena<>();
        this.classes = new UnionFind<>();
        this.interned = new HashMap<>();
        this.standard = new HashMap<>();
        this.aliases = new HashMap<>();
        this.VOID = this.add(Mode.of(Mode.Kind.VOID));
        this.HIP = this.add(Mode.of(Mode.Kind.HIP));
        this.ERROR = this.add(Mode.of(Mode.Kind.ERROR));
        this.VACUUM = this.add(Mode.of(Mode.Kind.VACUUM));
        this.ROWS = this.add(Mode.of(Mode.Kind.ROWS));
        this.standard.put("VOID", this.VOID);
        for(String length: ModeTable.LENGTHS) {
            this.addStandard(length + "INT");
            this.addStandard(length + "REAL");
            this.addStandard(length + "BITS");
            this.addStandard(length + "BYTES");
            int real = this.standard(length + "REAL");
            int compl = this.struct(List.of(
                new Mode.Field("re", real), new Mode.Field("im", real)
            ));
            this.alias(length + "COMPL", compl);
        }
        this.INT = this.standard("INT");
        this.REAL = this.standard("REAL");
        this.BITS = this.standard("BITS");
        this.BYTES = this.standard("BYTES");
        this.COMPL = this.standard("COMPL");
        this.BOOL = this.addStandard("BOOL");
        this.CHAR = this.addStandard("CHAR");
        this.FORMAT = this.addStandard("FORMAT");
        this.FILE = this.addStandard("FILE");
        this.SEMA = this.addStandard("SEMA");
        this.ROW_CHAR = this.row(1, this.CHAR);
        this.ROW_BOOL = this.row(1, this.BOOL);
        this.STRING = this.flex(this.ROW_CHAR);
        this.alias("STRING", this.STRING);
    }

    private int addStandard(String name) {
        int handle = this.add(Mode.standard(name));
        this.standard.put(name, handle);
        return handle;
    }

    private void alias(String name, int mode) {
        this.standard.put(name, mode);
        this.aliases.put(mode, name);
    }

    public int standard(String name) {
        return this.standard.getOrDefault(name, Node.NONE);
    }

    // interning

    private String keyOf(Mode mode) {
        StringBuilder key = new StringBuilder(mode.kind.name());
        key.append('|').append(mode.name);
        key.append('|').append(mode.tag);
        key.append('|').append(mode.dimensions);
        key.append('|').append(
            mode.sub == Node.NONE? Node.NONE : this.classOf(mode.sub)
        );
        for(Mode.Field field: mode.pack) {
            key.append('|').append(field.name());
            key.append(':').append(this.classOf(field.mode()));
        }
        return key.toString();
    }

    public int add(Mode mode) {
        String key = this.keyOf(mode);
        Integer existing = this.interned.get(key);
        if(existing != null) { return existing; }
        int handle = this.entries.add(h -> mode);
        int classHandle = this.classes.add(handle);
        if(classHandle != handle) {
            throw new IllegalStateException("mode handles out of step!");
        }
        this.interned.put(key, handle);
        return handle;
    }

    // Rebuilds the intern map once equivalences have been found, so that
    // later additions land on the surviving entries.
    void reintern() {
        this.interned.clear();
        for(int handle = 0; handle < this.entries.size(); handle += 1) {
            Mode mode = this.entries.get(handle);
            this.interned.putIfAbsent(this.keyOf(mode), handle);
        }
    }

    public int ref(int sub) { return this.add(Mode.ref(sub)); }
    public int flex(int sub) { return this.add(Mode.flex(sub)); }
    public int row(int dimensions, int sub) {
        return this.add(Mode.row(dimensions, sub));
    }
    public int proc(List<Integer> parameters, int result) {
        return this.add(Mode.proc(parameters, result));
    }
    public int struct(List<Mode.Field> fields) {
        return this.add(Mode.struct(fields));
    }
    public int union(List<Integer> members) {
        return this.add(Mode.union(members));
    }

    public int indicant(String name, int tag) {
        return this.add(Mode.indicant(name, tag));
    }

    void setTransput(int simplout, int simplin) {
        this.simplout = simplout;
        this.simplin = simplin;
    }

    public int simplout() { return this.simplout; }
    public int simplin() { return this.simplin; }

    // access

    public int count() {
        return this.entries.size();
    }

    public Mode exact(int handle) {
        return this.entries.get(handle);
    }

    // Follows indicants to the mode they stand for. A cycle of indicants
    // that never reaches a structural mode yields the error mode.
    public int resolve(int handle) {
        int current = handle;
        for(int step = 0; step <= this.entries.size(); step += 1) {
            Mode mode = this.entries.get(current);
            if(mode.kind != Mode.Kind.INDICANT
                    || mode.definition == Node.NONE) {
                return current;
            }
            current = mode.definition;
        }
        return this.ERROR;
    }

    public Mode get(int handle) {
        return this.entries.get(this.resolve(handle));
    }

    public Mode.Kind kindOf(int handle) {
        return this.get(handle).kind;
    }

    public int classOf(int handle) {
        return this.classes.find(this.resolve(handle));
    }

    UnionFind<Integer> classes() {
        return this.classes;
    }

    public Equivalencer equivalencer() {
        if(this.equivalencer == null) {
            this.equivalencer = new Equivalencer(this);
        }
        return this.equivalencer;
    }

    public boolean equal(int a, int b) {
        if(this.classOf(a) == this.classOf(b)) { return true; }
        if(this.equivalencer().equivalent(a, b)) {
            this.classes.union(this.resolve(a), this.resolve(b));
            return true;
        }
        return false;
    }

    public boolean isStandard(int handle, String name) {
        return this.standard.containsKey(name)
            && this.equal(handle, this.standard.get(name));
    }

    public int deflex(int handle) {
        return this.deflex(handle, new HashSet<>());
    }

    private int deflex(int handle, Set<Integer> visiting) {
        int resolved = this.resolve(handle);
        Mode mode = this.entries.get(resolved);
        if(!visiting.add(resolved)) { return resolved; }
        try {
            switch(mode.kind) {
                case FLEX:
                    return this.deflex(mode.sub, visiting);
                case ROW: {
                    int sub = this.deflex(mode.sub, visiting);
                    return sub == this.resolve(mode.sub)
                        ? resolved
                        : this.row(mode.dimensions, sub);
                }
                case STRUCT: {
                    List<Mode.Field> fields = new ArrayList<>();
                    boolean changed = false;
                    for(Mode.Field field: mode.pack) {
                        int sub = this.deflex(field.mode(), visiting);
                        changed |= sub != this.resolve(field.mode());
                        fields.add(new Mode.Field(field.name(), sub));
                    }
                    return changed? this.struct(fields) : resolved;
                }
                default:
                    return resolved;
            }
        } finally {
            visiting.remove(resolved);
        }
    }

    // Whether values of the mode may contain names or routines, which is
    // what the scope checker has to follow.
    public boolean hasNames(int handle) {
        return this.hasNames(handle, new HashSet<>());
    }

    private boolean hasNames(int handle, Set<Integer> visiting) {
        int resolved = this.resolve(handle);
        if(!visiting.add(resolved)) { return false; }
        Mode mode = this.entries.get(resolved);
        switch(mode.kind) {
            case REF:
            case PROC:
                return true;
            case ROW:
            case FLEX:
                return this.hasNames(mode.sub, visiting);
            case STRUCT:
            case UNION:
                for(Mode.Field field: mode.pack) {
                    if(this.hasNames(field.mode(), visiting)) { return true; }
                }
                return false;
            default:
                return false;
        }
    }

    // printing

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        for(int handle = 0; handle < this.entries.size(); handle += 1) {
            output.append(handle).append(": ");
            output.append(this.toString(handle)).append('\n');
        }
        return output.toString();
    }

    public String toString(int handle) {
        if(handle == Node.NONE) { return "no mode"; }
        StringBuilder output = new StringBuilder();
        this.append(output, handle, new HashSet<>());
        return output.toString();
    }

    private void append(StringBuilder output, int handle, Set<Integer> seen) {
        Mode exact = this.entries.get(handle);
        if(exact.kind == Mode.Kind.INDICANT) {
            output.append(exact.name);
            return;
        }
        String alias = this.aliases.get(handle);
        if(alias != null) {
            output.append(alias);
            return;
        }
        if(!seen.add(handle)) {
            output.append("...");
            return;
        }
        switch(exact.kind) {
            case STANDARD:
                output.append(exact.name);
                break;
            case VOID:
                output.append("VOID");
                break;
            case HIP:
                output.append("HIP");
                break;
            case ERROR:
                output.append("ERROR");
                break;
            case VACUUM:
                output.append("VACUUM");
                break;
            case ROWS:
                output.append("ROWS");
                break;
            case REF:
                output.append("REF ");
                this.append(output, exact.sub, seen);
                break;
            case FLEX:
                output.append("FLEX ");
                this.append(output, exact.sub, seen);
                break;
            case ROW:
                output.append('[');
                output.append(",".repeat(exact.dimensions - 1));
                output.append("] ");
                this.append(output, exact.sub, seen);
                break;
            case PROC:
                output.append("PROC ");
                if(!exact.pack.isEmpty()) {
                    this.appendPack(output, exact, seen);
                    output.append(' ');
                }
                this.append(output, exact.sub, seen);
                break;
            case STRUCT:
                output.append("STRUCT ");
                this.appendPack(output, exact, seen);
                break;
            case UNION:
                output.append("UNION ");
                this.appendPack(output, exact, seen);
                break;
            case SERIES:
            case STOWED:
                output.append(exact.kind == Mode.Kind.SERIES? "SERIES " : "STOWED ");
                this.appendPack(output, exact, seen);
                break;
            default:
                throw new RuntimeException("unhandled mode kind!");
        }
        seen.remove(handle);
    }

    private void appendPack(StringBuilder output, Mode mode, Set<Integer> seen) {
        output.append('(');
        for(int idx = 0; idx < mode.pack.size(); idx += 1) {
            if(idx > 0) { output.append(", "); }
            Mode.Field field = mode.pack.get(idx);
            this.append(output, field.mode(), seen);
            if(field.name() != null) {
                output.append(' ').append(field.name());
            }
        }
        output.append(')');
    }

}
