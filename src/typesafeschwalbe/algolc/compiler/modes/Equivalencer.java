package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.UnionFind;

// Decides structural equivalence of modes. Two modes are assumed equal
// while their components are compared, so recursive modes terminate.
public class Equivalencer {

    private static final Logger LOGGER
        = Logger.getLogger(Equivalencer.class.getName());

    public static final int MAX_ROUNDS = 32;

    private static record EqualityEncounter(int rootA, int rootB) {}

    private final ModeTable modes;

    Equivalencer(ModeTable modes) {
        this.modes = modes;
    }

    public boolean equivalent(int a, int b) {
        return this.equivalent(a, b, new HashSet<>());
    }

    private boolean equivalent(
        int a, int b, Set<EqualityEncounter> encountered
    ) {
        int rootA = this.modes.classOf(a);
        int rootB = this.modes.classOf(b);
        if(rootA == rootB) { return true; }
        EqualityEncounter encounter = new EqualityEncounter(
            Math.min(rootA, rootB), Math.max(rootA, rootB)
        );
        if(encountered.contains(encounter)) { return true; }
        encountered.add(encounter);
        boolean equal = this.equivalent(
            this.modes.get(a), this.modes.get(b), encountered
        );
        encountered.remove(encounter);
        return equal;
    }

    private boolean equivalent(
        Mode a, Mode b, Set<EqualityEncounter> encountered
    ) {
        if(a.kind != b.kind) { return false; }
        switch(a.kind) {
            case VOID:
            case HIP:
            case ERROR:
            case VACUUM:
            case ROWS:
                return true;
            case STANDARD:
                return a.name.equals(b.name);
            case INDICANT:
                // an indicant without definition only equals itself
                return a.tag == b.tag;
            case REF:
            case FLEX:
                return this.equivalent(a.sub, b.sub, encountered);
            case ROW:
                return a.dimensions == b.dimensions
                    && this.equivalent(a.sub, b.sub, encountered);
            case PROC: {
                if(a.pack.size() != b.pack.size()) { return false; }
                for(int idx = 0; idx < a.pack.size(); idx += 1) {
                    if(!this.equivalent(
                        a.pack.get(idx).mode(), b.pack.get(idx).mode(),
                        encountered
                    )) {
                        return false;
                    }
                }
                return this.equivalent(a.sub, b.sub, encountered);
            }
            case STRUCT: {
                if(a.pack.size() != b.pack.size()) { return false; }
                for(int idx = 0; idx < a.pack.size(); idx += 1) {
                    Mode.Field fieldA = a.pack.get(idx);
                    Mode.Field fieldB = b.pack.get(idx);
                    if(!fieldA.name().equals(fieldB.name())) { return false; }
                    if(!this.equivalent(
                        fieldA.mode(), fieldB.mode(), encountered
                    )) {
                        return false;
                    }
                }
                return true;
            }
            case UNION:
            case SERIES:
            case STOWED: {
                // members are unordered, but series keep their order
                if(a.kind != Mode.Kind.UNION) {
                    if(a.pack.size() != b.pack.size()) { return false; }
                    for(int idx = 0; idx < a.pack.size(); idx += 1) {
                        if(!this.equivalent(
                            a.pack.get(idx).mode(), b.pack.get(idx).mode(),
                            encountered
                        )) {
                            return false;
                        }
                    }
                    return true;
                }
                return this.containsAll(a, b, encountered)
                    && this.containsAll(b, a, encountered);
            }
            default:
                throw new RuntimeException("unhandled mode kind!");
        }
    }

    private boolean containsAll(
        Mode container, Mode contained, Set<EqualityEncounter> encountered
    ) {
        for(Mode.Field member: contained.pack) {
            boolean found = false;
            for(Mode.Field candidate: container.pack) {
                if(this.equivalent(
                    member.mode(), candidate.mode(), encountered
                )) {
                    found = true;
                    break;
                }
            }
            if(!found) { return false; }
        }
        return true;
    }

    public List<Integer> flatMembers(int union) {
        Set<Integer> seen = new LinkedHashSet<>();
        this.collectMembers(union, seen, new HashSet<>());
        List<Integer> members = new ArrayList<>();
        for(int member: seen) {
            boolean duplicate = false;
            for(int kept: members) {
                if(this.modes.equal(kept, member)) {
                    duplicate = true;
                    break;
                }
            }
            if(!duplicate) { members.add(member); }
        }
        return members;
    }

    private void collectMembers(
        int union, Set<Integer> members, Set<Integer> visiting
    ) {
        int resolved = this.modes.resolve(union);
        if(!visiting.add(resolved)) { return; }
        for(Mode.Field member: this.modes.get(resolved).pack) {
            if(this.modes.kindOf(member.mode()) == Mode.Kind.UNION) {
                this.collectMembers(member.mode(), members, visiting);
            } else {
                members.add(this.modes.resolve(member.mode()));
            }
        }
    }

    // Unites every pair of modes that can be proven equivalent and repeats
    // until a round finds nothing new. Returns the number of rounds.
    public int run() {
        UnionFind<Integer> classes = this.modes.classes();
        int rounds = 0;
        boolean changed = true;
        while(changed && rounds < Equivalencer.MAX_ROUNDS) {
            changed = false;
            rounds += 1;
            this.absorbUnions();
            Map<Mode.Kind, List<Integer>> byKind = new HashMap<>();
            for(int handle = 0; handle < this.modes.count(); handle += 1) {
                int resolved = this.modes.resolve(handle);
                if(resolved != handle) { continue; }
                if(!classes.isRoot(handle)) { continue; }
                byKind.computeIfAbsent(
                    this.modes.exact(handle).kind, k -> new ArrayList<>()
                ).add(handle);
            }
            int united = 0;
            for(List<Integer> candidates: byKind.values()) {
                for(int i = 0; i < candidates.size(); i += 1) {
                    for(int j = i + 1; j < candidates.size(); j += 1) {
                        int a = candidates.get(i);
                        int b = candidates.get(j);
                        if(classes.find(a) == classes.find(b)) { continue; }
                        if(this.equivalent(a, b)) {
                            classes.union(a, b);
                            united += 1;
                        }
                    }
                }
            }
            changed = united > 0;
            LOGGER.fine(
                "equivalencing round " + rounds + " united " + united
                    + " modes, " + classes.roots() + " classes remain"
            );
        }
        this.modes.reintern();
        return rounds;
    }

    // Makes each united mode equivalent to its flattened form, so that
    // UNION(A, UNION(B, C)) and UNION(A, B, C) end up in one class.
    private void absorbUnions() {
        int count = this.modes.count();
        for(int handle = 0; handle < count; handle += 1) {
            if(this.modes.exact(handle).kind != Mode.Kind.UNION) { continue; }
            List<Integer> members = this.flatMembers(handle);
            int flat = this.modes.union(members);
            if(flat != handle) {
                this.modes.classes().union(handle, flat);
            }
        }
    }

}
