package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;

// Finds the chain of coercions that takes a value of one mode to another
// in a position of a given sort. The chain always dereferences and
// deprocedures before it unites, widens, rows or voids.
public class Coercions {

    public static record Step(Attribute coercion, int mode) {}

    private static final int MAX_DEPTH = 64;

    private final ModeTable modes;
    private int depth;

    public Coercions(ModeTable modes) {
        this.modes = modes;
        this.depth = 0;
    }

    public boolean coercible(int from, int to, Sort sort) {
        return this.plan(from, to, sort) != null;
    }

    // The coercions in the order they apply, each with the mode it yields,
    // or null if there is no way.
    public List<Step> plan(int from, int to, Sort sort) {
        if(this.depth >= Coercions.MAX_DEPTH) { return null; }
        this.depth += 1;
        try {
            return this.planUnguarded(from, to, sort);
        } finally {
            this.depth -= 1;
        }
    }

    private static List<Step> prepend(Step step, List<Step> rest) {
        if(rest == null) { return null; }
        List<Step> steps = new ArrayList<>();
        steps.add(step);
        steps.addAll(rest);
        return steps;
    }

    private List<Step> planUnguarded(int from, int to, Sort sort) {
        Mode a = this.modes.get(from);
        Mode b = this.modes.get(to);
        if(a.is(Mode.Kind.ERROR) || b.is(Mode.Kind.ERROR)) {
            return new ArrayList<>();
        }
        if(this.same(from, to) || a.is(Mode.Kind.HIP)) {
            return new ArrayList<>();
        }
        if(b.is(Mode.Kind.VOID)) {
            if(!sort.includes(Sort.STRONG)) { return null; }
            if(a.is(Mode.Kind.PROC) && a.pack.isEmpty()) {
                return Coercions.prepend(
                    new Step(Attribute.DEPROCEDURING, a.sub),
                    this.plan(a.sub, to, sort)
                );
            }
            List<Step> voided = new ArrayList<>();
            voided.add(new Step(Attribute.VOIDING, to));
            return voided;
        }
        if(a.is(Mode.Kind.VACUUM) && b.isRowLike()) {
            return new ArrayList<>();
        }
        if(b.is(Mode.Kind.ROWS) && a.isRowLike()) {
            return new ArrayList<>();
        }
        List<Step> direct = this.direct(from, to, sort);
        if(direct != null) { return direct; }
        if(a.is(Mode.Kind.PROC) && a.pack.isEmpty()) {
            return Coercions.prepend(
                new Step(Attribute.DEPROCEDURING, a.sub),
                this.plan(a.sub, to, sort)
            );
        }
        if(a.is(Mode.Kind.REF) && sort.includes(Sort.WEAK)) {
            boolean keepsName = this.modes.kindOf(a.sub) == Mode.Kind.REF;
            if(sort == Sort.WEAK && !keepsName) { return null; }
            return Coercions.prepend(
                new Step(Attribute.DEREFERENCING, a.sub),
                this.plan(a.sub, to, sort)
            );
        }
        return null;
    }

    private List<Step> direct(int from, int to, Sort sort) {
        Mode b = this.modes.get(to);
        if(sort.includes(Sort.FIRM) && b.is(Mode.Kind.UNION)
                && this.unitable(from, to)) {
            List<Step> united = new ArrayList<>();
            united.add(new Step(Attribute.UNITING, to));
            return united;
        }
        if(!sort.includes(Sort.STRONG)) { return null; }
        boolean transput = this.isTransputUnion(to, this.modes.simplout())
                && this.printable(from)
            || this.isTransputUnion(to, this.modes.simplin())
                && this.readable(from);
        if(transput) {
            List<Step> united = new ArrayList<>();
            united.add(new Step(Attribute.UNITING, to));
            return united;
        }
        List<Step> widened = new ArrayList<>();
        for(int w = this.widened(from); w != Node.NONE; w = this.widened(w)) {
            widened.add(new Step(Attribute.WIDENING, w));
            if(this.same(w, to)) { return widened; }
        }
        if(b.isRowLike()) {
            Mode row = this.modes.get(this.modes.deflex(to));
            if(row.is(Mode.Kind.ROW)) {
                int element = row.dimensions > 1
                    ? this.modes.row(row.dimensions - 1, row.sub)
                    : row.sub;
                List<Step> rowed = this.plan(from, element, Sort.STRONG);
                if(rowed != null) {
                    rowed.add(new Step(Attribute.ROWING, to));
                    return rowed;
                }
            }
        }
        Mode a = this.modes.get(from);
        if(b.is(Mode.Kind.REF) && a.is(Mode.Kind.REF)) {
            Mode row = this.modes.get(b.sub);
            if(row.isRowLike()) {
                Mode deflexed = this.modes.get(this.modes.deflex(b.sub));
                int element = deflexed.dimensions > 1
                    ? this.modes.row(deflexed.dimensions - 1, deflexed.sub)
                    : deflexed.sub;
                if(this.same(a.sub, element)) {
                    List<Step> rowed = new ArrayList<>();
                    rowed.add(new Step(Attribute.ROWING, to));
                    return rowed;
                }
            }
        }
        return null;
    }

    public boolean same(int a, int b) {
        if(this.modes.equal(a, b)) { return true; }
        if(this.modes.kindOf(a) == Mode.Kind.REF
                || this.modes.kindOf(b) == Mode.Kind.REF) {
            return false;
        }
        return this.modes.equal(this.modes.deflex(a), this.modes.deflex(b));
    }

    public boolean unitable(int from, int union) {
        List<Integer> members = this.modes.equivalencer().flatMembers(union);
        if(this.modes.kindOf(from) == Mode.Kind.UNION) {
            for(int member: this.modes.equivalencer().flatMembers(from)) {
                if(!this.isMember(member, members)) { return false; }
            }
            return true;
        }
        return this.isMember(from, members);
    }

    private boolean isMember(int mode, List<Integer> members) {
        for(int member: members) {
            if(this.same(mode, member)) { return true; }
        }
        return false;
    }

    private boolean isTransputUnion(int mode, int union) {
        return union != Node.NONE && this.modes.equal(mode, union);
    }

    // any mode print and write can take apart, not only the SIMPLOUT members
    public boolean printable(int mode) {
        return this.isLayoutOrFormat(mode) || this.isTransput(mode, false);
    }

    public boolean readable(int mode) {
        if(this.isLayoutOrFormat(mode)) { return true; }
        Mode m = this.modes.get(mode);
        return m.is(Mode.Kind.REF) && this.isTransput(m.sub, true);
    }

    private boolean isLayoutOrFormat(int mode) {
        if(this.modes.isStandard(mode, "FORMAT")) { return true; }
        Mode m = this.modes.get(mode);
        if(!m.is(Mode.Kind.PROC) || m.pack.size() != 1
                || this.modes.kindOf(m.sub) != Mode.Kind.VOID) {
            return false;
        }
        Mode parameter = this.modes.get(m.pack.get(0).mode());
        return parameter.is(Mode.Kind.REF)
            && this.modes.isStandard(parameter.sub, "FILE");
    }

    private boolean isTransput(int mode, boolean reading) {
        Mode m = this.modes.get(mode);
        switch(m.kind) {
            case STANDARD:
                return m.name.endsWith("INT") || m.name.endsWith("REAL")
                    || m.name.endsWith("BITS") || m.name.equals("BOOL")
                    || m.name.equals("CHAR");
            case ROW:
                return this.isTransput(m.sub, reading)
                    || this.isLayoutOrFormat(m.sub);
            case FLEX:
                if(this.modes.equal(m.sub, this.modes.ROW_CHAR)) {
                    return true;
                }
                return !reading && this.isTransput(m.sub, reading);
            case STRUCT:
            case UNION:
                for(Mode.Field field: m.pack) {
                    boolean member = this.isTransput(field.mode(), reading)
                        || this.isLayoutOrFormat(field.mode());
                    if(!member) { return false; }
                }
                return true;
            default:
                return false;
        }
    }

    public int widened(int mode) {
        Mode m = this.modes.get(mode);
        if(!m.is(Mode.Kind.STANDARD)) { return Node.NONE; }
        String name = m.name;
        if(name.endsWith("INT")) {
            return this.modes.standard(
                name.substring(0, name.length() - 3) + "REAL"
            );
        }
        if(name.endsWith("REAL")) {
            return this.modes.standard(
                name.substring(0, name.length() - 4) + "COMPL"
            );
        }
        if(name.equals("BITS")) { return this.modes.ROW_BOOL; }
        if(name.equals("BYTES")) { return this.modes.ROW_CHAR; }
        return Node.NONE;
    }

    // The mode that every one of branches strongly coerces to,
    // preferring flexible rows, or Node.NONE.
    public int balance(List<Integer> branches) {
        List<Integer> candidates = new ArrayList<>();
        for(int branch: branches) {
            Mode.Kind kind = this.modes.kindOf(branch);
            if(kind == Mode.Kind.HIP || kind == Mode.Kind.ERROR
                    || kind == Mode.Kind.VACUUM) {
                continue;
            }
            if(kind == Mode.Kind.FLEX) {
                candidates.add(0, branch);
            } else {
                candidates.add(branch);
            }
        }
        if(candidates.isEmpty()) {
            return branches.isEmpty()? Node.NONE : branches.get(0);
        }
        for(int candidate: candidates) {
            boolean dominates = true;
            for(int branch: branches) {
                if(!this.coercible(branch, candidate, Sort.STRONG)) {
                    dominates = false;
                    break;
                }
            }
            if(dominates) { return candidate; }
        }
        return Node.NONE;
    }

}
