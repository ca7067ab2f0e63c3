package typesafeschwalbe.algolc.compiler.symbols;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.algolc.compiler.Arena;
import typesafeschwalbe.algolc.compiler.frontend.Node;

public class Symbols {

    private final Arena<SymbolTable> tables;
    private final Arena<Tag> tags;

    public Symbols() {
        this.tables = new Arena<>();
        this.tags = new Arena<>();
    }

    public int newTable(int parent) {
        int level = parent == Node.NONE? 0 : this.table(parent).level + 1;
        return this.tables.add(handle -> new SymbolTable(handle, parent, level));
    }

    public SymbolTable table(int handle) {
        return this.tables.get(handle);
    }

    public Tag tag(int handle) {
        return this.tags.get(handle);
    }

    public int tableCount() {
        return this.tables.size();
    }

    public List<Tag> allTags() {
        return this.tags.entries();
    }

    public Tag declare(
        int table, Tag.Kind kind, String name, Node node, Tag.Origin origin
    ) {
        int handle = this.tags.add(
            h -> new Tag(h, kind, name, table, node, origin)
        );
        this.table(table).chain(kind).add(handle);
        return this.tag(handle);
    }

    public Tag findLocal(int table, Tag.Kind kind, String name) {
        for(int handle: this.table(table).chain(kind)) {
            Tag tag = this.tag(handle);
            if(tag.name.equals(name)) { return tag; }
        }
        return null;
    }

    public Tag lookUp(int table, Tag.Kind kind, String name) {
        for(int t = table; t != Node.NONE; t = this.table(t).parent) {
            Tag found = this.findLocal(t, kind, name);
            if(found != null) { return found; }
        }
        return null;
    }

    public List<List<Tag>> operatorsVisible(int table, String name) {
        List<List<Tag>> ranges = new ArrayList<>();
        for(int t = table; t != Node.NONE; t = this.table(t).parent) {
            List<Tag> local = new ArrayList<>();
            for(int handle: this.table(t).chain(Tag.Kind.OPERATOR)) {
                Tag tag = this.tag(handle);
                if(tag.name.equals(name)) { local.add(tag); }
            }
            if(!local.isEmpty()) { ranges.add(local); }
        }
        return ranges;
    }

    public boolean isAncestor(int ancestor, int table) {
        for(int t = table; t != Node.NONE; t = this.table(t).parent) {
            if(t == ancestor) { return true; }
        }
        return false;
    }

    // Moves a range below another one, e.g. the body of a routine text
    // below the range of its parameters. Levels are brought up to date by
    // finalise.
    public void reparent(int table, int parent) {
        if(this.isAncestor(table, parent)) {
            throw new IllegalArgumentException(
                "reparenting " + table + " would create a cycle!"
            );
        }
        this.table(table).parent = parent;
    }

    private int depthOf(int table) {
        int depth = 0;
        for(int t = this.table(table).parent; t != Node.NONE;
                t = this.table(t).parent) {
            depth += 1;
        }
        return depth;
    }

    // Computes for every range the level of the nearest range, itself
    // included, that declares something and therefore owns storage.
    public void finalise() {
        for(SymbolTable table: this.tables.entries()) {
            table.level = this.depthOf(table.handle);
        }
        for(SymbolTable table: this.tables.entries()) {
            int level = table.level;
            for(int t = table.handle; t != Node.NONE;
                    t = this.table(t).parent) {
                SymbolTable current = this.table(t);
                level = current.level;
                if(current.hasDeclarations() || current.routineBoundary) {
                    break;
                }
            }
            table.storageLevel = level;
        }
    }

}
