package typesafeschwalbe.algolc.compiler.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import typesafeschwalbe.algolc.compiler.Source;
import typesafeschwalbe.algolc.compiler.modes.Sort;

public class Node {

    public static final int NONE = -1;

    private Attribute attribute;
    public final String symbol;
    public final Source source;

    private Node sub;
    private Node next;
    private Node previous;
    private Node parent;

    public int table = NONE;
    public int tag = NONE;
    public int mode = NONE;

    // the coercion the mode checker demanded at this node, if any
    public int expectedMode = NONE;
    public Sort expectedSort = null;

    public Node(Attribute attribute, String symbol, Source source) {
        this.attribute = attribute;
        this.symbol = symbol;
        this.source = source;
    }

    public Attribute attribute() { return this.attribute; }
    public Node sub() { return this.sub; }
    public Node next() { return this.next; }
    public Node previous() { return this.previous; }
    public Node parent() { return this.parent; }

    public boolean is(Attribute attribute) {
        return this.attribute == attribute;
    }

    public boolean isOneOf(Attribute... attributes) {
        for(Attribute a: attributes) {
            if(this.attribute == a) { return true; }
        }
        return false;
    }

    public static boolean is(Node node, Attribute attribute) {
        return node != null && node.attribute == attribute;
    }

    // Upgrades the category in place. Only legal while the node keeps its
    // children, e.g. a folded part becoming the clause part it stands for.
    public void become(Attribute attribute) {
        this.attribute = attribute;
    }

    public void setSub(Node first) {
        this.sub = first;
        for(Node child = first; child != null; child = child.next) {
            child.parent = this;
        }
    }

    public void append(Node node) {
        node.parent = this;
        node.next = null;
        if(this.sub == null) {
            this.sub = node;
            node.previous = null;
            return;
        }
        Node last = this.sub.last();
        last.next = node;
        node.previous = last;
    }

    public Node last() {
        Node current = this;
        while(current.next != null) {
            current = current.next;
        }
        return current;
    }

    public static void link(Node a, Node b) {
        if(a != null) { a.next = b; }
        if(b != null) { b.previous = a; }
    }

    // Replaces the sibling span from first to last by a new
    // node owning that span.
    public static Node fold(Node first, Node last, Attribute attribute) {
        Node folded = new Node(
            attribute, first.symbol, Source.span(first.source, last.source)
        );
        folded.table = first.table;
        Node before = first.previous;
        Node after = last.next;
        Node owner = first.parent;
        folded.parent = owner;
        first.previous = null;
        last.next = null;
        folded.setSub(first);
        Node.link(before, folded);
        Node.link(folded, after);
        if(owner != null && owner.sub == first) {
            owner.sub = folded;
        }
        return folded;
    }

    public Node wrap(Attribute attribute) {
        return Node.fold(this, this, attribute);
    }

    public void remove() {
        if(this.parent != null && this.parent.sub == this) {
            this.parent.sub = this.next;
        }
        Node.link(this.previous, this.next);
        if(this.previous == null && this.next != null) {
            this.next.previous = null;
        }
        this.previous = null;
        this.next = null;
        this.parent = null;
    }

    public void insertAfter(Node node) {
        node.parent = this.parent;
        Node after = this.next;
        Node.link(this, node);
        Node.link(node, after);
    }

    public List<Node> children() {
        List<Node> children = new ArrayList<>();
        for(Node child = this.sub; child != null; child = child.next) {
            children.add(child);
        }
        return children;
    }

    public int childCount() {
        int count = 0;
        for(Node child = this.sub; child != null; child = child.next) {
            count += 1;
        }
        return count;
    }

    public Node child(Attribute attribute) {
        for(Node child = this.sub; child != null; child = child.next) {
            if(child.attribute == attribute) { return child; }
        }
        return null;
    }

    public Node unwrap() {
        Node current = this;
        while(current.attribute.isWrapper() && current.sub != null
                && current.sub.next == null) {
            current = current.sub;
        }
        return current;
    }

    public Node findFirst(Attribute attribute) {
        if(this.attribute == attribute) { return this; }
        for(Node child = this.sub; child != null; child = child.next) {
            Node found = child.findFirst(attribute);
            if(found != null) { return found; }
        }
        return null;
    }

    public List<Node> findAll(Attribute attribute) {
        List<Node> found = new ArrayList<>();
        this.collect(attribute, found);
        return found;
    }

    private void collect(Attribute attribute, List<Node> found) {
        if(this.attribute == attribute) { found.add(this); }
        for(Node child = this.sub; child != null; child = child.next) {
            child.collect(attribute, found);
        }
    }

    @Override
    public String toString() {
        if(this.sub == null && !this.symbol.isEmpty()) {
            return this.attribute + " \"" + this.symbol + "\"";
        }
        return this.attribute.toString();
    }

    public String toTreeString(IntFunction<String> modeNames) {
        StringBuilder output = new StringBuilder();
        this.appendTree(output, 0, modeNames);
        return output.toString();
    }

    private void appendTree(
        StringBuilder output, int depth, IntFunction<String> modeNames
    ) {
        output.append("  ".repeat(depth));
        output.append(this.toString());
        if(this.mode != NONE && modeNames != null) {
            output.append(" : ");
            output.append(modeNames.apply(this.mode));
        }
        output.append("\n");
        for(Node child = this.sub; child != null; child = child.next) {
            child.appendTree(output, depth + 1, modeNames);
        }
    }

}
