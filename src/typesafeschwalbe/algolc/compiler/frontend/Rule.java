package typesafeschwalbe.algolc.compiler.frontend;

import java.util.function.Consumer;
import java.util.function.Predicate;

public class Rule {

    public final Attribute result;
    private final Attribute[] pattern;
    private final Attribute[] notFollowedBy;
    private final Attribute[] notPrecededBy;
    private final Predicate<Node> guard;
    private final Consumer<Node> action;

    private Rule(
        Attribute result, Attribute[] pattern, Attribute[] notFollowedBy,
        Attribute[] notPrecededBy, Predicate<Node> guard,
        Consumer<Node> action
    ) {
        this.result = result;
        this.pattern = pattern;
        this.notFollowedBy = notFollowedBy;
        this.notPrecededBy = notPrecededBy;
        this.guard = guard;
        this.action = action;
    }

    public static Rule of(Attribute result, Attribute... pattern) {
        if(pattern.length == 0) {
            throw new IllegalArgumentException("a rule needs a pattern!");
        }
        return new Rule(
            result, pattern, new Attribute[0], new Attribute[0], null, null
        );
    }

    public Rule unlessFollowedBy(Attribute... attributes) {
        return new Rule(
            this.result, this.pattern, attributes, this.notPrecededBy,
            this.guard, this.action
        );
    }

    public Rule unlessPrecededBy(Attribute... attributes) {
        return new Rule(
            this.result, this.pattern, this.notFollowedBy, attributes,
            this.guard, this.action
        );
    }

    public Rule when(Predicate<Node> guard) {
        return new Rule(
            this.result, this.pattern, this.notFollowedBy, this.notPrecededBy,
            guard, this.action
        );
    }

    public Rule then(Consumer<Node> action) {
        return new Rule(
            this.result, this.pattern, this.notFollowedBy, this.notPrecededBy,
            this.guard, action
        );
    }

    public static boolean matches(Attribute expected, Node node) {
        if(node == null) { return false; }
        switch(expected) {
            case WILDCARD:
                return true;
            case ENCLOSED_CLAUSE:
                return node.attribute().isEnclosedClause();
            default:
                return node.is(expected);
        }
    }

    private static boolean matchesAny(Attribute[] expected, Node node) {
        for(Attribute attribute: expected) {
            if(Rule.matches(attribute, node)) { return true; }
        }
        return false;
    }

    // Returns the last node of a match starting at first, or null
    // if the rule does not apply there.
    public Node match(Node first) {
        Node current = first;
        Node last = null;
        for(Attribute expected: this.pattern) {
            if(!Rule.matches(expected, current)) { return null; }
            last = current;
            current = current.next();
        }
        if(Rule.matchesAny(this.notFollowedBy, current)) { return null; }
        if(Rule.matchesAny(this.notPrecededBy, first.previous())) {
            return null;
        }
        if(this.guard != null && !this.guard.test(first)) { return null; }
        return last;
    }

    public void performAction(Node folded) {
        if(this.action != null) {
            this.action.accept(folded);
        }
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(this.result.toString());
        text.append(" <-");
        for(Attribute attribute: this.pattern) {
            text.append(' ').append(attribute);
        }
        return text.toString();
    }

}
