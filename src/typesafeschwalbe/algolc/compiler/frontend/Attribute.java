package typesafeschwalbe.algolc.compiler.frontend;

public enum Attribute {
    // terminals
    BOLD_TAG("a bold tag"),
    IDENTIFIER("an identifier"),
    OPERATOR("an operator"),
    EQUALS_SYMBOL("'='"),
    ALT_EQUALS_SYMBOL("'='"),
    INT_DENOTATION("an integral denotation"),
    REAL_DENOTATION("a real denotation"),
    BITS_DENOTATION("a bits denotation"),
    ROW_CHAR_DENOTATION("a string denotation"),
    TRUE_SYMBOL("TRUE"),
    FALSE_SYMBOL("FALSE"),
    EMPTY_SYMBOL("EMPTY"),
    NIL_SYMBOL("NIL"),
    SKIP_SYMBOL("SKIP"),
    LONG_SYMBOL("LONG"),
    SHORT_SYMBOL("SHORT"),
    COMMA_SYMBOL("','"),
    SEMICOLON_SYMBOL("';'"),
    COLON_SYMBOL("':'"),
    POINT_SYMBOL("'.'"),
    BECOMES_SYMBOL("':='"),
    IS_SYMBOL("':=:'"),
    ISNT_SYMBOL("':/=:'"),
    AT_SYMBOL("'@'"),
    OF_SYMBOL("OF"),
    LOC_SYMBOL("LOC"),
    HEAP_SYMBOL("HEAP"),
    REF_SYMBOL("REF"),
    FLEX_SYMBOL("FLEX"),
    PROC_SYMBOL("PROC"),
    STRUCT_SYMBOL("STRUCT"),
    UNION_SYMBOL("UNION"),
    VOID_SYMBOL("VOID"),
    OP_SYMBOL("OP"),
    PRIO_SYMBOL("PRIO"),
    MODE_SYMBOL("MODE"),
    GOTO_SYMBOL("GOTO"),
    GO_SYMBOL("GO"),
    ANDF_SYMBOL("ANDF"),
    ORF_SYMBOL("ORF"),
    PAR_SYMBOL("PAR"),
    ASSERT_SYMBOL("ASSERT"),
    EXIT_SYMBOL("EXIT"),
    BEGIN_SYMBOL("BEGIN"),
    END_SYMBOL("END"),
    OPEN_SYMBOL("'('"),
    CLOSE_SYMBOL("')'"),
    SUB_SYMBOL("'['"),
    BUS_SYMBOL("']'"),
    ACCO_SYMBOL("'{'"),
    OCCA_SYMBOL("'}'"),
    IF_SYMBOL("IF"),
    THEN_SYMBOL("THEN"),
    ELIF_SYMBOL("ELIF"),
    ELSE_SYMBOL("ELSE"),
    FI_SYMBOL("FI"),
    CASE_SYMBOL("CASE"),
    IN_SYMBOL("IN"),
    OUSE_SYMBOL("OUSE"),
    OUT_SYMBOL("OUT"),
    ESAC_SYMBOL("ESAC"),
    FOR_SYMBOL("FOR"),
    FROM_SYMBOL("FROM"),
    BY_SYMBOL("BY"),
    TO_SYMBOL("TO"),
    DOWNTO_SYMBOL("DOWNTO"),
    WHILE_SYMBOL("WHILE"),
    DO_SYMBOL("DO"),
    UNTIL_SYMBOL("UNTIL"),
    OD_SYMBOL("OD"),
    BAR_SYMBOL("'|'"),
    THEN_BAR_SYMBOL("'|'"),
    ELSE_BAR_SYMBOL("'|'"),
    BRIEF_ELIF_SYMBOL("'|:'"),
    FORMAT_DELIMITER_SYMBOL("'$'"),
    FORMAT_ITEM("a format item"),
    REPLICATOR("a replicator"),
    LITERAL("a format literal"),
    CODE_SYMBOL("CODE"),
    EDOC_SYMBOL("EDOC"),

    // declarers and their parts
    INDICANT("a mode indicant"),
    DEFINING_INDICANT("a defining indicant"),
    DEFINING_IDENTIFIER("a defining identifier"),
    DEFINING_OPERATOR("a defining operator"),
    DECLARER("a declarer"),
    BOUNDS("bounds"),
    BOUND("a bound"),
    PACK("a declarer pack"),
    FIELD("a field"),
    PARAMETER("a parameter"),
    PARAMETER_PACK("a parameter pack"),
    SPECIFIER("a specifier"),
    QUALIFIER("a qualifier"),
    PRIORITY("a priority"),

    // units
    DENOTATION("a denotation"),
    NIHIL("NIL"),
    SKIP("SKIP"),
    JUMP("a jump"),
    PRIMARY("a primary"),
    SECONDARY("a secondary"),
    TERTIARY("a tertiary"),
    UNIT("a unit"),
    CAST("a cast"),
    SLICE("a slice"),
    CALL("a call"),
    GENERIC_ARGUMENT("an argument or indexer"),
    TRIMMER("a trimmer"),
    FIELD_SELECTOR("a field selector"),
    SELECTION("a selection"),
    GENERATOR("a generator"),
    MONADIC_FORMULA("a monadic formula"),
    FORMULA("a formula"),
    IDENTITY_RELATION("an identity relation"),
    AND_FUNCTION("ANDF"),
    OR_FUNCTION("ORF"),
    ASSIGNATION("an assignation"),
    ROUTINE_TEXT("a routine text"),
    ASSERTION("an assertion"),
    FORMAT_TEXT("a format text"),

    // clauses
    CLOSED_CLAUSE("a closed clause"),
    COLLATERAL_CLAUSE("a collateral clause"),
    CONDITIONAL_CLAUSE("a conditional clause"),
    CASE_CLAUSE("a case clause"),
    CONFORMITY_CLAUSE("a conformity clause"),
    LOOP_CLAUSE("a loop clause"),
    PARALLEL_CLAUSE("a parallel clause"),
    CODE_CLAUSE("a code clause"),
    IF_PART("an if part"),
    THEN_PART("a then part"),
    ELSE_PART("an else part"),
    ELIF_PART("an elif part"),
    CASE_PART("a case part"),
    IN_PART("an in part"),
    OUT_PART("an out part"),
    OUSE_PART("an ouse part"),
    FOR_PART("a for part"),
    FROM_PART("a from part"),
    BY_PART("a by part"),
    TO_PART("a to part"),
    WHILE_PART("a while part"),
    DO_PART("a do part"),
    UNTIL_PART("an until part"),
    SERIAL_CLAUSE("a serial clause"),
    UNIT_LIST("a unit list"),
    SPECIFIED_UNIT("a specified unit"),
    SPECIFIED_UNIT_LIST("a list of specified units"),
    LABEL("a label"),
    LABELED_UNIT("a labeled unit"),

    // declarations
    MODE_DECLARATION("a mode declaration"),
    PRIORITY_DECLARATION("a priority declaration"),
    OPERATOR_DECLARATION("an operator declaration"),
    IDENTITY_DECLARATION("an identity declaration"),
    VARIABLE_DECLARATION("a variable declaration"),
    PROCEDURE_DECLARATION("a procedure declaration"),
    PROCEDURE_VARIABLE_DECLARATION("a procedure variable declaration"),
    DECLARATION_LIST("a declaration list"),

    // coercions
    DEREFERENCING("dereferencing"),
    DEPROCEDURING("deproceduring"),
    UNITING("uniting"),
    WIDENING("widening"),
    ROWING("rowing"),
    VOIDING("voiding"),
    PROCEDURING("proceduring"),

    PARTICULAR_PROGRAM("a particular program"),
    ERROR("an erroneous construct"),

    // matcher only
    ENCLOSED_CLAUSE("an enclosed clause"),
    WILDCARD("anything");

    public final String description;

    private Attribute(String description) {
        this.description = description;
    }

    public boolean isEnclosedClause() {
        switch(this) {
            case CLOSED_CLAUSE:
            case COLLATERAL_CLAUSE:
            case CONDITIONAL_CLAUSE:
            case CASE_CLAUSE:
            case CONFORMITY_CLAUSE:
            case LOOP_CLAUSE:
            case PARALLEL_CLAUSE:
            case CODE_CLAUSE:
                return true;
            default:
                return false;
        }
    }

    public boolean isCoercion() {
        switch(this) {
            case DEREFERENCING:
            case DEPROCEDURING:
            case UNITING:
            case WIDENING:
            case ROWING:
            case VOIDING:
            case PROCEDURING:
                return true;
            default:
                return false;
        }
    }

    public boolean isDeclaration() {
        switch(this) {
            case MODE_DECLARATION:
            case PRIORITY_DECLARATION:
            case OPERATOR_DECLARATION:
            case IDENTITY_DECLARATION:
            case VARIABLE_DECLARATION:
            case PROCEDURE_DECLARATION:
            case PROCEDURE_VARIABLE_DECLARATION:
                return true;
            default:
                return false;
        }
    }

    // Whether this category wraps exactly one child on the way from a
    // primary up to a unit.
    public boolean isWrapper() {
        switch(this) {
            case PRIMARY:
            case SECONDARY:
            case TERTIARY:
            case UNIT:
                return true;
            default:
                return false;
        }
    }
}
