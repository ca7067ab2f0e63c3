package typesafeschwalbe.algolc.compiler.frontend;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class Keywords {

    private static final Map<String, Attribute> BOLD_WORDS = new HashMap<>();

    static {
        Keywords.add("BEGIN", Attribute.BEGIN_SYMBOL);
        Keywords.add("END", Attribute.END_SYMBOL);
        Keywords.add("IF", Attribute.IF_SYMBOL);
        Keywords.add("THEN", Attribute.THEN_SYMBOL);
        Keywords.add("ELIF", Attribute.ELIF_SYMBOL);
        Keywords.add("ELSE", Attribute.ELSE_SYMBOL);
        Keywords.add("FI", Attribute.FI_SYMBOL);
        Keywords.add("CASE", Attribute.CASE_SYMBOL);
        Keywords.add("IN", Attribute.IN_SYMBOL);
        Keywords.add("OUSE", Attribute.OUSE_SYMBOL);
        Keywords.add("OUT", Attribute.OUT_SYMBOL);
        Keywords.add("ESAC", Attribute.ESAC_SYMBOL);
        Keywords.add("FOR", Attribute.FOR_SYMBOL);
        Keywords.add("FROM", Attribute.FROM_SYMBOL);
        Keywords.add("BY", Attribute.BY_SYMBOL);
        Keywords.add("TO", Attribute.TO_SYMBOL);
        Keywords.add("DOWNTO", Attribute.DOWNTO_SYMBOL);
        Keywords.add("WHILE", Attribute.WHILE_SYMBOL);
        Keywords.add("DO", Attribute.DO_SYMBOL);
        Keywords.add("UNTIL", Attribute.UNTIL_SYMBOL);
        Keywords.add("OD", Attribute.OD_SYMBOL);
        Keywords.add("PAR", Attribute.PAR_SYMBOL);
        Keywords.add("ASSERT", Attribute.ASSERT_SYMBOL);
        Keywords.add("EXIT", Attribute.EXIT_SYMBOL);
        Keywords.add("GOTO", Attribute.GOTO_SYMBOL);
        Keywords.add("GO", Attribute.GO_SYMBOL);
        Keywords.add("LOC", Attribute.LOC_SYMBOL);
        Keywords.add("HEAP", Attribute.HEAP_SYMBOL);
        Keywords.add("REF", Attribute.REF_SYMBOL);
        Keywords.add("FLEX", Attribute.FLEX_SYMBOL);
        Keywords.add("PROC", Attribute.PROC_SYMBOL);
        Keywords.add("STRUCT", Attribute.STRUCT_SYMBOL);
        Keywords.add("UNION", Attribute.UNION_SYMBOL);
        Keywords.add("VOID", Attribute.VOID_SYMBOL);
        Keywords.add("OP", Attribute.OP_SYMBOL);
        Keywords.add("PRIO", Attribute.PRIO_SYMBOL);
        Keywords.add("MODE", Attribute.MODE_SYMBOL);
        Keywords.add("LONG", Attribute.LONG_SYMBOL);
        Keywords.add("SHORT", Attribute.SHORT_SYMBOL);
        Keywords.add("TRUE", Attribute.TRUE_SYMBOL);
        Keywords.add("FALSE", Attribute.FALSE_SYMBOL);
        Keywords.add("EMPTY", Attribute.EMPTY_SYMBOL);
        Keywords.add("NIL", Attribute.NIL_SYMBOL);
        Keywords.add("SKIP", Attribute.SKIP_SYMBOL);
        Keywords.add("OF", Attribute.OF_SYMBOL);
        Keywords.add("AT", Attribute.AT_SYMBOL);
        Keywords.add("IS", Attribute.IS_SYMBOL);
        Keywords.add("ISNT", Attribute.ISNT_SYMBOL);
        Keywords.add("ANDF", Attribute.ANDF_SYMBOL);
        Keywords.add("ANDTH", Attribute.ANDF_SYMBOL);
        Keywords.add("ORF", Attribute.ORF_SYMBOL);
        Keywords.add("OREL", Attribute.ORF_SYMBOL);
        Keywords.add("CODE", Attribute.CODE_SYMBOL);
        Keywords.add("EDOC", Attribute.EDOC_SYMBOL);
    }

    public static final Set<String> COMMENT_WORDS = Set.of("COMMENT", "CO");
    public static final Set<String> PRAGMAT_WORDS = Set.of("PRAGMAT", "PR");

    private static void add(String word, Attribute attribute) {
        Keywords.BOLD_WORDS.put(word, attribute);
    }

    public static Attribute classify(String boldWord) {
        return Keywords.BOLD_WORDS.getOrDefault(boldWord, Attribute.BOLD_TAG);
    }

    public static boolean isPragment(String boldWord) {
        return Keywords.COMMENT_WORDS.contains(boldWord)
            || Keywords.PRAGMAT_WORDS.contains(boldWord);
    }

    private Keywords() {}

}
