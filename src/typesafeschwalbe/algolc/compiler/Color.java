package typesafeschwalbe.algolc.compiler;

public class Color {

    public static final String BOLD = "1";

    public static final String RED = "31";
    public static final String YELLOW = "33";
    public static final String GRAY = "90";

    public static String from(String... properties) {
        return "\033[0"
            + (properties.length > 0? ";" : "")
            + String.join(";", properties)
            + "m";
    }

    public static String paint(
        boolean colored, String text, String... properties
    ) {
        if(!colored) { return text; }
        return Color.from(properties) + text + Color.from();
    }

    private Color() {}

}
