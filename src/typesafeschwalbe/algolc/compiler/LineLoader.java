package typesafeschwalbe.algolc.compiler;

import java.util.ArrayList;
import java.util.List;

public class LineLoader {

    public static List<SourceLine> load(String file, String content) {
        List<SourceLine> lines = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        int pendingNumber = -1;
        int pendingOffset = -1;
        int lineNumber = 1;
        int lineStart = 0;
        while(lineStart <= content.length()) {
            int end = content.indexOf('\n', lineStart);
            boolean last = end == -1;
            if(last) { end = content.length(); }
            String text = content.substring(lineStart, end);
            if(text.endsWith("\r")) {
                text = text.substring(0, text.length() - 1);
            }
            if(pendingNumber == -1) {
                pendingNumber = lineNumber;
                pendingOffset = lineStart;
            }
            if(text.endsWith("\\") && !last) {
                pending.append(text, 0, text.length() - 1);
            } else {
                pending.append(text);
                lines.add(new SourceLine(
                    pending.toString(), file, pendingNumber, pendingOffset
                ));
                pending.setLength(0);
                pendingNumber = -1;
            }
            if(last) { break; }
            lineStart = end + 1;
            lineNumber += 1;
        }
        return lines;
    }

    private LineLoader() {}

}
