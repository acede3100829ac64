package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Public declarations without an adjacent doc comment. Languages: Java, Kotlin, Rust,
 * TypeScript/JavaScript, Python, Go.
 */
@Component
public class UndocumentedApiDetector implements GapDetector {

    private record Declaration(Pattern pattern, String kind) {}

    private static final Map<String, List<Declaration>> DECLARATIONS = Map.of(
            "java", List.of(
                    new Declaration(Pattern.compile("^\\s*public\\s+(?:(?:static|final|abstract|sealed|non-sealed)\\s+)*(?:class|interface|enum|record|@interface)\\s+(\\w+)"), "type"),
                    new Declaration(Pattern.compile("^\\s*public\\s+(?:(?:static|final|synchronized|abstract|default)\\s+)*(?:<[^>]+>\\s+)?[\\w.<>\\[\\],? ]+\\s+(\\w+)\\s*\\("), "method")),
            "kt", List.of(
                    new Declaration(Pattern.compile("^\\s*(?:public\\s+)?(?:(?:data|sealed|abstract|open|enum)\\s+)*(?:class|interface|object)\\s+(\\w+)"), "type"),
                    new Declaration(Pattern.compile("^\\s*(?:public\\s+)?(?:(?:suspend|inline|override|open)\\s+)*fun\\s+(?:<[^>]+>\\s+)?(?:\\w+\\.)?(\\w+)\\s*\\("), "function")),
            "rs", List.of(
                    new Declaration(Pattern.compile("^\\s*pub\\s+(?:(?:async|const|unsafe)\\s+)*(?:struct|enum|trait|type|mod)\\s+(\\w+)"), "type"),
                    new Declaration(Pattern.compile("^\\s*pub\\s+(?:(?:async|const|unsafe)\\s+)*fn\\s+(\\w+)"), "function")),
            "ts", List.of(
                    new Declaration(Pattern.compile("^\\s*export\\s+(?:default\\s+)?(?:abstract\\s+)?(?:class|interface|type|enum)\\s+(\\w+)"), "type"),
                    new Declaration(Pattern.compile("^\\s*export\\s+(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)"), "function")),
            "js", List.of(
                    new Declaration(Pattern.compile("^\\s*export\\s+(?:default\\s+)?class\\s+(\\w+)"), "type"),
                    new Declaration(Pattern.compile("^\\s*export\\s+(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)"), "function")),
            "py", List.of(
                    new Declaration(Pattern.compile("^class\\s+([A-Za-z]\\w*)"), "type"),
                    new Declaration(Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z]\\w*)"), "function")),
            "go", List.of(
                    new Declaration(Pattern.compile("^type\\s+([A-Z]\\w*)"), "type"),
                    new Declaration(Pattern.compile("^func\\s+(?:\\([^)]*\\)\\s*)?([A-Z]\\w*)"), "function")));

    @Override
    public GapType gapType() {
        return GapType.MISSING;
    }

    @Override
    public boolean supports(SourceFile file) {
        return DECLARATIONS.containsKey(file.extension());
    }

    @Override
    public List<KnowledgeGap> detect(SourceFile file, ScanContext context) {
        List<Declaration> declarations = DECLARATIONS.get(file.extension());
        List<String> lines = file.lines();
        List<KnowledgeGap> gaps = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            for (Declaration d : declarations) {
                Matcher m = d.pattern().matcher(line);
                if (!m.find()) continue;
                if (!isDocumented(file.extension(), lines, i)) {
                    String description = "undocumented public " + d.kind() + " " + m.group(1);
                    gaps.add(gap(file, context, i + 1, description, line.trim()));
                }
                break;
            }
        }
        return gaps;
    }

    private boolean isDocumented(String extension, List<String> lines, int declarationIndex) {
        if ("py".equals(extension)) {
            for (int j = declarationIndex + 1; j < lines.size(); j++) {
                String next = lines.get(j).trim();
                if (next.isEmpty()) continue;
                return next.startsWith("\"\"\"") || next.startsWith("'''");
            }
            return false;
        }
        for (int j = declarationIndex - 1; j >= 0; j--) {
            String prev = lines.get(j).trim();
            if (prev.isEmpty()) return false;
            if (isAttribute(extension, prev)) continue;
            return switch (extension) {
                case "rs" -> prev.startsWith("///") || prev.startsWith("//!");
                case "go" -> prev.startsWith("//");
                default -> prev.endsWith("*/") || prev.startsWith("*") || prev.startsWith("/**");
            };
        }
        return false;
    }

    private boolean isAttribute(String extension, String line) {
        return switch (extension) {
            case "rs" -> line.startsWith("#[");
            case "java", "kt", "ts", "js" -> line.startsWith("@");
            default -> false;
        };
    }
}
