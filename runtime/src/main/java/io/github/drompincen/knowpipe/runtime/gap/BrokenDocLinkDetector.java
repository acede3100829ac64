package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Relative Markdown links whose target file no longer exists. */
@Component
public class BrokenDocLinkDetector implements GapDetector {

    private static final Pattern LINK = Pattern.compile("\\[[^\\]]*\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+\"[^\"]*\")?\\s*\\)");
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    @Override
    public GapType gapType() {
        return GapType.ORPHANED;
    }

    @Override
    public boolean supports(SourceFile file) {
        return file.isMarkdown();
    }

    @Override
    public List<KnowledgeGap> detect(SourceFile file, ScanContext context) {
        List<KnowledgeGap> gaps = new ArrayList<>();
        List<String> lines = file.lines();
        Path dir = file.path().getParent();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = LINK.matcher(lines.get(i));
            while (m.find()) {
                String target = stripFragment(m.group(1));
                if (target.isEmpty() || SCHEME.matcher(target).find()) continue;
                if (!exists(context.root(), dir, target)) {
                    gaps.add(gap(file, context, i + 1, "broken link to " + target, lines.get(i).trim()));
                }
            }
        }
        return gaps;
    }

    private static String stripFragment(String target) {
        int cut = target.length();
        int hash = target.indexOf('#');
        int query = target.indexOf('?');
        if (hash >= 0) cut = Math.min(cut, hash);
        if (query >= 0) cut = Math.min(cut, query);
        return target.substring(0, cut);
    }

    private static boolean exists(Path root, Path dir, String target) {
        try {
            Path resolved = target.startsWith("/")
                    ? root.resolve(target.substring(1))
                    : dir.resolve(target);
            return Files.exists(resolved.normalize());
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
