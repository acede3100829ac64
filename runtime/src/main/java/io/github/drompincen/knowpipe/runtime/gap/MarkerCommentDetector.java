package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** TODO / FIXME / HACK / XXX markers in comments, or anywhere in Markdown. */
@Component
public class MarkerCommentDetector implements GapDetector {

    private static final Pattern IN_COMMENT = Pattern.compile(
            "(?://|#|/\\*|^\\s*\\*|<!--|--)\\s*(TODO|FIXME|HACK|XXX)\\b[:(\\s-]*(.*)");
    private static final Pattern IN_MARKDOWN = Pattern.compile("\\b(TODO|FIXME|HACK|XXX)\\b[:(\\s-]*(.*)");

    @Override
    public GapType gapType() {
        return GapType.INCONSISTENT;
    }

    @Override
    public boolean supports(SourceFile file) {
        return true;
    }

    @Override
    public List<KnowledgeGap> detect(SourceFile file, ScanContext context) {
        Pattern pattern = file.isMarkdown() ? IN_MARKDOWN : IN_COMMENT;
        List<KnowledgeGap> gaps = new ArrayList<>();
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = pattern.matcher(lines.get(i));
            if (!m.find()) continue;
            String text = m.group(2).replaceAll("\\*/\\s*$|-->\\s*$", "").trim();
            String description = m.group(1) + (text.isEmpty() ? "" : ": " + text);
            gaps.add(gap(file, context, i + 1, description, lines.get(i).trim()));
        }
        return gaps;
    }
}
