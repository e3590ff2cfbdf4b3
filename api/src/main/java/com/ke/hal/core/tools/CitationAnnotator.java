package com.ke.hal.core.tools;

import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.message.MessageContent;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将回答中的 [n] 标记转换为指向检索结果的 file_citation
 */
public class CitationAnnotator {

    private static final Pattern MARKER = Pattern.compile("\\[(\\d{1,6})]");
    private static final int MAX_QUOTE_CHARS = 200;

    private CitationAnnotator() {
    }

    public static List<MessageContent.Annotation> annotate(String text, List<ToolCallDb> toolCalls) {
        List<MessageContent.Annotation> annotations = new ArrayList<>();
        if(StringUtils.isEmpty(text)) {
            return annotations;
        }
        Map<Integer, RetrievalOutput.Result> results = new HashMap<>();
        for (RetrievalOutput.Result result : RetrievalOutput.collect(toolCalls)) {
            results.putIfAbsent(result.getIndex(), result);
        }
        if(results.isEmpty()) {
            return annotations;
        }

        Matcher matcher = MARKER.matcher(text);
        while (matcher.find()) {
            RetrievalOutput.Result result = results.get(Integer.parseInt(matcher.group(1)));
            if(result == null) {
                continue;
            }
            MessageContent.FileCitation citation = new MessageContent.FileCitation();
            citation.setFileId(result.getFileId());
            citation.setQuote(StringUtils.abbreviate(result.getText(), MAX_QUOTE_CHARS));

            MessageContent.Annotation annotation = new MessageContent.Annotation();
            annotation.setText(matcher.group());
            annotation.setStartIndex(matcher.start());
            annotation.setEndIndex(matcher.end());
            annotation.setFileCitation(citation);
            annotations.add(annotation);
        }
        return annotations;
    }
}
