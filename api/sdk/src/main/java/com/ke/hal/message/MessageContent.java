package com.ke.hal.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 消息内容片段，text 或 file 引用
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageContent {

    public static final String TEXT = "text";
    public static final String FILE = "file";

    private String type;

    private Text text;

    @JsonProperty("file_id")
    private String fileId;

    public static MessageContent text(String value) {
        return text(value, new ArrayList<>());
    }

    public static MessageContent text(String value, List<Annotation> annotations) {
        MessageContent content = new MessageContent();
        content.setType(TEXT);
        Text text = new Text();
        text.setValue(value);
        text.setAnnotations(annotations);
        content.setText(text);
        return content;
    }

    public static MessageContent file(String fileId) {
        MessageContent content = new MessageContent();
        content.setType(FILE);
        content.setFileId(fileId);
        return content;
    }

    @Data
    public static class Text {
        private String value;
        private List<Annotation> annotations = new ArrayList<>();
    }

    /**
     * 检索引用，指向回答中的一段文字
     */
    @Data
    public static class Annotation {
        private String type = "file_citation";
        private String text;
        @JsonProperty("start_index")
        private Integer startIndex;
        @JsonProperty("end_index")
        private Integer endIndex;
        @JsonProperty("file_citation")
        private FileCitation fileCitation;
    }

    @Data
    public static class FileCitation {
        @JsonProperty("file_id")
        private String fileId;
        private String quote;
    }
}
