package com.eduhub.learning_backend.modules.course.dto;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import lombok.Data;

import java.io.Serializable;

@Data
public class ContentSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private ContentType contentType;
    private String title;
    private String thumbnailUrl;
}
