package com.eduhub.learning_backend.modules.course.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 单个内容的售卖信息（归属讲师与标价），用于直接售卖入账。
 */
@Data
public class ContentSaleInfo {
    private String contentId;
    private String teacherId;
    private String title;
    private BigDecimal price;
}
