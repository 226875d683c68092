package com.eduhub.learning_backend.modules.course.mapper;

import com.eduhub.learning_backend.modules.course.dto.ContentSaleInfo;
import com.eduhub.learning_backend.modules.course.dto.ContentSummary;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.course.enums.MonetizationType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

/**
 * 只读访问课程目录（programs / modules）。目录本身的增删改由课程服务负责。
 */
@Mapper
public interface CourseContentMapper {

    Optional<ContentSaleInfo> selectSaleInfo(@Param("contentType") ContentType contentType,
                                             @Param("contentId") String contentId);

    MonetizationType selectMonetizationType(@Param("contentType") ContentType contentType,
                                            @Param("contentId") String contentId);

    /**
     * 订阅可见内容：已发布且 monetization_type = SUBSCRIPTION。
     */
    List<ContentSummary> selectSubscriptionContent();

    List<ContentSummary> selectSummaries(@Param("contentType") ContentType contentType,
                                         @Param("ids") List<String> ids);
}
