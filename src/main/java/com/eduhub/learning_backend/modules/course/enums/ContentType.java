package com.eduhub.learning_backend.modules.course.enums;

/**
 * 可计量内容类型：PROGRAM（课程合集，归属 programs.instructor_id）/ MODULE（独立课时，归属 modules.teacher_id）。
 */
public enum ContentType {
    PROGRAM,
    MODULE;

    /**
     * 学习记录表中的内容键，保证 (student, period, content) 唯一。
     */
    public String contentKey(String contentId) {
        return name() + ":" + contentId;
    }
}
