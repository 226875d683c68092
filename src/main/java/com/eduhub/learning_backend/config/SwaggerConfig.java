package com.eduhub.learning_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("EduHub 学习平台后端 API / EduHub Learning Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                订阅、学习行为与讲师收益分配接口 / Subscription, engagement and teacher revenue APIs.

                                统一返回结构 / Unified Response Envelope:
                                - code: 0 表示成功，其余与 HTTP 状态码一致 / 0 on success, otherwise the HTTP status.
                                - message: "ok" 或错误原因 / "ok" or the error reason.
                                - data: 业务数据 / payload.
                                - traceId: 链路追踪 ID / correlation id (X-Trace-Id).

                                收益分配 / Revenue distribution:
                                讲师份额 = 讲师观看时长 / 当期总观看时长 × 讲师池；讲师池 = 当期订阅收入 × (1 - 平台费率)。
                                Teacher share = teacher watch minutes / total watch minutes × teacher pool;
                                teacher pool = period subscription revenue × (1 - platform fee rate).
                                """
                        )
                        .contact(new Contact()
                                .name("EduHub Backend")
                                .email("backend@eduhub.dev")
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("在此处输入 JWT 访问令牌，格式为：Bearer {token}")
                        )
                );
    }
}
