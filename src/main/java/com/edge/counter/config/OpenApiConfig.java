package com.edge.counter.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeCounterOpenAPI(YamlConfig config) {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Counter System API")
                        .description("""
                                门店多路摄像头员工/顾客计数 API 文档

                                ### 核心功能
                                - **摄像头管理**：按通道启动/停止 RTSP 摄像头
                                - **检测统计**：每路摄像头的员工/顾客人数、帧数、推理耗时
                                - **快照**：最近一次检测的标注图像（JPEG）

                                ### API 响应格式
                                控制类接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version(config.getSystem().getVersion())
                        .contact(new Contact()
                                .name("Edge Counter Team")));
    }

    /**
     * POST 接口统一补充 400 响应说明
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null && !pathItem.getPost().getResponses().containsKey("400")) {
                pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("channel is required")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
