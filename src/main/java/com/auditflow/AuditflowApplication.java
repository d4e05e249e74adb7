package com.auditflow;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Boots the audit engine as a non-web Spring context. Front ends obtain
 * {@link com.auditflow.core.engine.AuditService} from the context.
 */
@SpringBootApplication
public class AuditflowApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(AuditflowApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
