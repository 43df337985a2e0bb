package tech.yump.tenancy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.tenancy.audit.AuditBackend;
import tech.yump.tenancy.audit.AuditHelper;
import tech.yump.tenancy.audit.LogAuditBackend;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    public AuditHelper auditHelper(AuditBackend auditBackend) {
        return new AuditHelper(auditBackend);
    }
}
