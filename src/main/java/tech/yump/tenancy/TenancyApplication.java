package tech.yump.tenancy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.tenancy.config.TenancyProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(TenancyProperties.class)
public class TenancyApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenancyApplication.class, args);
    log.info(">>> Tenant Data Source Manager Started <<<");
  }
}
