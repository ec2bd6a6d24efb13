package tech.yump.rotator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.rotator.config.RotatorProperties;

@Slf4j
@SpringBootApplication(
        // Target databases are opened per operation; the service owns no primary DataSource.
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(RotatorProperties.class)
public class LiteRotatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteRotatorApplication.class, args);
    log.info(">>> LiteRotator Application Started <<<");
  }
}
