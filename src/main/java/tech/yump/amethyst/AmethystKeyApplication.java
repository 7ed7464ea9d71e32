package tech.yump.amethyst;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.amethyst.config.AmethystProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(AmethystProperties.class)
public class AmethystKeyApplication {

  public static void main(String[] args) {
    SpringApplication.run(AmethystKeyApplication.class, args);
    log.info(">>> AmethystKey Application Started <<<");
  }
}
